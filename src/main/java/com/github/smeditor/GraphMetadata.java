package com.github.smeditor;

/**
 * Document level metadata of a diagram: the machine's name and the format version.
 */
public final class GraphMetadata {
  private final String name;
  private final String formatVersion;

  public GraphMetadata(final String name, final String formatVersion) {
    this.name = name;
    this.formatVersion = formatVersion;
  }

  public String getName() {
    return name;
  }

  public String getFormatVersion() {
    return formatVersion;
  }

  @Override
  public String toString() {
    return "GraphMetadata [name=" + name + ", formatVersion=" + formatVersion + "]";
  }
}
