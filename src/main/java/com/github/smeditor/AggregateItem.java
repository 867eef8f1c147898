package com.github.smeditor;

/**
 * Structural grouping node, either the states or the transitions aggregate.
 */
final class AggregateItem extends Item {
  private final String title;

  AggregateItem(final ItemKind kind, final String title) {
    super(kind, null);
    if (kind != ItemKind.STATES_AGGREGATE && kind != ItemKind.TRANSITIONS_AGGREGATE) {
      throw new IllegalArgumentException("Not an aggregate kind: " + kind);
    }
    this.title = title;
  }

  @Override
  public String getTitle() {
    return title;
  }
}
