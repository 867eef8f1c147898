package com.github.smeditor;

import java.io.IOException;

/**
 * Hook for the diagram reader. Implementations parse whatever on-disk format they support and
 * hand back the flat graph.
 */
public interface GraphSource {

  Graph read() throws IOException;
}
