package com.github.smeditor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat graph of a diagram as produced by the external reader: metadata, a forest of nodes and
 * the list of edges in document order.
 */
public final class Graph {
  private final GraphMetadata metadata;
  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;

  public Graph(final GraphMetadata metadata, final List<GraphNode> nodes,
      final List<GraphEdge> edges) {
    this.metadata = metadata;
    this.nodes = nodes == null ? null : Collections.unmodifiableList(new ArrayList<>(nodes));
    this.edges = edges == null ? null : Collections.unmodifiableList(new ArrayList<>(edges));
  }

  public GraphMetadata getMetadata() {
    return metadata;
  }

  public List<GraphNode> getNodes() {
    return nodes;
  }

  public List<GraphEdge> getEdges() {
    return edges;
  }

  @Override
  public String toString() {
    return "Graph [metadata=" + metadata + ", nodes=" + (nodes == null ? null : nodes.size())
        + ", edges=" + (edges == null ? null : edges.size()) + "]";
  }
}
