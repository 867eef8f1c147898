package com.github.smeditor;

import java.util.List;

/**
 * An edge as handed over by the diagram reader. Endpoints are referenced by node id only.
 */
public final class GraphEdge {
  private final String id;
  private final String sourceId;
  private final String targetId;
  private final String body;
  private final TransitionGeometry geometry;

  public GraphEdge(final String id, final String sourceId, final String targetId,
      final String body, final Point sourceAnchor, final Point targetAnchor,
      final List<Point> routePoints) {
    this.id = id;
    this.sourceId = sourceId;
    this.targetId = targetId;
    this.body = body;
    this.geometry = new TransitionGeometry(sourceAnchor, targetAnchor, routePoints);
  }

  public String getId() {
    return id;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public String getBody() {
    return body;
  }

  public TransitionGeometry getGeometry() {
    return geometry;
  }

  @Override
  public String toString() {
    return "GraphEdge [id=" + id + ", sourceId=" + sourceId + ", targetId=" + targetId + "]";
  }
}
