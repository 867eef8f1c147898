package com.github.smeditor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node as handed over by the diagram reader, with its nested nodes. Initial nodes only use
 * the position of their rectangle.
 */
public final class GraphNode {
  private final String id;
  private final GraphNodeType type;
  private final String title;
  private final String body;
  private final Rect rect;
  private final List<GraphNode> children = new ArrayList<>();

  public GraphNode(final String id, final GraphNodeType type, final String title,
      final String body, final Rect rect) {
    this.id = id;
    this.type = type;
    this.title = title;
    this.body = body;
    this.rect = rect;
  }

  public static GraphNode state(final String id, final String title, final String body,
      final Rect rect) {
    return new GraphNode(id, GraphNodeType.STATE, title, body, rect);
  }

  public static GraphNode initial(final String id, final Point position) {
    return new GraphNode(id, GraphNodeType.INITIAL, "", "",
        Rect.of(position.getX(), position.getY(), 0, 0));
  }

  public static GraphNode comment(final String id, final String body, final Rect rect) {
    return new GraphNode(id, GraphNodeType.COMMENT, "", body, rect);
  }

  public GraphNode child(final GraphNode child) {
    children.add(child);
    return this;
  }

  public String getId() {
    return id;
  }

  public GraphNodeType getType() {
    return type;
  }

  public String getTitle() {
    return title;
  }

  public String getBody() {
    return body;
  }

  public Rect getRect() {
    return rect;
  }

  public List<GraphNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public String toString() {
    return "GraphNode [id=" + id + ", type=" + type + ", title=" + title + ", children="
        + children.size() + "]";
  }
}
