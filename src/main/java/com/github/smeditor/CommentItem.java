package com.github.smeditor;

/**
 * Free floating note. The body is kept exactly as written, whitespace included.
 */
public final class CommentItem extends Item {
  private final String body;
  private final Rect geometry;

  CommentItem(final String id, final String body, final Rect geometry) {
    super(ItemKind.COMMENT, id);
    this.body = body == null ? "" : body;
    this.geometry = geometry;
  }

  public String getBody() {
    return body;
  }

  public Rect getGeometry() {
    return geometry;
  }

  @Override
  public String getTitle() {
    return body;
  }
}
