package com.github.smeditor;

/**
 * A (possibly composite) state. Nested states, initial states and comments are its children,
 * after the optional action item at row 0.
 */
public final class StateItem extends Item {
  private String title;
  private final Rect geometry;

  StateItem(final String id, final String title, final String action, final Rect geometry) {
    super(ItemKind.STATE, id);
    this.title = title;
    this.geometry = geometry;
    attachAction(action);
  }

  void rename(final String title) {
    this.title = title;
  }

  @Override
  public String getTitle() {
    return title;
  }

  /**
   * Trimmed behavior text, empty when the state has none.
   */
  public String getAction() {
    return actionText();
  }

  public Rect getGeometry() {
    return geometry;
  }
}
