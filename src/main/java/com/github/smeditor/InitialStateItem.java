package com.github.smeditor;

/**
 * Pseudo-state marking where a region starts. It only has a position, no size.
 */
public final class InitialStateItem extends Item {
  static final String TITLE = "Initial";

  private final Point position;

  InitialStateItem(final String id, final Point position) {
    super(ItemKind.INITIAL_STATE, id);
    this.position = position;
  }

  public Point getPosition() {
    return position;
  }

  @Override
  public String getTitle() {
    return TITLE;
  }
}
