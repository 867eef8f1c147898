package com.github.smeditor;

/**
 * Behavior text of a state or a transition, shown as its first child.
 */
public final class ActionItem extends Item {
  private String text;

  ActionItem(final String text) {
    super(ItemKind.ACTION, null);
    this.text = text;
  }

  // empty text is fine here, unlike state titles
  void rename(final String text) {
    this.text = text == null ? "" : text;
  }

  @Override
  public String getTitle() {
    return text;
  }
}
