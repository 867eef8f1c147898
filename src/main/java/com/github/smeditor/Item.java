package com.github.smeditor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the editor tree. Children are owned and kept in display order; the parent is a
 * plain back reference that is never used to manage lifetime.
 *
 * The set of subclasses is closed: constructors are package-private and every concrete kind
 * lives in this package.
 */
public abstract class Item {
  private final ItemKind kind;
  private String id;
  private Item parent;
  private final List<Item> children = new ArrayList<>();

  Item(final ItemKind kind, final String id) {
    this.kind = kind;
    this.id = id;
  }

  public ItemKind getKind() {
    return kind;
  }

  /**
   * Id of the item, null for the structural items that are not addressable.
   */
  public String getId() {
    return id;
  }

  void setId(final String id) {
    this.id = id;
  }

  public abstract String getTitle();

  public int childCount() {
    return children.size();
  }

  /**
   * Returns the child at the given row or null when the row is out of bounds.
   */
  public Item child(final int row) {
    if (row < 0 || row >= children.size()) {
      return null;
    }
    return children.get(row);
  }

  /**
   * Position of this item within its parent's children, 0 for a detached item.
   */
  public int row() {
    if (parent == null) {
      return 0;
    }
    return parent.children.indexOf(this);
  }

  public Item parent() {
    return parent;
  }

  public boolean isRoot() {
    return kind == ItemKind.ROOT;
  }

  public List<Item> getChildren() {
    return Collections.unmodifiableList(children);
  }

  void addChild(final Item item) {
    insertChild(children.size(), item);
  }

  void insertChild(final int row, final Item item) {
    if (item.parent != null) {
      throw new IllegalStateException("Item " + item + " is still attached to " + item.parent);
    }
    children.add(row, item);
    item.parent = this;
  }

  /**
   * Detaches the child without destroying it. Returns false if it's not a child of this item.
   */
  boolean removeChild(final Item item) {
    if (item == null || item.parent != this) {
      return false;
    }
    children.remove(item.row());
    item.parent = null;
    return true;
  }

  /**
   * True if this item is a strict ancestor of the given one.
   */
  public boolean isAncestorOf(final Item item) {
    for (Item current = item == null ? null : item.parent; current != null;
        current = current.parent) {
      if (current == this) {
        return true;
      }
    }
    return false;
  }

  // body text lives in an ACTION child at row 0
  String actionText() {
    final Item first = child(0);
    if (first != null && first.getKind() == ItemKind.ACTION) {
      return first.getTitle();
    }
    return "";
  }

  void attachAction(final String action) {
    if (action != null && !action.isEmpty()) {
      insertChild(0, new ActionItem(action));
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [kind=" + kind + ", id=" + id + ", title=" + getTitle()
        + ", children=" + children.size() + "]";
  }
}
