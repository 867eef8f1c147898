package com.github.smeditor;

/**
 * A bracketed structural change of the model. Opening one fires the "about to" notification,
 * closing it fires the completion. Meant to be used with try-with-resources so the bracket is
 * closed on every exit path:
 *
 * <pre>
 * try (StructuralChange change = StructuralChange.removeRows(notifier, parent, row, row)) {
 *   parentItem.removeChild(item);
 * }
 * </pre>
 */
final class StructuralChange implements AutoCloseable {
  enum Type {
    RESET,
    REMOVE_ROWS,
    INSERT_ROWS;
  }

  private final ChangeNotifier notifier;
  private final Type type;
  private final ItemAddress parent;
  private final int first;
  private final int last;
  private boolean closed;

  private StructuralChange(final ChangeNotifier notifier, final Type type,
      final ItemAddress parent, final int first, final int last) {
    this.notifier = notifier;
    this.type = type;
    this.parent = parent;
    this.first = first;
    this.last = last;
    notifier.begin(this);
  }

  static StructuralChange reset(final ChangeNotifier notifier) {
    return new StructuralChange(notifier, Type.RESET, ItemAddress.INVALID, -1, -1);
  }

  static StructuralChange removeRows(final ChangeNotifier notifier, final ItemAddress parent,
      final int first, final int last) {
    return new StructuralChange(notifier, Type.REMOVE_ROWS, parent, first, last);
  }

  static StructuralChange insertRows(final ChangeNotifier notifier, final ItemAddress parent,
      final int first, final int last) {
    return new StructuralChange(notifier, Type.INSERT_ROWS, parent, first, last);
  }

  Type getType() {
    return type;
  }

  ItemAddress getParent() {
    return parent;
  }

  int getFirst() {
    return first;
  }

  int getLast() {
    return last;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      notifier.end(this);
    }
  }

  @Override
  public String toString() {
    return "StructuralChange [type=" + type + ", parent=" + parent + ", first=" + first
        + ", last=" + last + "]";
  }
}
