package com.github.smeditor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans model notifications out to the registered listeners and keeps track of the structural
 * change in progress, if any. At most one structural change may be open at a time. A listener
 * failing in either half of the bracket leaves no change open behind it.
 */
final class ChangeNotifier {
  private final List<ItemModelListener> listeners = new CopyOnWriteArrayList<>();
  private StructuralChange openChange;

  void addListener(final ItemModelListener listener) {
    if (listener != null) {
      listeners.add(listener);
    }
  }

  void removeListener(final ItemModelListener listener) {
    listeners.remove(listener);
  }

  boolean inStructuralChange() {
    return openChange != null;
  }

  void begin(final StructuralChange change) {
    if (openChange != null) {
      throw new IllegalStateException(
          "Cannot begin " + change + " while " + openChange + " is still open");
    }
    openChange = change;
    try {
      for (final ItemModelListener listener : listeners) {
        switch (change.getType()) {
          case RESET:
            listener.modelAboutToBeReset();
            break;
          case REMOVE_ROWS:
            listener.rowsAboutToBeRemoved(change.getParent(), change.getFirst(),
                change.getLast());
            break;
          case INSERT_ROWS:
            listener.rowsAboutToBeInserted(change.getParent(), change.getFirst(),
                change.getLast());
            break;
          default:
            throw new IllegalStateException("Unhandled change type " + change.getType());
        }
      }
    } catch (RuntimeException problem) {
      // the change never opened, so nobody will close it
      openChange = null;
      throw problem;
    }
  }

  void end(final StructuralChange change) {
    if (openChange != change) {
      throw new IllegalStateException("Cannot end " + change + ", open change is " + openChange);
    }
    openChange = null;
    for (final ItemModelListener listener : listeners) {
      switch (change.getType()) {
        case RESET:
          listener.modelReset();
          break;
        case REMOVE_ROWS:
          listener.rowsRemoved(change.getParent(), change.getFirst(), change.getLast());
          break;
        case INSERT_ROWS:
          listener.rowsInserted(change.getParent(), change.getFirst(), change.getLast());
          break;
        default:
          throw new IllegalStateException("Unhandled change type " + change.getType());
      }
    }
  }

  void dataChanged(final ItemAddress address) {
    for (final ItemModelListener listener : listeners) {
      listener.dataChanged(address);
    }
  }
}
