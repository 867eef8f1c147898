package com.github.smeditor;

/**
 * Receives the change notifications of a {@link StateMachineModel}. Notifications are delivered
 * synchronously, on the thread that changed the model. Every "about to" call is followed by its
 * matching completion call before any other structural notification.
 */
public interface ItemModelListener {

  default void modelAboutToBeReset() {}

  /**
   * Every address and item obtained before this call is stale.
   */
  default void modelReset() {}

  default void dataChanged(ItemAddress address) {}

  default void rowsAboutToBeRemoved(ItemAddress parent, int first, int last) {}

  default void rowsRemoved(ItemAddress parent, int first, int last) {}

  default void rowsAboutToBeInserted(ItemAddress parent, int first, int last) {}

  default void rowsInserted(ItemAddress parent, int first, int last) {}
}
