package com.github.smeditor;

/**
 * The closed set of item kinds that make up the editor tree.
 */
public enum ItemKind {
  // invisible root of the whole tree
  ROOT,
  // the state machine itself, sole child of ROOT
  STATE_MACHINE_ROOT,
  // groups all states, initial states and comments
  STATES_AGGREGATE,
  // groups all transitions
  TRANSITIONS_AGGREGATE,
  STATE,
  INITIAL_STATE,
  COMMENT,
  TRANSITION,
  // behavior text attached to a state or a transition
  ACTION;

  /**
   * Addressable items carry an id that is unique within the identifier registry.
   */
  public boolean isAddressable() {
    switch (this) {
      case STATE_MACHINE_ROOT:
      case STATE:
      case INITIAL_STATE:
      case COMMENT:
      case TRANSITION:
        return true;
      case ROOT:
      case STATES_AGGREGATE:
      case TRANSITIONS_AGGREGATE:
      case ACTION:
        return false;
      default:
        throw new IllegalStateException("Unhandled item kind " + this);
    }
  }

  /**
   * Kinds that can be picked up and moved around the states subtree.
   */
  public boolean isDraggable() {
    return this == STATE || this == INITIAL_STATE;
  }
}
