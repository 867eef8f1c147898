package com.github.smeditor;

/**
 * What the view asks the model to do with a dropped payload.
 */
public enum DropAction {
  // nothing to do, the drop was cancelled
  IGNORE,
  // reparent the dragged items, the only action the model supports
  MOVE,
  COPY;
}
