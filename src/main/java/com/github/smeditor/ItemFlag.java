package com.github.smeditor;

/**
 * Capabilities a view may offer on an address.
 */
public enum ItemFlag {
  ENABLED,
  SELECTABLE,
  EDITABLE,
  DRAG_ENABLED,
  DROP_ENABLED;
}
