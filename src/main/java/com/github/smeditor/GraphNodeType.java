package com.github.smeditor;

/**
 * Node type tags as they come from the diagram reader.
 */
public enum GraphNodeType {
  STATE,
  INITIAL,
  COMMENT;
}
