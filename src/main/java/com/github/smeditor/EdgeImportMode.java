package com.github.smeditor;

/**
 * This represents the mode used by the importer when binding transitions to their endpoints.
 */
public enum EdgeImportMode {
  // resolve every edge endpoint first and only create transitions if all of them resolve
  VALIDATE_THEN_APPLY,
  // create transitions in source order and give up on the rest at the first unresolved edge,
  // keeping the transitions created so far
  STOP_AT_FIRST_UNRESOLVED;
}
