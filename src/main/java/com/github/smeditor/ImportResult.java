package com.github.smeditor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of loading a graph into the model.
 *
 * Successes are encoded with {@link #isSuccessful()} being true. Failures report false and carry
 * the associated {@link #getError()}: an import failure means the model is empty, an unresolved
 * endpoint means the states were imported but the transitions are incomplete (see
 * {@link EdgeImportMode}). Warnings are informational, eg. ids that had to be renamed because
 * they collided with an already registered one.
 */
public final class ImportResult {
  private final boolean successful;
  private final String description;
  private final ModelException error;
  private final int states;
  private final int initialStates;
  private final int comments;
  private final int transitions;
  private final List<String> warnings;

  private ImportResult(final Builder builder, final boolean successful, final String description,
      final ModelException error) {
    this.successful = successful;
    this.description = description;
    this.error = error;
    this.states = builder.states;
    this.initialStates = builder.initialStates;
    this.comments = builder.comments;
    this.transitions = builder.transitions;
    this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
  }

  public boolean isSuccessful() {
    return successful;
  }

  public String getDescription() {
    return description;
  }

  public ModelException getError() {
    return error;
  }

  public int getStates() {
    return states;
  }

  public int getInitialStates() {
    return initialStates;
  }

  public int getComments() {
    return comments;
  }

  public int getTransitions() {
    return transitions;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  @Override
  public String toString() {
    return "ImportResult [successful=" + successful + ", description=" + description + ", error="
        + error + ", states=" + states + ", initialStates=" + initialStates + ", comments="
        + comments + ", transitions=" + transitions + ", warnings=" + warnings + "]";
  }

  /**
   * Running tally kept by the importer while it walks the graph.
   */
  static final class Builder {
    int states;
    int initialStates;
    int comments;
    int transitions;
    final List<String> warnings = new ArrayList<>();

    void warn(final String warning) {
      warnings.add(warning);
    }

    ImportResult success(final String description) {
      return new ImportResult(this, true, description, null);
    }

    ImportResult failure(final ModelException error) {
      return new ImportResult(this, false, error.getMessage(), error);
    }
  }
}
