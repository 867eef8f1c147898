package com.github.smeditor;

/**
 * Unified single exception that's thrown and handled by the editor model. The code enum
 * encapsulates the various failure conditions; stack traces, where available, are kept.
 */
public final class ModelException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public ModelException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public ModelException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public ModelException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    IMPORT_FAILURE("Failed to read the state machine graph. The model was left empty."),
    // 2.
    UNRESOLVED_ENDPOINT("Transition references a source or target id that is not registered"),
    // 3.
    INVALID_MOVE("Move rejected, the item or the target parent cannot take part in a move"),
    // 4.
    INVALID_ID("Identifier cannot be null or empty"),
    // 5.
    INVALID_PAYLOAD("Drag payload is malformed or carries an unsupported type"),
    // 6.
    INVALID_MODEL_CONFIG("Model configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
