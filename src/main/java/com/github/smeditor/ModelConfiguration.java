package com.github.smeditor;

/**
 * This class encapsulates all the configuration parameters for the StateMachineModel. Use the
 * {@code ModelConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If the edge import mode is not set, edges are validated before any transition is created.
 * <br>
 * 2. Titles, the collision suffix and the generated id prefix fall back to their defaults when
 * left unset. The suffix and prefix cannot be blank since the registry relies on them to make
 * progress.<br>
 */
public final class ModelConfiguration {
  public static final String DEFAULT_EMPTY_STATE_TITLE = "<Untitled>";
  public static final String DEFAULT_MACHINE_NAME = "State Machine";
  public static final String DEFAULT_ID_COLLISION_SUFFIX = "_";
  public static final String DEFAULT_GENERATED_ID_PREFIX = "id-";

  private final EdgeImportMode edgeImportMode;
  private final String emptyStateTitle;
  private final String defaultMachineName;
  private final String idCollisionSuffix;
  private final String generatedIdPrefix;

  public EdgeImportMode getEdgeImportMode() {
    return edgeImportMode;
  }

  public String getEmptyStateTitle() {
    return emptyStateTitle;
  }

  public String getDefaultMachineName() {
    return defaultMachineName;
  }

  public String getIdCollisionSuffix() {
    return idCollisionSuffix;
  }

  public String getGeneratedIdPrefix() {
    return generatedIdPrefix;
  }

  /**
   * Configuration with every parameter at its default.
   */
  public static ModelConfiguration defaults() {
    return new ModelConfiguration(null, null, null, null, null);
  }

  public final static class ModelConfigurationBuilder {
    private EdgeImportMode edgeImportMode;
    private String emptyStateTitle;
    private String defaultMachineName;
    private String idCollisionSuffix;
    private String generatedIdPrefix;

    public static ModelConfigurationBuilder newBuilder() {
      return new ModelConfigurationBuilder();
    }

    public ModelConfigurationBuilder edgeImportMode(final EdgeImportMode edgeImportMode) {
      this.edgeImportMode = edgeImportMode;
      return this;
    }

    public ModelConfigurationBuilder emptyStateTitle(final String emptyStateTitle) {
      this.emptyStateTitle = emptyStateTitle;
      return this;
    }

    public ModelConfigurationBuilder defaultMachineName(final String defaultMachineName) {
      this.defaultMachineName = defaultMachineName;
      return this;
    }

    public ModelConfigurationBuilder idCollisionSuffix(final String idCollisionSuffix) {
      this.idCollisionSuffix = idCollisionSuffix;
      return this;
    }

    public ModelConfigurationBuilder generatedIdPrefix(final String generatedIdPrefix) {
      this.generatedIdPrefix = generatedIdPrefix;
      return this;
    }

    public ModelConfiguration build() throws ModelException {
      final ModelConfiguration config = new ModelConfiguration(edgeImportMode, emptyStateTitle,
          defaultMachineName, idCollisionSuffix, generatedIdPrefix);
      config.validate();
      return config;
    }

    private ModelConfigurationBuilder() {}
  }

  private void validate() throws ModelException {
    StringBuilder messages = new StringBuilder();
    if (idCollisionSuffix.trim().isEmpty()) {
      messages.append("Id collision suffix cannot be blank. ");
    }
    if (generatedIdPrefix.trim().isEmpty()) {
      messages.append("Generated id prefix cannot be blank. ");
    }
    if (defaultMachineName.isEmpty()) {
      messages.append("Default machine name cannot be empty. ");
    }
    if (messages.length() > 0) {
      throw new ModelException(ModelException.Code.INVALID_MODEL_CONFIG, messages.toString());
    }
  }

  @Override
  public String toString() {
    return "ModelConfiguration [edgeImportMode=" + edgeImportMode + ", emptyStateTitle="
        + emptyStateTitle + ", defaultMachineName=" + defaultMachineName
        + ", idCollisionSuffix=" + idCollisionSuffix + ", generatedIdPrefix=" + generatedIdPrefix
        + "]";
  }

  private ModelConfiguration(final EdgeImportMode edgeImportMode, final String emptyStateTitle,
      final String defaultMachineName, final String idCollisionSuffix,
      final String generatedIdPrefix) {
    this.edgeImportMode =
        edgeImportMode == null ? EdgeImportMode.VALIDATE_THEN_APPLY : edgeImportMode;
    this.emptyStateTitle = emptyStateTitle == null ? DEFAULT_EMPTY_STATE_TITLE : emptyStateTitle;
    this.defaultMachineName =
        defaultMachineName == null ? DEFAULT_MACHINE_NAME : defaultMachineName;
    this.idCollisionSuffix =
        idCollisionSuffix == null ? DEFAULT_ID_COLLISION_SUFFIX : idCollisionSuffix;
    this.generatedIdPrefix =
        generatedIdPrefix == null ? DEFAULT_GENERATED_ID_PREFIX : generatedIdPrefix;
  }

}
