package com.grpatch.solver;

import static java.util.Objects.requireNonNull;

import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Settings of a gr1c engine instance.
 *
 * @param binary gr1c executable, looked up on the path unless absolute
 * @param prompt prompt printed by an interactive gr1c session
 * @param workDirectory directory for change and specification files; a fresh temporary directory
 *     per call if null
 * @param keepFiles keep the files written for a call instead of deleting them afterwards
 */
public record EngineConfig(String binary, ToolLog toolLog, String prompt, @Nullable Path workDirectory,
                           boolean keepFiles) {
  public static final String BINARY_VARIABLE = "GR1C_BIN";
  public static final String DEFAULT_BINARY = "gr1c";
  public static final String DEFAULT_PROMPT = ">>> ";

  public EngineConfig {
    requireNonNull(binary, "binary");
    requireNonNull(toolLog, "toolLog");
    requireNonNull(prompt, "prompt");
  }

  /** Binary from {@code GR1C_BIN} if set, logging enabled, temporary files removed. */
  public static EngineConfig defaults() {
    String binary = System.getenv(BINARY_VARIABLE);
    return new EngineConfig(binary == null || binary.isBlank() ? DEFAULT_BINARY : binary, ToolLog.LOG,
        DEFAULT_PROMPT, null, false);
  }

  public EngineConfig withBinary(String binary) {
    return new EngineConfig(binary, toolLog, prompt, workDirectory, keepFiles);
  }

  public EngineConfig withToolLog(ToolLog toolLog) {
    return new EngineConfig(binary, toolLog, prompt, workDirectory, keepFiles);
  }

  public EngineConfig withPrompt(String prompt) {
    return new EngineConfig(binary, toolLog, prompt, workDirectory, keepFiles);
  }

  public EngineConfig withWorkDirectory(@Nullable Path workDirectory, boolean keepFiles) {
    return new EngineConfig(binary, toolLog, prompt, workDirectory, keepFiles);
  }
}
