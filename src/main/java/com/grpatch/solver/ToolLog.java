package com.grpatch.solver;

import java.util.List;

/** Logging requested from gr1c. Verbose logging writes to disk frequently and slows gr1c down. */
public enum ToolLog {
  NONE(List.of()),
  LOG(List.of("-l")),
  VERBOSE(List.of("-l", "-vv"));

  private final List<String> flags;

  ToolLog(List<String> flags) {
    this.flags = flags;
  }

  public List<String> flags() {
    return flags;
  }

  /** The reachability game solver knows no verbose mode. */
  public List<String> reachGameFlags() {
    return this == NONE ? List.of() : List.of("-l");
  }

  public boolean enabled() {
    return this != NONE;
  }
}
