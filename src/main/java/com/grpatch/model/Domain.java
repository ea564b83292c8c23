package com.grpatch.model;

import static com.google.common.base.Preconditions.checkArgument;

/** Value domain of a specification variable: boolean, or an inclusive integer range. */
public record Domain(boolean bool, int low, int high) {
  public static final Domain BOOLEAN = new Domain(true, 0, 1);

  public Domain {
    checkArgument(low <= high, "Empty domain [%s,%s]", low, high);
    checkArgument(!bool || (low == 0 && high == 1), "Boolean domain must be [0,1]");
  }

  public static Domain range(int low, int high) {
    return new Domain(false, low, high);
  }

  public boolean contains(int value) {
    return low <= value && value <= high;
  }

  /** Declaration suffix in gr1c syntax, empty for booleans. */
  public String toGr1c() {
    return bool ? "" : " [%d,%d]".formatted(low, high);
  }

  @Override
  public String toString() {
    return bool ? "boolean" : "[%d,%d]".formatted(low, high);
  }
}
