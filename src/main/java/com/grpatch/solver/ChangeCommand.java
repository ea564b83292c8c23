package com.grpatch.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.grpatch.model.Valuation;
import com.grpatch.spec.GrSpec;
import java.util.Arrays;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * An edit of the game graph understood by the patching mode of gr1c.
 *
 * <p>{@code blocksys} forbids the system to enter a state, given by the system variables of
 * {@code state}. {@code restrict} and {@code relax} remove respectively add the edge from the
 * full state {@code state} to {@code target}, which assigns the environment variables and, if it
 * covers them too, the system variables.
 */
public record ChangeCommand(Kind kind, Valuation state, @Nullable Valuation target) {
  public enum Kind {
    BLOCK_SYS("blocksys"), RESTRICT("restrict"), RELAX("relax");

    private final String keyword;

    Kind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  public ChangeCommand {
    requireNonNull(kind);
    requireNonNull(state);
    checkArgument((kind == Kind.BLOCK_SYS) == (target == null), "%s takes %s", kind.keyword(),
        kind == Kind.BLOCK_SYS ? "one state" : "two states");
  }

  public static ChangeCommand blockSys(Valuation state) {
    return new ChangeCommand(Kind.BLOCK_SYS, state, null);
  }

  public static ChangeCommand restrict(Valuation from, Valuation to) {
    return new ChangeCommand(Kind.RESTRICT, from, to);
  }

  public static ChangeCommand relax(Valuation from, Valuation to) {
    return new ChangeCommand(Kind.RELAX, from, to);
  }

  /** The change file line of this command. */
  public String toLine(GrSpec spec) {
    if (target == null) {
      return kind.keyword() + " " + vector(state.toVector(spec.sysVariables()));
    }
    String targetVector = vector(target.toVector(spec.envVariables()));
    if (spec.sysVariables().stream().allMatch(target::contains) && !spec.sysVariables().isEmpty()) {
      targetVector += " " + vector(target.toVector(spec.sysVariables()));
    }
    return "%s %s %s".formatted(kind.keyword(), vector(state.toVector(spec.variables())), targetVector);
  }

  static String vector(int[] values) {
    return Arrays.stream(values).mapToObj(Integer::toString).collect(Collectors.joining(" "));
  }
}
