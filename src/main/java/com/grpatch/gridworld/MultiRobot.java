package com.grpatch.gridworld;

import static com.google.common.base.Preconditions.checkArgument;

import com.grpatch.spec.FormulaSlot;
import com.grpatch.spec.GrSpec;
import java.util.ArrayList;
import java.util.List;

/** Several controlled robots sharing one grid world. */
public final class MultiRobot {
  private MultiRobot() {}

  /** Prefix of robot {@code n} in a world with prefix {@code prefix}. */
  public static String robotPrefix(String prefix, int n) {
    return prefix + "_" + n;
  }

  /**
   * One copy of the world specification per robot, each with its own cell variables, such that no
   * two robots occupy the same empty cell, initially or in any later step. With {@code goalSequence}
   * every robot has its own goal counter {@code goal_<n>}.
   */
  public static GrSpec compose(GridWorld world, int robots, boolean goalSequence, boolean nonbool) {
    checkArgument(robots > 0, "At least one robot required, got %s", robots);
    List<GridWorld> instances = new ArrayList<>(robots);
    GrSpec spec = new GrSpec();
    for (int n = 0; n < robots; n++) {
      GridWorld instance = world.copy();
      instance.setPrefix(robotPrefix(world.prefix(), n));
      instances.add(instance);
      spec.importSpec(goalSequence
          ? instance.sequencedSpec(Cell.ORIGIN, true, nonbool, "goal_" + n)
          : instance.spec(Cell.ORIGIN, true, nonbool));
    }

    for (Cell cell : world.emptyCells()) {
      for (int n = 0; n < robots; n++) {
        for (int m = n + 1; m < robots; m++) {
          GridWorld first = instances.get(n);
          GridWorld second = instances.get(m);
          spec.add(FormulaSlot.SYS_INIT, "!(%s & %s)".formatted(
              first.cellFormula(cell, false, nonbool), second.cellFormula(cell, false, nonbool)));
          spec.add(FormulaSlot.SYS_SAFETY, "!(%s & %s)".formatted(
              first.cellFormula(cell, true, nonbool), second.cellFormula(cell, true, nonbool)));
        }
      }
    }
    return spec;
  }
}
