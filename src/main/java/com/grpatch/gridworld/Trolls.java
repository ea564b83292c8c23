package com.grpatch.gridworld;

import static com.google.common.base.Preconditions.checkArgument;

import com.grpatch.model.Valuation;
import com.grpatch.spec.FormulaSlot;
import com.grpatch.spec.GrSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Specifications with trolls: adversarial obstacles moving inside square home regions.
 *
 * <p>Troll {@code k} is an environment agent with prefix {@code <prefix>_k} living in the subworld
 * around its center, and it must return to its center infinitely often. Only the controlled agent
 * and each troll are mutually exclusive; trolls may overlap each other.
 */
public final class Trolls {
  private static final Logger log = Logger.getLogger(Trolls.class.getName());

  /**
   * @param moves per troll, every state it can take in its home region; these are the independent
   *     move lists of a nonmetric patch neighborhood
   */
  public record TrollSpec(GrSpec spec, List<List<Valuation>> moves) {}

  private record Home(GridWorld world, Cell offset) {}

  private Trolls() {}

  /**
   * Joint specification of the controlled {@code world} and the given trolls.
   *
   * <p>Integer encoded trolls use coordinates relative to their home region. Boolean encoded
   * trolls name their cells by absolute world coordinates, e.g. {@code X_0_3_4}.
   *
   * @param startAnywhere whether a troll may start on any empty cell of its home region instead of
   *     its center
   */
  public static TrollSpec addTrolls(GridWorld world, List<MovingObstacleGridWorld.Troll> trolls, String prefix,
      boolean startAnywhere, boolean nonbool) {
    List<Home> homes = new ArrayList<>(trolls.size());
    List<List<Valuation>> moves = new ArrayList<>(trolls.size());
    for (MovingObstacleGridWorld.Troll troll : trolls) {
      Cell center = troll.center();
      checkArgument(world.inBounds(center), "Troll center %s is outside of the world", center);
      int radius = troll.radius();
      Cell offset = Cell.of(Math.max(0, center.row() - radius), Math.max(0, center.col() - radius));
      int rows = Math.min(center.row() - offset.row() + radius + 1, world.rows() - offset.row());
      int cols = Math.min(center.col() - offset.col() + radius + 1, world.cols() - offset.col());

      GridWorld home = world.dumpSubworld(rows, cols, offset, prefix + "_" + homes.size(), false);
      Cell localCenter = center.minus(offset);
      home.addGoal(localCenter);
      if (startAnywhere) {
        home.setInits(home.emptyCells());
      } else {
        home.addInit(localCenter);
      }
      homes.add(new Home(home, offset));

      Cell nameOffset = nonbool ? Cell.ORIGIN : offset;
      moves.add(home.emptyCells().stream()
          .filter(cell -> home.isReachable(localCenter, cell))
          .map(cell -> home.state(cell, nameOffset, nonbool))
          .toList());
      log.log(Level.FINE, () -> "Troll %s covers %dx%d cells at %s".formatted(home.prefix(), rows, cols, offset));
    }

    GrSpec spec = new GrSpec();
    spec.importGridWorld(world, Cell.ORIGIN, true, nonbool);
    for (Home home : homes) {
      spec.importGridWorld(home.world(), home.offset(), false, nonbool);
    }

    for (int i = 0; i < world.rows(); i++) {
      for (int j = 0; j < world.cols(); j++) {
        Cell cell = Cell.of(i, j);
        for (Home home : homes) {
          Cell local = cell.minus(home.offset());
          if (!home.world().inBounds(local)) {
            continue;
          }
          String trollCell = home.world().cellFormula(local, nonbool ? Cell.ORIGIN : home.offset(), true, nonbool);
          spec.add(FormulaSlot.SYS_SAFETY, "!(%s & %s)".formatted(world.cellFormula(cell, true, nonbool), trollCell));
        }
      }
    }
    return new TrollSpec(spec, moves);
  }
}
