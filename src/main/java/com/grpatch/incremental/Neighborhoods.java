package com.grpatch.incremental;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Lists;
import com.grpatch.geometry.Polytope;
import com.grpatch.gridworld.Cell;
import com.grpatch.gridworld.GridWorld;
import com.grpatch.model.Valuation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Sets of states around a changed part of the state space, on which a strategy is recomputed. */
public final class Neighborhoods {
  private static final Logger log = Logger.getLogger(Neighborhoods.class.getName());

  private Neighborhoods() {}

  /**
   * States of the agent in every cell within Chebyshev distance {@code radius} of {@code blocked},
   * clipped to the world, combined with every choice of one move from each list in {@code nonmetric}.
   *
   * @param nonmetric possible partial states of variables without a distance, e.g. obstacle positions
   */
  public static List<Valuation> discrete(GridWorld world, Cell blocked, int radius,
      List<List<Valuation>> nonmetric, boolean nonbool) {
    checkArgument(radius >= 0, "Negative radius %s", radius);
    Cell center = world.resolve(blocked);

    List<Valuation> cells = new ArrayList<>();
    for (int i = center.row() - radius; i <= center.row() + radius; i++) {
      if (i < 0 || i >= world.rows()) {
        continue;
      }
      for (int j = center.col() - radius; j <= center.col() + radius; j++) {
        if (j < 0 || j >= world.cols()) {
          continue;
        }
        cells.add(world.state(Cell.of(i, j), Cell.ORIGIN, nonbool));
      }
    }
    if (nonmetric.isEmpty()) {
      return cells;
    }

    List<List<Valuation>> factors = new ArrayList<>(nonmetric.size() + 1);
    factors.add(cells);
    factors.addAll(nonmetric);
    List<Valuation> product = new ArrayList<>();
    for (List<Valuation> combination : Lists.cartesianProduct(factors)) {
      Valuation state = combination.get(0);
      for (Valuation move : combination.subList(1, combination.size())) {
        state = state.withAll(move);
      }
      product.add(state);
    }
    return product;
  }

  /**
   * One state per region that intersects the polytope of {@code blocked}, inflated by
   * {@code radius}, in more than {@code absTol} volume. States assign 1 to the variable of that
   * region and 0 to every other region variable.
   */
  public static List<Valuation> inflated(Map<String, Polytope> regions, String blocked, double radius,
      double absTol) {
    Polytope region = regions.get(blocked);
    checkArgument(region != null, "Unknown region %s", blocked);
    return inflated(regions, region.inflate(radius), absTol);
  }

  static List<Valuation> inflated(Map<String, Polytope> regions, Polytope inflated, double absTol) {
    Valuation base = Valuation.zeros(regions.keySet());
    List<Valuation> neighborhood = new ArrayList<>();
    for (Map.Entry<String, Polytope> entry : regions.entrySet()) {
      if (inflated.intersect(entry.getValue()).volume() > absTol) {
        log.log(Level.FINE, () -> "Including cell \"%s\" in the neighborhood".formatted(entry.getKey()));
        neighborhood.add(base.with(entry.getKey(), 1));
      }
    }
    return neighborhood;
  }
}
