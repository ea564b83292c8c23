package com.grpatch.incremental;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.grpatch.geometry.Polytope;
import com.grpatch.gridworld.Cell;
import com.grpatch.gridworld.GridWorld;
import com.grpatch.model.Automaton;
import com.grpatch.model.Domain;
import com.grpatch.model.Valuation;
import com.grpatch.solver.ChangeCommand;
import com.grpatch.solver.SynthesisEngine;
import com.grpatch.spec.GrSpec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Repairs a strategy after a local change of the problem by recomputing it on a neighborhood of the
 * change only. Every method returns empty if the patch is not realizable on that neighborhood, in
 * which case callers typically retry with a larger radius or synthesize from scratch.
 */
public final class LocalPatcher {
  private static final Logger log = Logger.getLogger(LocalPatcher.class.getName());
  public static final double DEFAULT_ABS_TOL = Polytope.ABS_TOL;

  private final SynthesisEngine engine;

  public LocalPatcher(SynthesisEngine engine) {
    this.engine = requireNonNull(engine);
  }

  /** Patched specification and strategy of a refinement. */
  public record Refinement(GrSpec spec, Automaton strategy) {}

  /**
   * Recomputes {@code strategy} on {@code neighborhood} after {@code changes}. An empty
   * neighborhood cannot be patched; without changes the strategy is returned as is.
   */
  public Optional<Automaton> patchLocalFixpoint(GrSpec spec, Automaton strategy, Collection<Valuation> neighborhood,
      List<ChangeCommand> changes) {
    if (neighborhood.isEmpty()) {
      log.log(Level.INFO, "Empty neighborhood, nothing to patch on");
      return Optional.empty();
    }
    if (changes.isEmpty()) {
      return Optional.of(strategy);
    }
    return engine.patchLocalFixpoint(spec, strategy, neighborhood, changes);
  }

  /**
   * Patches {@code strategy} for a grid world in which {@code blocked} has become unreachable.
   *
   * @param blocked may use negative indices counted from the far end
   * @param nonmetric move lists of independent parts of the state, see {@link Neighborhoods#discrete}
   */
  public Optional<Automaton> unreachableCellDiscrete(GrSpec spec, Automaton strategy, GridWorld world, Cell blocked,
      int radius, List<List<Valuation>> nonmetric, boolean nonbool) {
    List<Valuation> neighborhood = Neighborhoods.discrete(world, blocked, radius, nonmetric, nonbool);
    log.log(Level.FINE, () -> "Blocking %s with %d neighborhood states".formatted(blocked, neighborhood.size()));
    Valuation blockedState = world.state(blocked, Cell.ORIGIN, nonbool);
    return patchLocalFixpoint(spec, strategy, neighborhood, List.of(ChangeCommand.blockSys(blockedState)));
  }

  /**
   * Patches {@code strategy} after the region {@code blocked} of a boolean encoded partition has
   * become unreachable.
   *
   * @param regions polytope of every region, keyed by the variable of the region
   */
  public Optional<Automaton> unreachableCell(GrSpec spec, Automaton strategy, Map<String, Polytope> regions,
      String blocked, double radius, double absTol, boolean nonbool) {
    checkArgument(!nonbool, "Only boolean encoded partitions are supported");
    List<Valuation> neighborhood = Neighborhoods.inflated(regions, blocked, radius, absTol);
    Valuation blockedState = Valuation.zeros(regions.keySet()).with(blocked, 1);
    return patchLocalFixpoint(spec, strategy, neighborhood, List.of(ChangeCommand.blockSys(blockedState)));
  }

  public Optional<Automaton> unreachableCell(GrSpec spec, Automaton strategy, Map<String, Polytope> regions,
      String blocked, double radius) {
    return unreachableCell(spec, strategy, regions, blocked, radius, DEFAULT_ABS_TOL, false);
  }

  /**
   * Patches {@code strategy} after splitting regions. {@code spec} already describes the refined
   * partition and {@code strategy} does not know the new regions yet. The refined regions are
   * declared for the duration of the patch and blocked, forcing the strategy onto the new regions.
   * The arguments are left unchanged.
   *
   * @param regions partition before refinement
   * @param refinements new parts of each refined region
   */
  public Optional<Refinement> refineCells(GrSpec spec, Automaton strategy, Map<String, Polytope> regions,
      Map<String, List<SubRegion>> refinements, double radius, double absTol, boolean nonbool) {
    checkArgument(!nonbool, "Only boolean encoded partitions are supported");
    for (String refined : refinements.keySet()) {
      checkArgument(regions.containsKey(refined), "Unknown region %s", refined);
    }

    GrSpec extended = spec.copy();
    for (String refined : refinements.keySet()) {
      extended.addSysVariable(refined, Domain.BOOLEAN);
    }
    Set<String> newNames = new LinkedHashSet<>();
    Map<String, Polytope> allRegions = new LinkedHashMap<>(regions);
    refinements.values().forEach(parts -> parts.forEach(part -> {
      newNames.add(part.name());
      allRegions.put(part.name(), part.polytope());
      extended.addSysVariable(part.name(), Domain.BOOLEAN);
    }));

    Automaton extendedStrategy = strategy.copy();
    extendedStrategy.updateStates(state -> state.withDefaults(newNames, 0));

    Valuation base = Valuation.zeros(allRegions.keySet());
    List<Valuation> neighborhood = new ArrayList<>();
    List<ChangeCommand> changes = new ArrayList<>();
    for (String refined : refinements.keySet()) {
      neighborhood.addAll(Neighborhoods.inflated(allRegions, allRegions.get(refined).inflate(radius), absTol));
      changes.add(ChangeCommand.blockSys(base.with(refined, 1)));
    }

    return patchLocalFixpoint(extended, extendedStrategy, neighborhood, changes).map(patched -> {
      patched.updateStates(state -> state.without(refinements.keySet()));
      refinements.keySet().forEach(extended::removeVariable);
      log.log(Level.INFO, () -> "Refined %s into %s".formatted(refinements.keySet(), newNames));
      return new Refinement(extended, patched);
    });
  }

  public Optional<Refinement> refineCells(GrSpec spec, Automaton strategy, Map<String, Polytope> regions,
      Map<String, List<SubRegion>> refinements, double radius) {
    return refineCells(spec, strategy, regions, refinements, radius, DEFAULT_ABS_TOL, false);
  }
}
