package com.grpatch.solver;

import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import com.grpatch.spec.GrSpec;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A GR(1) synthesis tool. Unrealizable specifications and tool failures both yield an empty result,
 * so callers can retry with other parameters or fall back to full synthesis.
 */
public interface SynthesisEngine {
  /** Whether the text is a syntactically correct specification. */
  boolean checkSyntax(String specification);

  boolean checkRealizable(GrSpec spec);

  Optional<Automaton> synthesize(GrSpec spec);

  /** Strategy for the reachability game of a specification with at most one system goal. */
  Optional<Automaton> synthesizeReachGame(GrSpec spec);

  /**
   * Patches {@code strategy} after the edits in {@code changes} by recomputing it locally on the
   * states in {@code neighborhood}. Both collections are expected to be nonempty.
   */
  Optional<Automaton> patchLocalFixpoint(GrSpec spec, Automaton strategy, Collection<Valuation> neighborhood,
      List<ChangeCommand> changes);

  /**
   * Patches {@code strategy} for an additional system goal.
   *
   * @param spec the specification without the new goal
   * @param metricVariables variables whose values are treated as euclidean coordinates
   */
  Optional<Automaton> addSysGoal(GrSpec spec, Automaton strategy, String goal, List<String> metricVariables);

  /** Patches {@code strategy} after removing the system goal with the given index. */
  Optional<Automaton> removeSysGoal(GrSpec spec, Automaton strategy, int index);
}
