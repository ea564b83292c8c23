package com.grpatch.execution;

import static java.util.Objects.requireNonNull;

import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import com.grpatch.model.Valuation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Runs a strategy against a sequence of environment moves. Before the first step the position is
 * unknown and every node agreeing with the move is a candidate.
 */
public final class StrategyExecutor {
  private static final Logger log = Logger.getLogger(StrategyExecutor.class.getName());

  private final Automaton strategy;
  @Nullable
  private final Random random;
  @Nullable
  private AutomatonNode current = null;

  /** Executor which always takes the first matching successor. */
  public StrategyExecutor(Automaton strategy) {
    this(strategy, null);
  }

  /** @param random source of choices between matching successors, or null to take the first */
  public StrategyExecutor(Automaton strategy, @Nullable Random random) {
    this.strategy = requireNonNull(strategy);
    this.random = random;
  }

  public Optional<AutomatonNode> current() {
    return Optional.ofNullable(current);
  }

  /** Starts from the given node instead of an unknown position. */
  public void reset(int nodeId) {
    current = strategy.node(nodeId);
  }

  public void reset() {
    current = null;
  }

  /**
   * Moves to a successor of the current node that agrees with {@code envMove}. Returns empty, and
   * stays in place, if the strategy has no such successor.
   */
  public Optional<AutomatonNode> step(Valuation envMove) {
    Optional<AutomatonNode> next = random == null
        ? strategy.findNextState(current, envMove, true)
        : strategy.findNextState(current, envMove, random);
    if (next.isEmpty()) {
      log.log(Level.FINE, () -> "No successor of %s for %s".formatted(
          current == null ? "initial position" : "node " + current.id(), envMove));
      return next;
    }
    current = next.get();
    return next;
  }

  /**
   * Steps through at most {@code steps} moves of {@code envMoves}, returning the ids of the visited
   * nodes. Stops early if the strategy cannot follow a move.
   */
  public List<Integer> rollout(int steps, List<Valuation> envMoves) {
    List<Integer> visited = new ArrayList<>();
    for (int i = 0; i < steps && i < envMoves.size(); i++) {
      Optional<AutomatonNode> next = step(envMoves.get(i));
      if (next.isEmpty()) {
        break;
      }
      visited.add(next.get().id());
    }
    return visited;
  }
}
