package com.grpatch.gridworld;

import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/** Paths of agents through a grid world, as read off a boolean encoded strategy. */
public final class GridPaths {
  private static final Logger log = Logger.getLogger(GridPaths.class.getName());

  private GridPaths() {}

  /**
   * Follows the first successor from node 0 until a node repeats or a dead end is reached, and
   * collects the cells of the agent with the given prefix (any agent if null). Steps where the agent
   * is nowhere repeat its last cell; leading such steps take its first known cell.
   */
  public static List<Cell> extractPath(Automaton automaton, @Nullable String prefix) {
    List<Cell> path = new ArrayList<>();
    if (!automaton.contains(0)) {
      return path;
    }
    IntSet visited = new IntOpenHashSet();
    visited.add(0);
    AutomatonNode node = automaton.node(0);
    Cell last = null;
    while (true) {
      boolean moved = false;
      for (Map.Entry<String, Integer> entry : node.state().asMap().entrySet()) {
        if (entry.getValue() == 0) {
          continue;
        }
        Optional<CellNames.CellCoordinate> coordinate = CellNames.extractCoord(entry.getKey(), false);
        if (coordinate.isPresent() && (prefix == null || coordinate.get().prefix().equals(prefix))) {
          last = coordinate.get().cell();
          path.add(last);
          moved = true;
        }
      }
      if (!moved) {
        path.add(last);
      }
      if (node.successors().isEmpty()) {
        break;
      }
      int next = node.successors().iterator().nextInt();
      if (!visited.add(next)) {
        break;
      }
      node = automaton.node(next);
    }

    Optional<Cell> first = path.stream().filter(Objects::nonNull).findFirst();
    if (first.isEmpty()) {
      return List.of();
    }
    for (int i = 0; i < path.size() && path.get(i) == null; i++) {
      path.set(i, first.get());
    }
    return path;
  }

  /**
   * Whether the path visits every goal of the world, in list order if {@code sequenced}, and never
   * enters a wall.
   */
  public static boolean verifyPath(GridWorld world, List<Cell> path, boolean sequenced) {
    List<Cell> goals = new ArrayList<>(world.goals());
    if (sequenced) {
      for (Cell cell : path) {
        if (goals.isEmpty()) {
          break;
        }
        if (goals.get(0).equals(cell)) {
          goals.remove(0);
        } else if (goals.contains(cell)) {
          log.log(Level.FINE, () -> "Path visits goal %s out of order".formatted(cell));
          return false;
        }
      }
      if (!goals.isEmpty()) {
        log.log(Level.FINE, () -> "Path misses goals %s".formatted(goals));
        return false;
      }
    } else {
      for (Cell goal : goals) {
        if (!path.contains(goal)) {
          log.log(Level.FINE, () -> "Path does not visit goal " + goal);
          return false;
        }
      }
    }
    for (Cell cell : path) {
      if (!world.isEmpty(cell)) {
        log.log(Level.FINE, () -> "Path intersects obstacle at " + cell);
        return false;
      }
    }
    return true;
  }

  /** Whether the paths have equal length and never put two agents on one cell at the same step. */
  public static boolean verifyMutex(List<List<Cell>> paths) {
    if (paths.isEmpty()) {
      return true;
    }
    int length = paths.get(0).size();
    if (paths.stream().anyMatch(path -> path.size() != length)) {
      log.log(Level.FINE, "Paths are of different lengths");
      return false;
    }
    for (int step = 0; step < length; step++) {
      HashSet<Cell> cells = new HashSet<>();
      for (List<Cell> path : paths) {
        if (!cells.add(path.get(step))) {
          int collision = step;
          log.log(Level.FINE, () -> "Agents collide at step %d in %s".formatted(collision, path.get(collision)));
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Drops every step after which no agent moves, except for the last step.
   *
   * @param paths paths of equal length, one per agent
   */
  public static List<List<Cell>> compressPaths(List<List<Cell>> paths) {
    if (paths.isEmpty() || paths.get(0).isEmpty()) {
      return List.of();
    }
    int length = paths.get(0).size();
    List<List<Cell>> compressed = new ArrayList<>(paths.size());
    paths.forEach(path -> compressed.add(new ArrayList<>()));
    for (int step = 0; step < length; step++) {
      int current = step;
      boolean last = step == length - 1;
      if (last || paths.stream().anyMatch(path -> !path.get(current).equals(path.get(current + 1)))) {
        for (int i = 0; i < paths.size(); i++) {
          compressed.get(i).add(paths.get(i).get(step));
        }
      }
    }
    return compressed;
  }
}
