package com.grpatch.gridworld;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/** Generators of grid worlds. */
public final class RandomWorlds {
  private static final Logger log = Logger.getLogger(RandomWorlds.class.getName());

  public enum Status {
    GENERATED, INFEASIBLE, TIMED_OUT
  }

  /** Result of {@link #randomWorld}; the world is present iff the status is {@code GENERATED}. */
  public record Outcome(Status status, @Nullable GridWorld world) {
    public GridWorld requireWorld() {
      if (world == null) {
        throw new IllegalStateException("No world was generated: " + status);
      }
      return world;
    }
  }

  /**
   * Parameters of a random world.
   *
   * @param wallDensity fraction of cells to turn into walls, rounded to the nearest count
   * @param ensureFeasible keep the initial and goal cells mutually reachable
   * @param timeout bound on the search for a feasible world, none if null
   * @param trolls number of radius 1 trolls; if positive a {@link MovingObstacleGridWorld} is made
   */
  public record Settings(int rows, int cols, double wallDensity, int inits, int goals, String prefix,
                         boolean ensureFeasible, @Nullable Duration timeout, int trolls) {
    public Settings {
      checkArgument(rows > 0 && cols > 0, "Invalid grid size %sx%s", rows, cols);
      checkArgument(0 <= wallDensity && wallDensity <= 1, "Invalid wall density %s", wallDensity);
      checkArgument(inits >= 0 && goals >= 0 && trolls >= 0, "Negative feature count");
    }

    public static Settings of(int rows, int cols, double wallDensity) {
      return new Settings(rows, cols, wallDensity, 1, 2, GridWorld.DEFAULT_PREFIX, false, null, 0);
    }

    public Settings withFeatures(int inits, int goals, int trolls) {
      return new Settings(rows, cols, wallDensity, inits, goals, prefix, ensureFeasible, timeout, trolls);
    }

    public Settings withFeasibility(@Nullable Duration timeout) {
      return new Settings(rows, cols, wallDensity, inits, goals, prefix, true, timeout, trolls);
    }

    public Settings withPrefix(String prefix) {
      return new Settings(rows, cols, wallDensity, inits, goals, prefix, ensureFeasible, timeout, trolls);
    }
  }

  private RandomWorlds() {}

  public static GridWorld unoccupied(int rows, int cols, String prefix) {
    return new GridWorld(rows, cols, prefix);
  }

  /**
   * Goals, initial cells and troll centers are placed first on distinct cells. Walls are then added
   * one at a time on random free cells. With feasibility requested, a wall that breaks the cyclic
   * chain of reachability through all initial and goal cells is removed again; since more walls
   * never restore reachability, such a cell is not tried again.
   */
  public static Outcome randomWorld(Settings settings, Random random) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    GridWorld world = unoccupied(settings.rows(), settings.cols(), settings.prefix());
    List<Cell> free = new ArrayList<>(world.emptyCells());
    int features = settings.goals() + settings.inits() + settings.trolls();
    checkArgument(features <= free.size(), "%s features do not fit into %s cells", features, free.size());

    List<Cell> goals = draw(free, settings.goals(), random);
    List<Cell> inits = draw(free, settings.inits(), random);
    List<Cell> trolls = draw(free, settings.trolls(), random);
    world.setGoals(goals);
    world.setInits(inits);
    List<Cell> chain = new ArrayList<>(inits);
    chain.addAll(goals);

    long walls = Math.round(Math.rint(settings.wallDensity() * settings.rows() * settings.cols()));
    Set<Cell> rejected = new HashSet<>();
    int placed = 0;
    while (placed < walls) {
      if (free.isEmpty()) {
        log.log(Level.FINE, "No cell left for walls after placing %d of %d".formatted(placed, walls));
        return new Outcome(Status.INFEASIBLE, null);
      }
      if (settings.timeout() != null && stopwatch.elapsed().compareTo(settings.timeout()) > 0) {
        return new Outcome(Status.TIMED_OUT, null);
      }
      Cell candidate = free.remove(random.nextInt(free.size()));
      world.setOccupied(candidate);
      if (settings.ensureFeasible() && !isChainReachable(world, chain)) {
        world.setEmpty(candidate);
        rejected.add(candidate);
        continue;
      }
      placed++;
    }
    log.log(Level.FINE, () -> "Placed %d walls in %s, rejected %d".formatted(walls, stopwatch, rejected.size()));

    if (settings.trolls() == 0) {
      return new Outcome(Status.GENERATED, world);
    }
    return new Outcome(Status.GENERATED, new MovingObstacleGridWorld(world,
        trolls.stream().map(center -> new MovingObstacleGridWorld.Troll(center, 1)).toList()));
  }

  private static List<Cell> draw(List<Cell> free, int count, Random random) {
    List<Cell> drawn = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      drawn.add(free.remove(random.nextInt(free.size())));
    }
    return drawn;
  }

  private static boolean isChainReachable(GridWorld world, List<Cell> chain) {
    for (int i = 0; i < chain.size(); i++) {
      if (!world.isReachable(chain.get(i), chain.get((i + 1) % chain.size()))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Two open zones joined by a horizontal passage. Initial cells are drawn from the left zone and
   * goals from the right zone.
   *
   * @param passageLength length of the passage as a fraction of the width
   * @param passageTop first row of the passage, random if null
   */
  public static GridWorld narrowPassage(int rows, int cols, int passageWidth, int inits, int goals,
      double passageLength, @Nullable Integer passageTop, String prefix, Random random) {
    checkArgument(rows >= 3 && cols >= 3, "Grid world too small: minimum dimension 3");
    checkArgument(0 < passageWidth && passageWidth <= rows, "Invalid passage width %s", passageWidth);
    GridWorld world = unoccupied(rows, cols, prefix);
    int zoneWidth = Math.max(1, (int) ((1.0 - passageLength) / 2.0 * cols));
    int initZone = zoneWidth;
    int goalZone = cols - zoneWidth;
    checkArgument(initZone * rows >= inits && (cols - goalZone) * rows >= goals,
        "Too many initial or goal cells for grid size");

    int top = passageTop == null ? random.nextInt(rows - passageWidth + 1) : passageTop;
    checkArgument(0 <= top && top + passageWidth <= rows, "Passage at row %s does not fit", top);
    for (int row = 0; row < rows; row++) {
      if (top <= row && row < top + passageWidth) {
        continue;
      }
      for (int col = initZone; col < goalZone; col++) {
        world.setOccupied(Cell.of(row, col));
      }
    }

    world.setInits(sample(world, 0, initZone, inits, random));
    world.setGoals(sample(world, goalZone, cols, goals, random));
    return world;
  }

  private static List<Cell> sample(GridWorld world, int fromCol, int toCol, int count, Random random) {
    List<Cell> zone = new ArrayList<>();
    for (int row = 0; row < world.rows(); row++) {
      for (int col = fromCol; col < toCol; col++) {
        zone.add(Cell.of(row, col));
      }
    }
    Collections.shuffle(zone, random);
    return zone.subList(0, count);
  }
}
