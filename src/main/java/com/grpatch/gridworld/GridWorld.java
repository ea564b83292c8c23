package com.grpatch.gridworld;

import static com.google.common.base.Preconditions.checkArgument;

import com.grpatch.geometry.Polytope;
import com.grpatch.model.Domain;
import com.grpatch.model.Partition;
import com.grpatch.model.Region;
import com.grpatch.model.Valuation;
import com.grpatch.parser.GridWorldParser;
import com.grpatch.spec.FormulaSlot;
import com.grpatch.spec.GrSpec;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Four-connected grid of empty and statically occupied cells, with possible initial cells and goal
 * cells.
 *
 * <p>Cell arguments may use negative indices, which wrap around once: {@code (-1, -1)} is the
 * bottom-right cell.
 */
public class GridWorld {
  public static final String DEFAULT_PREFIX = "Y";

  private static final Cell[] DIRECTIONS = {Cell.of(-1, 0), Cell.of(0, -1), Cell.of(1, 0), Cell.of(0, 1)};

  private final boolean[][] occupied;
  private final List<Cell> inits = new ArrayList<>();
  private final List<Cell> goals = new ArrayList<>();
  private String prefix;

  public GridWorld(int rows, int cols, String prefix) {
    checkArgument(rows > 0 && cols > 0, "Invalid grid size %sx%s", rows, cols);
    this.occupied = new boolean[rows][cols];
    this.prefix = prefix;
  }

  public static GridWorld load(String description) {
    return load(description, DEFAULT_PREFIX);
  }

  public static GridWorld load(String description, String prefix) {
    return GridWorldParser.parse(description, prefix);
  }

  public GridWorld copy() {
    GridWorld copy = new GridWorld(rows(), cols(), prefix);
    copyInto(copy);
    return copy;
  }

  void copyInto(GridWorld target) {
    for (int i = 0; i < rows(); i++) {
      System.arraycopy(occupied[i], 0, target.occupied[i], 0, cols());
    }
    target.inits.addAll(inits);
    target.goals.addAll(goals);
  }

  public int rows() {
    return occupied.length;
  }

  public int cols() {
    return occupied[0].length;
  }

  public String prefix() {
    return prefix;
  }

  public void setPrefix(String prefix) {
    this.prefix = prefix;
  }

  public List<Cell> inits() {
    return List.copyOf(inits);
  }

  public List<Cell> goals() {
    return List.copyOf(goals);
  }

  public void addInit(Cell cell) {
    Cell resolved = resolve(cell);
    checkArgument(!occupied[resolved.row()][resolved.col()], "Initial cell %s is occupied", resolved);
    inits.add(resolved);
  }

  public void addGoal(Cell cell) {
    Cell resolved = resolve(cell);
    checkArgument(!occupied[resolved.row()][resolved.col()], "Goal cell %s is occupied", resolved);
    goals.add(resolved);
  }

  public void setInits(List<Cell> cells) {
    inits.clear();
    cells.forEach(this::addInit);
  }

  public void setGoals(List<Cell> cells) {
    goals.clear();
    cells.forEach(this::addGoal);
  }

  /**
   * Canonical non-negative form of {@code cell}.
   *
   * @throws IllegalArgumentException if the cell lies outside the grid even after wrapping
   */
  public Cell resolve(Cell cell) {
    int row = cell.row();
    int col = cell.col();
    checkArgument(-rows() <= row && row < rows() && -cols() <= col && col < cols(),
        "Cell %s is out of bounds of %sx%s grid", cell, rows(), cols());
    return Cell.of(row < 0 ? rows() + row : row, col < 0 ? cols() + col : col);
  }

  public boolean inBounds(Cell cell) {
    return 0 <= cell.row() && cell.row() < rows() && 0 <= cell.col() && cell.col() < cols();
  }

  public boolean isEmpty(Cell cell) {
    Cell resolved = resolve(cell);
    return !occupied[resolved.row()][resolved.col()];
  }

  /** With {@code extend}, indices do not wrap and every cell outside the grid counts as occupied. */
  public boolean isEmpty(Cell cell, boolean extend) {
    if (extend && !inBounds(cell)) {
      return false;
    }
    return isEmpty(cell);
  }

  public void setOccupied(Cell cell) {
    Cell resolved = resolve(cell);
    occupied[resolved.row()][resolved.col()] = true;
  }

  public void setEmpty(Cell cell) {
    Cell resolved = resolve(cell);
    occupied[resolved.row()][resolved.col()] = false;
  }

  public int occupiedCount() {
    int count = 0;
    for (boolean[] row : occupied) {
      for (boolean cell : row) {
        if (cell) {
          count++;
        }
      }
    }
    return count;
  }

  /** All empty cells in row-major order. */
  public List<Cell> emptyCells() {
    List<Cell> cells = new ArrayList<>();
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        if (!occupied[i][j]) {
          cells.add(Cell.of(i, j));
        }
      }
    }
    return cells;
  }

  private List<Cell> emptyNeighbours(Cell cell) {
    List<Cell> neighbours = new ArrayList<>(4);
    for (Cell direction : DIRECTIONS) {
      Cell neighbour = cell.plus(direction);
      if (inBounds(neighbour) && !occupied[neighbour.row()][neighbour.col()]) {
        neighbours.add(neighbour);
      }
    }
    return neighbours;
  }

  /** Whether a four-connected path of empty cells joins the two cells. */
  public boolean isReachable(Cell start, Cell stop) {
    Cell source = resolve(start);
    Cell target = resolve(stop);
    if (!isEmpty(source) || !isEmpty(target)) {
      return false;
    }
    Set<Cell> visited = new HashSet<>(List.of(source));
    Deque<Cell> open = new ArrayDeque<>(List.of(source));
    while (!open.isEmpty()) {
      Cell current = open.pop();
      if (current.equals(target)) {
        return true;
      }
      for (Cell neighbour : emptyNeighbours(current)) {
        if (visited.add(neighbour)) {
          open.push(neighbour);
        }
      }
    }
    return false;
  }

  // Naming

  /**
   * The gr1c subformula identifying a cell. Integer encoding: {@code ((Y_r = R) & (Y_c = C))};
   * boolean encoding: the variable {@code Y_R_C}. The offset is added to the coordinates.
   */
  public String cellFormula(Cell cell, Cell offset, boolean next, boolean nonbool) {
    Cell shifted = resolve(cell).plus(offset);
    String prime = next ? "'" : "";
    if (nonbool) {
      return "((%s_r%s = %d) & (%s_c%s = %d))".formatted(prefix, prime, shifted.row(), prefix, prime, shifted.col());
    }
    return "%s_%d_%d%s".formatted(prefix, shifted.row(), shifted.col(), prime);
  }

  public String cellFormula(Cell cell, boolean next, boolean nonbool) {
    return cellFormula(cell, Cell.ORIGIN, next, nonbool);
  }

  /** Name of the boolean variable of a cell. */
  public String variableName(Cell cell, Cell offset) {
    return cellFormula(cell, offset, false, false);
  }

  /** Valuation of the cell variables when the agent occupies {@code cell}. */
  public Valuation state(Cell cell, Cell offset, boolean nonbool) {
    Cell resolved = resolve(cell);
    Valuation.Builder builder = Valuation.builder();
    if (nonbool) {
      return builder.put(prefix + "_r", resolved.row() + offset.row())
          .put(prefix + "_c", resolved.col() + offset.col())
          .build();
    }
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        builder.put(variableName(Cell.of(i, j), offset), 0);
      }
    }
    return builder.put(variableName(resolved, offset), 1).build();
  }

  // Specifications

  /**
   * Specification of an agent moving through this world. Integer encoded worlds ignore the offset.
   *
   * @param controlled whether the agent is the system or part of the environment
   */
  public GrSpec spec(Cell offset, boolean controlled, boolean nonbool) {
    Cell nameOffset = nonbool ? Cell.ORIGIN : offset;
    List<String> safety = new ArrayList<>();
    for (Cell cell : emptyCells()) {
      StringBuilder move = new StringBuilder(cellFormula(cell, nameOffset, false, nonbool))
          .append(" -> (")
          .append(cellFormula(cell, nameOffset, true, nonbool));
      for (Cell neighbour : emptyNeighbours(cell)) {
        move.append(" | ").append(cellFormula(neighbour, nameOffset, true, nonbool));
      }
      safety.add(move.append(')').toString());
    }
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        if (occupied[i][j]) {
          safety.add("!(" + cellFormula(Cell.of(i, j), nameOffset, true, nonbool) + ")");
        }
      }
    }

    GrSpec spec = new GrSpec();
    List<String> variables = new ArrayList<>();
    if (nonbool) {
      declare(spec, controlled, prefix + "_r", Domain.range(0, rows() - 1));
      declare(spec, controlled, prefix + "_c", Domain.range(0, cols() - 1));
    } else {
      for (int i = 0; i < rows(); i++) {
        for (int j = 0; j < cols(); j++) {
          String name = variableName(Cell.of(i, j), nameOffset);
          variables.add(name);
          declare(spec, controlled, name, Domain.BOOLEAN);
        }
      }
      List<Cell> empty = emptyCells();
      safety.add(empty.stream()
          .map(cell -> empty.stream()
              .map(other -> other.equals(cell)
                  ? cellFormula(cell, nameOffset, true, false)
                  : "(!" + cellFormula(other, nameOffset, true, false) + ")")
              .collect(Collectors.joining(" & ", "(", ")")))
          .collect(Collectors.joining("\n| ")));
    }

    String init = inits.stream()
        .map(cell -> {
          if (nonbool) {
            return cellFormula(cell, nameOffset, false, true);
          }
          String own = variableName(cell, nameOffset);
          return variables.stream()
              .map(name -> name.equals(own) ? name : "!" + name)
              .collect(Collectors.joining(" & ", "(", ")"));
        })
        .collect(Collectors.joining(" | "));

    spec.add(controlled ? FormulaSlot.SYS_INIT : FormulaSlot.ENV_INIT, init);
    spec.add(controlled ? FormulaSlot.SYS_SAFETY : FormulaSlot.ENV_SAFETY, safety);
    spec.add(controlled ? FormulaSlot.SYS_PROGRESS : FormulaSlot.ENV_PROGRESS, goals.stream()
        .map(goal -> cellFormula(goal, nameOffset, false, nonbool))
        .toList());
    return spec;
  }

  private static void declare(GrSpec spec, boolean controlled, String name, Domain domain) {
    if (controlled) {
      spec.addSysVariable(name, domain);
    } else {
      spec.addEnvVariable(name, domain);
    }
  }

  /**
   * Like {@link #spec(Cell, boolean, boolean)}, but the goals must be visited in list order. An
   * integer counter ranging over {@code [0, N]} tracks the next goal; it may advance from
   * {@code n} to {@code n+1} while the agent is at goal {@code n}, and wraps from {@code N} to 0.
   * The only progress condition is {@code counter = N}.
   */
  public GrSpec sequencedSpec(Cell offset, boolean controlled, boolean nonbool, String counter) {
    GrSpec spec = spec(offset, controlled, nonbool);
    int n = goals.size();
    if (n == 0) {
      return spec;
    }
    Cell nameOffset = nonbool ? Cell.ORIGIN : offset;
    declare(spec, controlled, counter, Domain.range(0, n));
    spec.add(controlled ? FormulaSlot.SYS_INIT : FormulaSlot.ENV_INIT, counter + " = 0");
    FormulaSlot safety = controlled ? FormulaSlot.SYS_SAFETY : FormulaSlot.ENV_SAFETY;
    for (int k = 0; k < n; k++) {
      spec.add(safety, "(%s = %d) -> ((%s' = %d) | (%s & (%s' = %d)))".formatted(counter, k, counter, k,
          cellFormula(goals.get(k), nameOffset, false, nonbool), counter, k + 1));
    }
    spec.add(safety, "(%s = %d) -> (%s' = 0)".formatted(counter, n, counter));
    spec.set(controlled ? FormulaSlot.SYS_PROGRESS : FormulaSlot.ENV_PROGRESS, List.of(counter + " = " + n));
    return spec;
  }

  // Partitions

  /** Discrete partition with one region per cell and no geometry. */
  public Partition discreteTransitionSystem(boolean nonbool) {
    return partition(nonbool, null, null);
  }

  /**
   * Partition whose regions are the axis-aligned boxes of the cells. The bottom-left corner of the
   * grid is placed at {@code offset}; row 0 is the top row.
   */
  public Partition dumpPPartition(double[] sideLengths, double[] offset, boolean nonbool) {
    checkArgument(sideLengths.length == 2 && offset.length == 2, "Expected planar side lengths and offset");
    return partition(nonbool, sideLengths, offset);
  }

  public Polytope cellBox(Cell cell, double[] sideLengths, double[] offset) {
    Cell resolved = resolve(cell);
    int i = resolved.row();
    int j = resolved.col();
    return Polytope.box(
        new double[] {offset[0] + j * sideLengths[0], offset[1] + (rows() - i - 1) * sideLengths[1]},
        new double[] {offset[0] + (j + 1) * sideLengths[0], offset[1] + (rows() - i) * sideLengths[1]});
  }

  private Partition partition(boolean nonbool, @Nullable double[] sideLengths, @Nullable double[] offset) {
    int count = rows() * cols();
    List<String> symbols = new ArrayList<>(count);
    List<Region> regions = new ArrayList<>(count);
    boolean[][] transitions = new boolean[count][count];
    boolean[][] adjacency = new boolean[count][count];
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        Cell cell = Cell.of(i, j);
        String symbol = cellFormula(cell, false, nonbool);
        symbols.add(symbol);
        regions.add(Region.of(Set.of(symbol), sideLengths == null ? null : cellBox(cell, sideLengths, offset)));
        if (occupied[i][j]) {
          continue;
        }
        int source = flat(cell);
        transitions[source][source] = true;
        adjacency[source][source] = true;
        for (Cell neighbour : emptyNeighbours(cell)) {
          transitions[flat(neighbour)][source] = true;
          adjacency[flat(neighbour)][source] = true;
          adjacency[source][flat(neighbour)] = true;
        }
      }
    }
    Polytope domain = sideLengths == null ? null : Polytope.box(offset,
        new double[] {offset[0] + cols() * sideLengths[0], offset[1] + rows() * sideLengths[1]});
    return new Partition(symbols, regions, transitions, adjacency, domain);
  }

  private int flat(Cell cell) {
    return cell.row() * cols() + cell.col();
  }

  /**
   * Transition matrix ({@code [dst][src]}) of an obstacle cycling deterministically along
   * {@code path}, returning to its first cell after the last one.
   */
  public boolean[][] deterministicMovingObstacle(List<Cell> path) {
    int count = rows() * cols();
    boolean[][] transitions = new boolean[count][count];
    for (int n = 0; n < path.size(); n++) {
      Cell cell = resolve(path.get(n));
      Cell previous = resolve(path.get((n + path.size() - 1) % path.size()));
      transitions[flat(cell)][flat(previous)] = true;
    }
    return transitions;
  }

  // Derived worlds

  /**
   * The world scaled by integer factors: {@code yf} for rows and {@code xf} for columns. Walls grow,
   * initial and goal cells move to the top-left cell of their block.
   */
  public GridWorld scale(int xf, int yf) {
    checkArgument(xf > 0 && yf > 0, "Invalid scaling factors %s, %s", xf, yf);
    GridWorld scaled = new GridWorld(rows() * yf, cols() * xf, prefix);
    for (int row = 0; row < scaled.rows(); row++) {
      for (int col = 0; col < scaled.cols(); col++) {
        scaled.occupied[row][col] = occupied[row / yf][col / xf];
      }
    }
    inits.forEach(cell -> scaled.inits.add(Cell.of(cell.row() * yf, cell.col() * xf)));
    goals.forEach(cell -> scaled.goals.add(Cell.of(cell.row() * yf, cell.col() * xf)));
    return scaled;
  }

  /**
   * A window of this world, without initial and goal cells.
   *
   * @param extend allow windows reaching outside the grid; cells outside count as occupied
   */
  public GridWorld dumpSubworld(int subRows, int subCols, Cell offset, String subPrefix, boolean extend) {
    GridWorld sub = new GridWorld(subRows, subCols, subPrefix);
    if (!extend) {
      checkArgument(inBounds(offset), "Offset %s is out of bounds", offset);
      checkArgument(offset.row() + subRows <= rows() && offset.col() + subCols <= cols(),
          "Subworld %sx%s does not fit at offset %s", subRows, subCols, offset);
    }
    for (int i = 0; i < subRows; i++) {
      for (int j = 0; j < subCols; j++) {
        Cell source = Cell.of(i, j).plus(offset);
        sub.occupied[i][j] = !inBounds(source) || occupied[source.row()][source.col()];
      }
    }
    return sub;
  }

  // Text

  /** Grid description accepted by {@link GridWorldParser}. */
  public String dump() {
    StringBuilder output = new StringBuilder().append(rows()).append(' ').append(cols()).append('\n');
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        output.append(symbol(Cell.of(i, j)));
      }
      output.append('\n');
    }
    return output.toString();
  }

  char symbol(Cell cell) {
    if (occupied[cell.row()][cell.col()]) {
      return '*';
    }
    if (inits.contains(cell)) {
      return 'I';
    }
    if (goals.contains(cell)) {
      return 'G';
    }
    return ' ';
  }

  /** Troll regions drawn by {@link #pretty}. */
  List<MovingObstacleGridWorld.Troll> overlayTrolls() {
    return List.of();
  }

  /**
   * Human readable rendering. Trolls are drawn as {@code E} at their centers and {@code +} over
   * their extent, path cells as arrows towards the next path cell.
   */
  public String pretty(boolean showGrid, List<Cell> path, boolean goalOrder) {
    char[][] overlay = new char[rows()][cols()];
    for (MovingObstacleGridWorld.Troll troll : overlayTrolls()) {
      Cell center = resolve(troll.center());
      for (int i = center.row() - troll.radius(); i <= center.row() + troll.radius(); i++) {
        for (int j = center.col() - troll.radius(); j <= center.col() + troll.radius(); j++) {
          if (inBounds(Cell.of(i, j)) && !occupied[i][j] && overlay[i][j] == 0) {
            overlay[i][j] = '+';
          }
        }
      }
      if (!occupied[center.row()][center.col()]) {
        overlay[center.row()][center.col()] = 'E';
      }
    }

    StringBuilder output = new StringBuilder();
    String border = showGrid ? "  " + "-".repeat(cols() * 2 + 1) + "\n" : "-".repeat(cols() + 2) + "\n";
    if (showGrid) {
      output.append("  ");
      for (int k = 0; k < cols(); k++) {
        output.append(String.format("%2d", k));
      }
      output.append('\n');
    } else {
      output.append(border);
    }
    for (int i = 0; i < rows(); i++) {
      if (showGrid) {
        output.append(border).append(String.format("%2d", i));
      } else {
        output.append('|');
      }
      for (int j = 0; j < cols(); j++) {
        if (showGrid) {
          output.append('|');
        }
        output.append(prettySymbol(Cell.of(i, j), overlay[i][j], path, goalOrder));
      }
      output.append("|\n");
    }
    return output.append(border).toString();
  }

  private char prettySymbol(Cell cell, char overlay, List<Cell> path, boolean goalOrder) {
    if (occupied[cell.row()][cell.col()]) {
      return '*';
    }
    if (overlay != 0) {
      return overlay;
    }
    if (inits.contains(cell)) {
      return 'I';
    }
    if (goals.contains(cell)) {
      return goalOrder ? Character.forDigit(goals.indexOf(cell) % 36, 36) : 'G';
    }
    char direction = ' ';
    for (int n = 0; n < path.size(); n++) {
      if (path.get(n).equals(cell)) {
        direction = direction(cell, path.get((n + 1) % path.size()));
        if (direction != '.') {
          break;
        }
      }
    }
    return direction;
  }

  private static char direction(Cell from, Cell to) {
    if (from.col() > to.col()) {
      return '<';
    }
    if (from.col() < to.col()) {
      return '>';
    }
    if (from.row() > to.row()) {
      return '^';
    }
    if (from.row() < to.row()) {
      return 'v';
    }
    return '.';
  }

  /** Equality of occupancy, initial and goal cells; prefixes are not compared. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    GridWorld other = (GridWorld) o;
    return Arrays.deepEquals(occupied, other.occupied) && inits.equals(other.inits) && goals.equals(other.goals);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.deepHashCode(occupied), inits, goals);
  }

  @Override
  public String toString() {
    return pretty(true, List.of(), false);
  }
}
