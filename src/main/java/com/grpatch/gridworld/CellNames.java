package com.grpatch.gridworld;

import com.grpatch.model.Valuation;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Decoding of the cell names produced by {@link GridWorld#cellFormula}. */
public final class CellNames {
  private static final String AXIS = "\\(\\s*([\\w.]+)_([rc])\\s*=\\s*(-?\\d+)\\s*\\)";
  private static final Pattern INTEGER_CELL = Pattern.compile("\\s*\\(?\\s*" + AXIS + "\\s*&\\s*" + AXIS + "\\s*\\)?\\s*");

  /** Coordinate named by a cell variable; the "nowhere" cell {@code Y_n_n} has row and column -1. */
  public record CellCoordinate(String prefix, int row, int col) {
    public Cell cell() {
      return Cell.of(row, col);
    }
  }

  private CellNames() {}

  /**
   * Extracts the coordinate from {@code Y_R_C} or, with {@code nonbool}, from
   * {@code ((Y_r = R) & (Y_c = C))} with either order of the two equations.
   */
  public static Optional<CellCoordinate> extractCoord(String name, boolean nonbool) {
    return nonbool ? extractInteger(name) : extractBoolean(name);
  }

  private static Optional<CellCoordinate> extractBoolean(String name) {
    String[] parts = name.split("_", -1);
    if (parts.length < 3) {
      return Optional.empty();
    }
    String prefix = String.join("_", Arrays.copyOf(parts, parts.length - 2));
    String row = parts[parts.length - 2];
    String col = parts[parts.length - 1];
    if (row.equals("n") && col.equals("n")) {
      return Optional.of(new CellCoordinate(prefix, -1, -1));
    }
    try {
      return Optional.of(new CellCoordinate(prefix, Integer.parseInt(row), Integer.parseInt(col)));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static Optional<CellCoordinate> extractInteger(String formula) {
    Matcher matcher = INTEGER_CELL.matcher(formula);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String prefix = matcher.group(1);
    String firstAxis = matcher.group(2);
    if (!prefix.equals(matcher.group(4)) || firstAxis.equals(matcher.group(5))) {
      return Optional.empty();
    }
    int first = Integer.parseInt(matcher.group(3));
    int second = Integer.parseInt(matcher.group(6));
    return Optional.of(firstAxis.equals("r")
        ? new CellCoordinate(prefix, first, second)
        : new CellCoordinate(prefix, second, first));
  }

  /** The entries of {@code state} whose variable names start with {@code prefix}. */
  public static Valuation prefixFilter(Valuation state, String prefix) {
    Valuation.Builder builder = Valuation.builder();
    state.asMap().forEach((name, value) -> {
      if (name.startsWith(prefix)) {
        builder.put(name, value);
      }
    });
    return builder.build();
  }
}
