package com.grpatch.gridworld;

/** Grid coordinate in row-major order. Negative values are only meaningful as offsets. */
public record Cell(int row, int col) {
  public static final Cell ORIGIN = new Cell(0, 0);

  public static Cell of(int row, int col) {
    return new Cell(row, col);
  }

  public Cell plus(Cell offset) {
    return new Cell(row + offset.row, col + offset.col);
  }

  public Cell minus(Cell offset) {
    return new Cell(row - offset.row, col - offset.col);
  }

  /** Infinity-norm distance. */
  public int chebyshevDistance(Cell other) {
    return Math.max(Math.abs(row - other.row), Math.abs(col - other.col));
  }

  @Override
  public String toString() {
    return "(" + row + "," + col + ")";
  }
}
