package com.grpatch.gridworld;

import static com.google.common.base.Preconditions.checkArgument;

import com.grpatch.model.Partition;
import com.grpatch.model.Region;
import java.util.Optional;

/**
 * Grid world laid over the plane: every cell is an axis-aligned box of the given side lengths and
 * the bottom-left corner of the grid sits at {@code offset}.
 */
public final class ContinuousGridWorld extends GridWorld {
  private double[] sideLengths;
  private double[] offset;
  private Partition partition;

  public ContinuousGridWorld(GridWorld world, double[] sideLengths, double[] offset) {
    super(world.rows(), world.cols(), world.prefix());
    world.copyInto(this);
    remap(sideLengths, offset);
  }

  public static ContinuousGridWorld load(String description, String prefix, double[] sideLengths, double[] offset) {
    return new ContinuousGridWorld(GridWorld.load(description, prefix), sideLengths, offset);
  }

  @Override
  public ContinuousGridWorld copy() {
    return new ContinuousGridWorld(this, sideLengths, offset);
  }

  /** Rebuilds the boolean encoded partition for new cell dimensions. */
  public void remap(double[] sideLengths, double[] offset) {
    checkArgument(sideLengths.length == 2 && offset.length == 2, "Expected planar side lengths and offset");
    checkArgument(sideLengths[0] > 0 && sideLengths[1] > 0, "Side lengths must be positive");
    this.sideLengths = sideLengths.clone();
    this.offset = offset.clone();
    this.partition = dumpPPartition(this.sideLengths, this.offset, false);
  }

  public Partition partition() {
    return partition;
  }

  /** The cell containing {@code point}, or empty if the point lies outside the grid. */
  public Optional<Cell> cellAt(double[] point) {
    checkArgument(point.length == 2, "Continuous state must be planar");
    for (Region region : partition.regions()) {
      if (region.requirePolytope().contains(point)) {
        String symbol = region.propositions().iterator().next();
        return CellNames.extractCoord(symbol, false).map(CellNames.CellCoordinate::cell);
      }
    }
    return Optional.empty();
  }

  /** Lower-left and upper-right corners of the cell. */
  public double[][] boundingBox(Cell cell) {
    Cell resolved = resolve(cell);
    double[] lower = {
        offset[0] + resolved.col() * sideLengths[0],
        offset[1] + (rows() - resolved.row() - 1) * sideLengths[1]};
    double[] upper = {lower[0] + sideLengths[0], lower[1] + sideLengths[1]};
    return new double[][] {lower, upper};
  }

  public double[] center(Cell cell) {
    double[][] box = boundingBox(cell);
    return new double[] {(box[0][0] + box[1][0]) / 2, (box[0][1] + box[1][1]) / 2};
  }
}
