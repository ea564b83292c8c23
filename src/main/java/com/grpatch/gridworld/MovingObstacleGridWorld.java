package com.grpatch.gridworld;

import static com.google.common.base.Preconditions.checkArgument;

import com.grpatch.parser.GridWorldParser;
import com.grpatch.spec.GrSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Grid world with moving obstacles ("trolls") bound to square home regions. */
public final class MovingObstacleGridWorld extends GridWorld {
  /** Home region of a troll: all cells within infinity-norm distance {@code radius} of the center. */
  public record Troll(Cell center, int radius) {
    public Troll {
      checkArgument(radius >= 0, "Negative troll radius %s", radius);
    }
  }

  private final List<Troll> trolls = new ArrayList<>();

  public MovingObstacleGridWorld(int rows, int cols, String prefix) {
    super(rows, cols, prefix);
  }

  public MovingObstacleGridWorld(GridWorld world, List<Troll> trolls) {
    super(world.rows(), world.cols(), world.prefix());
    world.copyInto(this);
    trolls.forEach(this::addTroll);
  }

  public static MovingObstacleGridWorld load(String description, String prefix) {
    return GridWorldParser.parseWithTrolls(description, prefix);
  }

  @Override
  public MovingObstacleGridWorld copy() {
    return new MovingObstacleGridWorld(this, trolls);
  }

  public List<Troll> trolls() {
    return List.copyOf(trolls);
  }

  public void addTroll(Troll troll) {
    Cell center = resolve(troll.center());
    checkArgument(isEmpty(center), "Troll center %s is occupied", center);
    trolls.add(new Troll(center, troll.radius()));
  }

  /** Specification of the controlled agent together with all trolls, see {@link Trolls}. */
  public GrSpec mspec(String trollPrefix, boolean nonbool) {
    return Trolls.addTrolls(this, trolls, trollPrefix, false, nonbool).spec();
  }

  @Override
  char symbol(Cell cell) {
    char symbol = super.symbol(cell);
    if (symbol == ' ' && trolls.contains(new Troll(cell, 1))) {
      return 'E';
    }
    return symbol;
  }

  @Override
  List<Troll> overlayTrolls() {
    return trolls();
  }

  @Override
  public boolean equals(Object o) {
    return super.equals(o) && trolls.equals(((MovingObstacleGridWorld) o).trolls);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), trolls);
  }
}
