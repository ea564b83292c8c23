package com.grpatch.geometry;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/**
 * Convex polytope in H-representation, i.e. the set of points {@code x} with {@code A x <= b}.
 *
 * <p>Instances are immutable. Linear programs are solved with the commons-math simplex solver.
 */
public final class Polytope {
  public static final double ABS_TOL = 1e-7;
  private static final double MAX_RADIUS = 1e9;
  private static final int MAX_ITERATIONS = 10_000;
  private static final int MONTE_CARLO_SAMPLES = 50_000;

  private final double[][] a;
  private final double[] b;

  private Polytope(double[][] a, double[] b) {
    this.a = a;
    this.b = b;
  }

  public static Polytope of(double[][] a, double[] b) {
    checkArgument(a.length == b.length, "Got %s constraints but %s offsets", a.length, b.length);
    checkArgument(a.length > 0, "No constraints");
    int dimension = a[0].length;
    checkArgument(dimension > 0, "Zero-dimensional polytope");
    double[][] rows = new double[a.length][];
    for (int i = 0; i < a.length; i++) {
      checkArgument(a[i].length == dimension, "Row %s has dimension %s, expected %s", i, a[i].length, dimension);
      rows[i] = a[i].clone();
    }
    return new Polytope(rows, b.clone());
  }

  /** The axis-aligned box {@code lower <= x <= upper}. */
  public static Polytope box(double[] lower, double[] upper) {
    checkArgument(lower.length == upper.length, "Bounds of different dimension");
    int dimension = lower.length;
    double[][] a = new double[2 * dimension][dimension];
    double[] b = new double[2 * dimension];
    for (int d = 0; d < dimension; d++) {
      a[2 * d][d] = -1.0;
      b[2 * d] = -lower[d];
      a[2 * d + 1][d] = 1.0;
      b[2 * d + 1] = upper[d];
    }
    return new Polytope(a, b);
  }

  public int dimension() {
    return a[0].length;
  }

  public int constraintCount() {
    return a.length;
  }

  public double[] normal(int constraint) {
    return a[constraint].clone();
  }

  public double offset(int constraint) {
    return b[constraint];
  }

  public boolean contains(double[] point) {
    checkArgument(point.length == dimension(), "Point has wrong dimension");
    for (int i = 0; i < a.length; i++) {
      if (dot(a[i], point) > b[i] + ABS_TOL) {
        return false;
      }
    }
    return true;
  }

  public Polytope intersect(Polytope other) {
    checkArgument(other.dimension() == dimension(), "Dimension mismatch %s vs %s", dimension(), other.dimension());
    double[][] rows = new double[a.length + other.a.length][];
    double[] offsets = new double[b.length + other.b.length];
    for (int i = 0; i < a.length; i++) {
      rows[i] = a[i].clone();
      offsets[i] = b[i];
    }
    for (int i = 0; i < other.a.length; i++) {
      rows[a.length + i] = other.a[i].clone();
      offsets[a.length + i] = other.b[i];
    }
    return new Polytope(rows, offsets);
  }

  /**
   * Moves every facet outwards by {@code radius}. Facet normals are normalized first, so the
   * result contains all points within Euclidean distance {@code radius} of this polytope.
   */
  public Polytope inflate(double radius) {
    checkArgument(radius >= 0, "Negative radius %s", radius);
    double[][] rows = new double[a.length][];
    double[] offsets = new double[b.length];
    for (int i = 0; i < a.length; i++) {
      double norm = norm(a[i]);
      if (norm == 0.0) {
        rows[i] = a[i].clone();
        offsets[i] = b[i];
        continue;
      }
      rows[i] = Arrays.stream(a[i]).map(v -> v / norm).toArray();
      offsets[i] = b[i] / norm + radius;
    }
    return new Polytope(rows, offsets);
  }

  public record ChebyshevBall(double[] center, double radius) {}

  /** Largest inscribed ball, or empty if the polytope is infeasible. */
  public Optional<ChebyshevBall> chebyshevBall() {
    int n = dimension();
    List<LinearConstraint> constraints = new ArrayList<>(a.length + 2);
    for (int i = 0; i < a.length; i++) {
      double[] row = Arrays.copyOf(a[i], n + 1);
      row[n] = norm(a[i]);
      constraints.add(new LinearConstraint(row, Relationship.LEQ, b[i]));
    }
    double[] radiusOnly = new double[n + 1];
    radiusOnly[n] = 1.0;
    constraints.add(new LinearConstraint(radiusOnly, Relationship.GEQ, 0.0));
    constraints.add(new LinearConstraint(radiusOnly, Relationship.LEQ, MAX_RADIUS));

    try {
      PointValuePair solution = new SimplexSolver().optimize(new MaxIter(MAX_ITERATIONS),
          new LinearObjectiveFunction(radiusOnly, 0.0),
          new LinearConstraintSet(constraints),
          GoalType.MAXIMIZE,
          new NonNegativeConstraint(false));
      double[] point = solution.getPoint();
      return Optional.of(new ChebyshevBall(Arrays.copyOf(point, n), point[n]));
    } catch (NoFeasibleSolutionException e) {
      return Optional.empty();
    } catch (TooManyIterationsException e) {
      throw new IllegalStateException("Simplex did not converge for " + this, e);
    }
  }

  /** True iff the polytope has no interior point; lower-dimensional sets count as empty. */
  public boolean isEmpty() {
    return chebyshevBall().map(ball -> ball.radius() <= ABS_TOL).orElse(true);
  }

  /**
   * Axis-aligned bounding box as {@code {lower, upper}}.
   *
   * @throws IllegalStateException if the polytope is empty or unbounded
   */
  public double[][] boundingBox() {
    int n = dimension();
    List<LinearConstraint> rows = new ArrayList<>(a.length);
    for (int i = 0; i < a.length; i++) {
      rows.add(new LinearConstraint(a[i], Relationship.LEQ, b[i]));
    }
    LinearConstraintSet constraints = new LinearConstraintSet(rows);

    double[] lower = new double[n];
    double[] upper = new double[n];
    for (int d = 0; d < n; d++) {
      double[] objective = new double[n];
      objective[d] = 1.0;
      lower[d] = extremum(objective, constraints, GoalType.MINIMIZE);
      upper[d] = extremum(objective, constraints, GoalType.MAXIMIZE);
    }
    return new double[][] {lower, upper};
  }

  private static double extremum(double[] objective, LinearConstraintSet constraints, GoalType goal) {
    try {
      return new SimplexSolver().optimize(new MaxIter(MAX_ITERATIONS),
          new LinearObjectiveFunction(objective, 0.0), constraints, goal, new NonNegativeConstraint(false))
          .getValue();
    } catch (NoFeasibleSolutionException e) {
      throw new IllegalStateException("Bounding box of empty polytope", e);
    } catch (UnboundedSolutionException e) {
      throw new IllegalStateException("Polytope is unbounded", e);
    }
  }

  /**
   * Lebesgue measure. Exact in one and two dimensions, estimated by seeded sampling of the bounding
   * box otherwise.
   */
  public double volume() {
    if (isEmpty()) {
      return 0.0;
    }
    double[][] box = boundingBox();
    return switch (dimension()) {
      case 1 -> box[1][0] - box[0][0];
      case 2 -> area(clippedPolygon(box));
      default -> sampledVolume(box);
    };
  }

  /** Vertices of a two-dimensional polytope in counter-clockwise order. */
  public List<double[]> vertices() {
    checkArgument(dimension() == 2, "Vertex enumeration only supported in 2D");
    if (isEmpty()) {
      return List.of();
    }
    return clippedPolygon(boundingBox());
  }

  /** Cuts the polytope into {@code pieces} slabs of equal width along {@code axis}. */
  public List<Polytope> splitAlong(int axis, int pieces) {
    checkArgument(0 <= axis && axis < dimension(), "Invalid axis %s", axis);
    checkArgument(pieces > 0, "Invalid number of pieces %s", pieces);
    double[][] box = boundingBox();
    double width = (box[1][axis] - box[0][axis]) / pieces;
    List<Polytope> slabs = new ArrayList<>(pieces);
    for (int k = 0; k < pieces; k++) {
      double[][] rows = new double[2][dimension()];
      rows[0][axis] = -1.0;
      rows[1][axis] = 1.0;
      double[] offsets = {-(box[0][axis] + k * width), box[0][axis] + (k + 1) * width};
      slabs.add(intersect(new Polytope(rows, offsets)));
    }
    return slabs;
  }

  private List<double[]> clippedPolygon(double[][] box) {
    List<double[]> polygon = new ArrayList<>(List.of(
        new double[] {box[0][0], box[0][1]},
        new double[] {box[1][0], box[0][1]},
        new double[] {box[1][0], box[1][1]},
        new double[] {box[0][0], box[1][1]}));
    for (int i = 0; i < a.length && !polygon.isEmpty(); i++) {
      polygon = clip(polygon, a[i], b[i]);
    }
    return withoutRepeatedVertices(polygon);
  }

  // Clipping through a vertex emits it twice
  private static List<double[]> withoutRepeatedVertices(List<double[]> polygon) {
    List<double[]> vertices = new ArrayList<>(polygon.size());
    for (double[] vertex : polygon) {
      if (vertices.isEmpty() || !close(vertices.get(vertices.size() - 1), vertex)) {
        vertices.add(vertex);
      }
    }
    while (vertices.size() > 1 && close(vertices.get(0), vertices.get(vertices.size() - 1))) {
      vertices.remove(vertices.size() - 1);
    }
    return vertices;
  }

  private static boolean close(double[] p, double[] q) {
    return Math.abs(p[0] - q[0]) <= ABS_TOL && Math.abs(p[1] - q[1]) <= ABS_TOL;
  }

  // Sutherland-Hodgman step against the half-plane normal . x <= offset
  private static List<double[]> clip(List<double[]> polygon, double[] normal, double offset) {
    List<double[]> clipped = new ArrayList<>(polygon.size() + 1);
    int size = polygon.size();
    for (int k = 0; k < size; k++) {
      double[] current = polygon.get(k);
      double[] previous = polygon.get((k + size - 1) % size);
      double currentValue = dot(normal, current);
      double previousValue = dot(normal, previous);
      boolean currentInside = currentValue <= offset + ABS_TOL;
      boolean previousInside = previousValue <= offset + ABS_TOL;
      if (currentInside != previousInside) {
        double t = (offset - previousValue) / (currentValue - previousValue);
        clipped.add(new double[] {
            previous[0] + t * (current[0] - previous[0]),
            previous[1] + t * (current[1] - previous[1])});
      }
      if (currentInside) {
        clipped.add(current);
      }
    }
    return clipped;
  }

  private static double area(List<double[]> polygon) {
    double sum = 0.0;
    for (int k = 0; k < polygon.size(); k++) {
      double[] p = polygon.get(k);
      double[] q = polygon.get((k + 1) % polygon.size());
      sum += p[0] * q[1] - q[0] * p[1];
    }
    return Math.abs(sum) / 2.0;
  }

  private double sampledVolume(double[][] box) {
    Random random = new Random(0L);
    int n = dimension();
    double boxVolume = 1.0;
    for (int d = 0; d < n; d++) {
      boxVolume *= box[1][d] - box[0][d];
    }
    double[] point = new double[n];
    int hits = 0;
    for (int s = 0; s < MONTE_CARLO_SAMPLES; s++) {
      for (int d = 0; d < n; d++) {
        point[d] = box[0][d] + random.nextDouble() * (box[1][d] - box[0][d]);
      }
      if (contains(point)) {
        hits++;
      }
    }
    return boxVolume * hits / MONTE_CARLO_SAMPLES;
  }

  private static double dot(double[] x, double[] y) {
    double sum = 0.0;
    for (int i = 0; i < x.length; i++) {
      sum += x[i] * y[i];
    }
    return sum;
  }

  private static double norm(double[] x) {
    return Math.sqrt(dot(x, x));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Polytope other
        && Arrays.deepEquals(a, other.a) && Arrays.equals(b, other.b));
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.deepHashCode(a) + Arrays.hashCode(b);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < a.length; i++) {
      builder.append(Arrays.stream(a[i]).mapToObj(Double::toString).collect(Collectors.joining(" ", "[", "]")))
          .append(" x <= ").append(b[i]).append('\n');
    }
    return builder.toString();
  }
}
