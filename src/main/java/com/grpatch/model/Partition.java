package com.grpatch.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.grpatch.geometry.Polytope;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Proposition preserving partition together with its one-step transition relation.
 *
 * <p>{@code transition(dst, src)} holds iff a move from region {@code src} to region {@code dst}
 * is allowed. The adjacency relation is symmetric and reflexive on traversable regions.
 */
public final class Partition {
  private final ImmutableList<String> propositionSymbols;
  private final ImmutableList<Region> regions;
  private final boolean[][] transitions;
  private final boolean[][] adjacency;
  @Nullable
  private final Polytope domain;

  public Partition(List<String> propositionSymbols, List<Region> regions, boolean[][] transitions,
      boolean[][] adjacency, @Nullable Polytope domain) {
    int size = regions.size();
    checkArgument(transitions.length == size && adjacency.length == size,
        "Relations must be %s x %s", size, size);
    for (int i = 0; i < size; i++) {
      checkArgument(transitions[i].length == size && adjacency[i].length == size,
          "Relations must be %s x %s", size, size);
    }
    this.propositionSymbols = ImmutableList.copyOf(propositionSymbols);
    this.regions = ImmutableList.copyOf(regions);
    this.transitions = copy(transitions);
    this.adjacency = copy(adjacency);
    this.domain = domain;
  }

  private static boolean[][] copy(boolean[][] matrix) {
    boolean[][] copy = new boolean[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      copy[i] = matrix[i].clone();
    }
    return copy;
  }

  public List<String> propositionSymbols() {
    return propositionSymbols;
  }

  public List<Region> regions() {
    return regions;
  }

  public Region region(int index) {
    return regions.get(index);
  }

  public int size() {
    return regions.size();
  }

  public boolean transition(int dst, int src) {
    return transitions[dst][src];
  }

  public boolean adjacent(int i, int j) {
    return adjacency[i][j];
  }

  /** Index of the unique region carrying {@code symbol}, or -1. */
  public int indexOf(String symbol) {
    for (int i = 0; i < regions.size(); i++) {
      if (regions.get(i).carries(symbol)) {
        return i;
      }
    }
    return -1;
  }

  @Nullable
  public Polytope domain() {
    return domain;
  }
}
