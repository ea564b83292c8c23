package com.grpatch.model;

import static java.util.Objects.requireNonNull;

import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * A node of a strategy automaton. Labels and edges are only changed through the owning
 * {@link Automaton}.
 */
public final class AutomatonNode {
  public static final int UNSET = -1;

  private final int id;
  private Valuation state;
  private final IntLinkedOpenHashSet successors;
  private int mode;
  private int rgrad;
  private boolean initial;

  AutomatonNode(int id, Valuation state, IntCollection successors, int mode, int rgrad, boolean initial) {
    this.id = id;
    this.state = requireNonNull(state);
    this.successors = new IntLinkedOpenHashSet(successors);
    this.mode = mode;
    this.rgrad = rgrad;
    this.initial = initial;
  }

  public int id() {
    return id;
  }

  public Valuation state() {
    return state;
  }

  /** Successor ids in insertion order. */
  public IntSet successors() {
    return IntSets.unmodifiable(successors);
  }

  /** Index of the system goal this node is working towards, or {@link #UNSET}. */
  public int mode() {
    return mode;
  }

  /** Reach gradient (rank) annotation, or {@link #UNSET}. */
  public int rgrad() {
    return rgrad;
  }

  public boolean initial() {
    return initial;
  }

  void setState(Valuation state) {
    this.state = requireNonNull(state);
  }

  void setSuccessors(IntCollection successors) {
    this.successors.clear();
    this.successors.addAll(successors);
  }

  boolean addSuccessor(int successor) {
    return successors.add(successor);
  }

  boolean removeSuccessor(int successor) {
    return successors.remove(successor);
  }

  void setAnnotations(int mode, int rgrad) {
    this.mode = mode;
    this.rgrad = rgrad;
  }

  void setInitial(boolean initial) {
    this.initial = initial;
  }

  AutomatonNode copy() {
    return new AutomatonNode(id, state, successors, mode, rgrad, initial);
  }

  @Override
  public String toString() {
    return "%d %s -> %s".formatted(id, state, successors);
  }
}
