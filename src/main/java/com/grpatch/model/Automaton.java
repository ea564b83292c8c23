package com.grpatch.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Strategy automaton: a directed graph whose nodes carry state valuations.
 *
 * <p>Node ids are stable handles. Removing a node never renumbers the remaining ones, and
 * iteration follows insertion order. Instances are not thread-safe.
 */
public final class Automaton {
  private static final Logger log = Logger.getLogger(Automaton.class.getName());

  private final Int2ObjectLinkedOpenHashMap<AutomatonNode> nodes = new Int2ObjectLinkedOpenHashMap<>();

  public Automaton() {}

  public Automaton copy() {
    Automaton copy = new Automaton();
    for (AutomatonNode node : nodes.values()) {
      copy.nodes.put(node.id(), node.copy());
    }
    return copy;
  }

  public void addNode(int id, Valuation state, IntCollection transitions) {
    addNode(id, state, transitions, AutomatonNode.UNSET, AutomatonNode.UNSET, false);
  }

  public void addNode(int id, Valuation state, IntCollection transitions, int mode, int rgrad) {
    addNode(id, state, transitions, mode, rgrad, false);
  }

  /** Inserts a node. An existing node with the same id is replaced, including its edges. */
  public void addNode(int id, Valuation state, IntCollection transitions, int mode, int rgrad, boolean initial) {
    AutomatonNode previous = nodes.put(id, new AutomatonNode(id, state, transitions, mode, rgrad, initial));
    if (previous != null) {
      log.log(Level.FINE, () -> "Replacing node %d".formatted(id));
    }
  }

  /** Removes the node and all edges pointing to it. */
  public boolean removeNode(int id) {
    if (nodes.remove(id) == null) {
      return false;
    }
    for (AutomatonNode node : nodes.values()) {
      node.removeSuccessor(id);
    }
    return true;
  }

  public boolean contains(int id) {
    return nodes.containsKey(id);
  }

  public AutomatonNode node(int id) {
    AutomatonNode node = nodes.get(id);
    if (node == null) {
      throw new NoSuchElementException("No node with id " + id);
    }
    return node;
  }

  public Collection<AutomatonNode> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public IntSet ids() {
    return IntSets.unmodifiable(nodes.keySet());
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** Sets the label of the node, creating a node without successors if necessary. */
  public void setState(int id, Valuation state) {
    AutomatonNode node = nodes.get(id);
    if (node == null) {
      addNode(id, state, IntSets.EMPTY_SET);
    } else {
      node.setState(state);
    }
  }

  /** Sets the outgoing edges of the node, creating an unlabelled node if necessary. */
  public void setTransitions(int id, IntCollection transitions) {
    AutomatonNode node = nodes.get(id);
    if (node == null) {
      addNode(id, Valuation.of(), transitions);
    } else {
      node.setSuccessors(transitions);
    }
  }

  public void setAnnotations(int id, int mode, int rgrad) {
    node(id).setAnnotations(mode, rgrad);
  }

  public void setInitial(int id, boolean initial) {
    node(id).setInitial(initial);
  }

  public boolean addTransition(int from, int to) {
    checkArgument(nodes.containsKey(to), "No node with id %s", to);
    return node(from).addSuccessor(to);
  }

  public boolean removeTransition(int from, int to) {
    return node(from).removeSuccessor(to);
  }

  public IntSet successors(int id) {
    return node(id).successors();
  }

  /** All nodes having an edge to {@code id}, in insertion order. */
  public List<AutomatonNode> predecessors(int id) {
    checkArgument(nodes.containsKey(id), "No node with id %s", id);
    return nodes.values().stream()
        .filter(node -> node.successors().contains(id))
        .toList();
  }

  /** First node, in iteration order, whose state is exactly {@code state}. */
  public Optional<AutomatonNode> findState(Valuation state) {
    return nodes.values().stream().filter(node -> node.state().equals(state)).findFirst();
  }

  public List<AutomatonNode> findAllStates(Valuation state) {
    return nodes.values().stream().filter(node -> node.state().equals(state)).toList();
  }

  /** All nodes consistent with the fragment; the empty fragment matches every node. */
  public List<AutomatonNode> findAllPartial(Valuation fragment) {
    return nodes.values().stream().filter(node -> node.state().agreesWith(fragment)).toList();
  }

  /** Nodes without predecessors. Recomputed on every call. */
  public List<AutomatonNode> initialNodes() {
    IntSet targets = new IntOpenHashSet();
    for (AutomatonNode node : nodes.values()) {
      targets.addAll(node.successors());
    }
    return nodes.values().stream().filter(node -> !targets.contains(node.id())).toList();
  }

  /** Removes nodes without successors until every remaining node has at least one. */
  public void trimDeadStates() {
    boolean changed = true;
    while (changed) {
      IntList dead = new IntArrayList();
      for (AutomatonNode node : nodes.values()) {
        if (node.successors().isEmpty()) {
          dead.add(node.id());
        }
      }
      changed = !dead.isEmpty();
      dead.forEach(this::removeNode);
    }
  }

  /** Keeps only the weakly connected component of {@code rootId}. */
  public void trimUnconnectedStates(int rootId) {
    checkArgument(nodes.containsKey(rootId), "No node with id %s", rootId);
    Int2ObjectMap<IntList> undirected = new Int2ObjectLinkedOpenHashMap<>();
    for (AutomatonNode node : nodes.values()) {
      undirected.computeIfAbsent(node.id(), k -> new IntArrayList());
      for (int successor : node.successors()) {
        if (nodes.containsKey(successor)) {
          undirected.get(node.id()).add(successor);
          undirected.computeIfAbsent(successor, k -> new IntArrayList()).add(node.id());
        }
      }
    }

    IntSet component = new IntOpenHashSet();
    component.add(rootId);
    Queue<Integer> queue = new ArrayDeque<>(List.of(rootId));
    while (!queue.isEmpty()) {
      for (int neighbour : undirected.get((int) queue.poll())) {
        if (component.add(neighbour)) {
          queue.add(neighbour);
        }
      }
    }

    IntList unconnected = new IntArrayList();
    for (int id : nodes.keySet()) {
      if (!component.contains(id)) {
        unconnected.add(id);
      }
    }
    unconnected.forEach(this::removeNode);
  }

  /**
   * Picks the next node which agrees with the given environment move.
   *
   * @param current the current node, or {@code null} if unknown, in which case every node is a
   *     candidate
   * @param deterministic choose the first candidate in iteration order instead of a random one
   */
  public Optional<AutomatonNode> findNextState(@Nullable AutomatonNode current, Valuation envMove,
      boolean deterministic) {
    return deterministic
        ? candidates(current, envMove).stream().findFirst()
        : findNextState(current, envMove, ThreadLocalRandom.current());
  }

  public Optional<AutomatonNode> findNextState(@Nullable AutomatonNode current, Valuation envMove, Random random) {
    List<AutomatonNode> candidates = candidates(current, envMove);
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(candidates.get(random.nextInt(candidates.size())));
  }

  private List<AutomatonNode> candidates(@Nullable AutomatonNode current, Valuation envMove) {
    if (current == null) {
      return findAllPartial(envMove);
    }
    List<AutomatonNode> candidates = new ArrayList<>();
    for (int successor : current.successors()) {
      AutomatonNode node = nodes.get(successor);
      if (node != null && node.state().agreesWith(envMove)) {
        candidates.add(node);
      }
    }
    return candidates;
  }

  /** Relabels every node. */
  public void updateStates(UnaryOperator<Valuation> update) {
    for (AutomatonNode node : nodes.values()) {
      node.setState(requireNonNull(update.apply(node.state())));
    }
  }

  /** Drops module prefixes, e.g. {@code grid.cellID} becomes {@code cellID}. */
  public void stripNames() {
    updateStates(state -> {
      Valuation.Builder builder = Valuation.builder();
      state.asMap().forEach((name, value) -> builder.put(name.substring(name.lastIndexOf('.') + 1), value));
      return builder.build();
    });
  }

  /** Checks that every edge ends in an existing node. */
  public void validate() {
    for (AutomatonNode node : nodes.values()) {
      for (int successor : node.successors()) {
        checkArgument(nodes.containsKey(successor),
            "Node %s has a transition to undefined node %s", node.id(), successor);
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Automaton that) || nodes.size() != that.nodes.size()) {
      return false;
    }
    for (AutomatonNode node : nodes.values()) {
      AutomatonNode other = that.nodes.get(node.id());
      if (other == null
          || !node.state().equals(other.state())
          || !node.successors().equals(other.successors())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (AutomatonNode node : nodes.values()) {
      hash += node.id() ^ node.state().hashCode() ^ node.successors().hashCode();
    }
    return hash;
  }

  @Override
  public String toString() {
    return nodes.values().stream().map(AutomatonNode::toString).collect(Collectors.joining("\n"));
  }
}
