package com.grpatch.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable assignment of integer values to variable names. Booleans are encoded as 0 and 1.
 *
 * <p>A valuation may also act as a partial state (a "fragment"): it then matches every state which
 * agrees on all of its variables, see {@link #agreesWith(Valuation)}.
 */
public final class Valuation {
  private static final Valuation EMPTY = new Valuation(ImmutableMap.of());

  private final ImmutableMap<String, Integer> values;
  private final int hashCode;

  private Valuation(ImmutableMap<String, Integer> values) {
    this.values = values;
    this.hashCode = values.hashCode();
  }

  public static Valuation of() {
    return EMPTY;
  }

  public static Valuation of(String variable, int value) {
    return new Valuation(ImmutableMap.of(variable, value));
  }

  public static Valuation of(Map<String, Integer> values) {
    return values.isEmpty() ? EMPTY : new Valuation(ImmutableMap.copyOf(values));
  }

  /** Zips the given names with the values of {@code vector}, which must be at least as long. */
  public static Valuation fromVector(List<String> variables, int[] vector) {
    checkArgument(vector.length >= variables.size(),
        "State vector %s too short for variables %s", vector.length, variables);
    Builder builder = builder();
    for (int i = 0; i < variables.size(); i++) {
      builder.put(variables.get(i), vector[i]);
    }
    return builder.build();
  }

  /** A valuation in which every given variable is 0. */
  public static Valuation zeros(Collection<String> variables) {
    Builder builder = builder();
    variables.forEach(variable -> builder.put(variable, 0));
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int get(String variable) {
    Integer value = values.get(variable);
    checkArgument(value != null, "Variable %s not assigned in %s", variable, this);
    return value;
  }

  public boolean contains(String variable) {
    return values.containsKey(variable);
  }

  public Set<String> variables() {
    return values.keySet();
  }

  public Map<String, Integer> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** True iff every variable of {@code fragment} has the same value here. */
  public boolean agreesWith(Valuation fragment) {
    for (Map.Entry<String, Integer> entry : fragment.values.entrySet()) {
      if (!entry.getValue().equals(values.get(entry.getKey()))) {
        return false;
      }
    }
    return true;
  }

  public Valuation with(String variable, int value) {
    Integer previous = values.get(variable);
    if (previous != null && previous == value) {
      return this;
    }
    return builder().putAll(this).put(variable, value).build();
  }

  /** Overrides the values of this valuation by those of {@code other}. */
  public Valuation withAll(Valuation other) {
    if (other.isEmpty()) {
      return this;
    }
    return builder().putAll(this).putAll(other).build();
  }

  /** Adds the variables which are not assigned yet, keeping existing values. */
  public Valuation withDefaults(Collection<String> variables, int value) {
    Builder builder = builder().putAll(this);
    boolean changed = false;
    for (String variable : variables) {
      if (!values.containsKey(variable)) {
        builder.put(variable, value);
        changed = true;
      }
    }
    return changed ? builder.build() : this;
  }

  public Valuation without(Collection<String> variables) {
    return Valuation.of(values.entrySet().stream()
        .filter(entry -> !variables.contains(entry.getKey()))
        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new)));
  }

  public Valuation restrictTo(Collection<String> variables) {
    return Valuation.of(values.entrySet().stream()
        .filter(entry -> variables.contains(entry.getKey()))
        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new)));
  }

  /** Positional encoding of this valuation; every listed variable must be assigned. */
  public int[] toVector(List<String> order) {
    int[] vector = new int[order.size()];
    for (int i = 0; i < order.size(); i++) {
      vector[i] = get(order.get(i));
    }
    return vector;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Valuation valuation)) {
      return false;
    }
    return hashCode == valuation.hashCode && values.equals(valuation.values);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return values.entrySet().stream()
        .map(entry -> entry.getKey() + ":" + entry.getValue())
        .collect(Collectors.joining(", ", "<", ">"));
  }

  public static final class Builder {
    private final Map<String, Integer> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String variable, int value) {
      values.put(variable, value);
      return this;
    }

    public Builder putAll(Valuation valuation) {
      values.putAll(valuation.values);
      return this;
    }

    public Valuation build() {
      return Valuation.of(values);
    }
  }
}
