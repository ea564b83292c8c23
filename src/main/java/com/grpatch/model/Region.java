package com.grpatch.model;

import com.google.common.collect.ImmutableSet;
import com.grpatch.geometry.Polytope;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Atomic region of a proposition preserving partition. Purely discrete partitions carry no
 * polytope.
 */
public record Region(ImmutableSet<String> propositions, @Nullable Polytope polytope) {
  public static Region of(Set<String> propositions, @Nullable Polytope polytope) {
    return new Region(ImmutableSet.copyOf(propositions), polytope);
  }

  public boolean carries(String proposition) {
    return propositions.contains(proposition);
  }

  public Polytope requirePolytope() {
    if (polytope == null) {
      throw new IllegalStateException("Region %s has no geometry".formatted(propositions));
    }
    return polytope;
  }
}
