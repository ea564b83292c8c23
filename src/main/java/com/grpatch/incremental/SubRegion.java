package com.grpatch.incremental;

import static java.util.Objects.requireNonNull;

import com.grpatch.geometry.Polytope;

/** A named part of a region that is being refined. */
public record SubRegion(String name, Polytope polytope) {
  public SubRegion {
    requireNonNull(name);
    requireNonNull(polytope);
  }
}
