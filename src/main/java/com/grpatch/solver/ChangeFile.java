package com.grpatch.solver;

import com.grpatch.model.Valuation;
import com.grpatch.spec.GrSpec;
import java.util.Collection;
import java.util.List;

/**
 * Change description for {@code gr1c patch -e}: one line per neighborhood state holding its
 * environment then system values, followed by one line per {@link ChangeCommand}.
 */
public final class ChangeFile {
  private ChangeFile() {}

  /**
   * @throws IllegalArgumentException if a neighborhood state does not assign every variable of the
   *     specification
   */
  public static String render(GrSpec spec, Collection<Valuation> neighborhood, List<ChangeCommand> changes) {
    List<String> variables = spec.variables();
    StringBuilder output = new StringBuilder();
    for (Valuation state : neighborhood) {
      output.append(ChangeCommand.vector(state.toVector(variables))).append('\n');
    }
    for (ChangeCommand change : changes) {
      output.append(change.toLine(spec)).append('\n');
    }
    return output.toString();
  }
}
