package com.grpatch.spec;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.grpatch.gridworld.Cell;
import com.grpatch.gridworld.GridWorld;
import com.grpatch.model.Domain;
import com.grpatch.model.Partition;
import com.grpatch.model.Region;
import com.grpatch.model.Valuation;
import com.grpatch.parser.FormulaEvaluator;
import com.grpatch.parser.FormulaVariables;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

/**
 * A GR(1) specification: environment and system variables with their domains and six lists of
 * conjuncts. An empty list stands for {@code True}.
 *
 * <p>Formulas are kept as gr1c text. Safety and progress conjuncts are stored without their
 * {@code []} and {@code []<>} wrappers, which are added when dumping.
 */
public final class GrSpec {
  private final Map<String, Domain> envVariables = new LinkedHashMap<>();
  private final Map<String, Domain> sysVariables = new LinkedHashMap<>();
  private final EnumMap<FormulaSlot, List<String>> formulas = new EnumMap<>(FormulaSlot.class);

  public GrSpec() {
    for (FormulaSlot slot : FormulaSlot.values()) {
      formulas.put(slot, new ArrayList<>());
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public GrSpec copy() {
    GrSpec copy = new GrSpec();
    copy.envVariables.putAll(envVariables);
    copy.sysVariables.putAll(sysVariables);
    formulas.forEach((slot, list) -> copy.formulas.get(slot).addAll(list));
    return copy;
  }

  // Variables

  /** Declares an environment variable; returns false if the name is already declared. */
  public boolean addEnvVariable(String name, Domain domain) {
    return declare(envVariables, name, domain);
  }

  public boolean addSysVariable(String name, Domain domain) {
    return declare(sysVariables, name, domain);
  }

  private boolean declare(Map<String, Domain> variables, String name, Domain domain) {
    requireNonNull(domain);
    checkArgument(!name.isBlank(), "Blank variable name");
    if (isDeclared(name)) {
      return false;
    }
    variables.put(name, domain);
    return true;
  }

  /** Removes the declaration of {@code name}; formulas are left untouched. */
  public boolean removeVariable(String name) {
    return envVariables.remove(name) != null || sysVariables.remove(name) != null;
  }

  public boolean isDeclared(String name) {
    return envVariables.containsKey(name) || sysVariables.containsKey(name);
  }

  public boolean isEnvVariable(String name) {
    return envVariables.containsKey(name);
  }

  public List<String> envVariables() {
    return List.copyOf(envVariables.keySet());
  }

  public List<String> sysVariables() {
    return List.copyOf(sysVariables.keySet());
  }

  /** Environment variables followed by system variables, the positional order of gr1c state vectors. */
  public List<String> variables() {
    return ImmutableList.<String>builder().addAll(envVariables.keySet()).addAll(sysVariables.keySet()).build();
  }

  public Domain domain(String name) {
    Domain domain = envVariables.containsKey(name) ? envVariables.get(name) : sysVariables.get(name);
    checkArgument(domain != null, "Undeclared variable %s", name);
    return domain;
  }

  // Formulas

  public List<String> formulas(FormulaSlot slot) {
    return List.copyOf(formulas.get(slot));
  }

  /** Appends conjuncts to a slot; empty strings are dropped. */
  public GrSpec add(FormulaSlot slot, String... conjuncts) {
    return add(slot, Arrays.asList(conjuncts));
  }

  public GrSpec add(FormulaSlot slot, List<String> conjuncts) {
    List<String> list = formulas.get(slot);
    for (String conjunct : conjuncts) {
      if (!conjunct.isEmpty()) {
        list.add(conjunct);
      }
    }
    return this;
  }

  public void set(FormulaSlot slot, List<String> conjuncts) {
    formulas.get(slot).clear();
    add(slot, conjuncts);
  }

  public String remove(FormulaSlot slot, int index) {
    List<String> list = formulas.get(slot);
    checkArgument(0 <= index && index < list.size(), "No conjunct %s in %s", index, slot);
    return list.remove(index);
  }

  public void addSysGoal(String goal) {
    add(FormulaSlot.SYS_PROGRESS, goal);
  }

  public String removeSysGoal(int index) {
    return remove(FormulaSlot.SYS_PROGRESS, index);
  }

  // Merging

  /** Adds the declarations (skipping known names) and conjuncts of {@code other}. */
  public void importSpec(GrSpec other) {
    other.envVariables.forEach(this::addEnvVariable);
    other.sysVariables.forEach(this::addSysVariable);
    other.formulas.forEach((slot, list) -> formulas.get(slot).addAll(list));
  }

  public void importGridWorld(GridWorld world, Cell offset, boolean controlled, boolean nonbool) {
    importSpec(world.spec(offset, controlled, nonbool));
  }

  /**
   * Adds one boolean system variable {@code <cellPrefix>_<i>} per region of the partition,
   * replaces the proposition symbols of the partition by disjunctions over these cells, encodes the
   * transition relation and makes the cell variables mutually exclusive.
   *
   * @return the new cell variables and their regions
   */
  public Map<String, Region> importDiscDynamics(Partition partition, String cellPrefix) {
    Map<String, Region> cells = new LinkedHashMap<>();
    if (partition.size() == 0) {
      return cells;
    }
    List<String> names = IntStream.range(0, partition.size()).mapToObj(i -> cellPrefix + "_" + i).toList();
    for (int i = 0; i < names.size(); i++) {
      cells.put(names.get(i), partition.region(i));
      addSysVariable(names.get(i), Domain.BOOLEAN);
    }
    for (String symbol : partition.propositionSymbols()) {
      sysVariables.remove(symbol);
    }

    for (String symbol : partition.propositionSymbols()) {
      List<String> carrying = IntStream.range(0, partition.size())
          .filter(i -> partition.region(i).carries(symbol))
          .mapToObj(names::get)
          .toList();
      String current = carrying.isEmpty() ? "False" : String.join(" | ", carrying);
      String next = carrying.isEmpty() ? "False"
          : carrying.stream().map(name -> name + "'").collect(Collectors.joining(" | "));
      symbolSubstitute(Map.of(symbol + "'", next));
      symbolSubstitute(Map.of(symbol, current));
    }

    for (int from = 0; from < partition.size(); from++) {
      int source = from;
      List<String> targets = IntStream.range(0, partition.size())
          .filter(to -> partition.transition(to, source))
          .mapToObj(to -> names.get(to) + "'")
          .toList();
      add(FormulaSlot.SYS_SAFETY, targets.isEmpty()
          ? names.get(from) + " -> False"
          : names.get(from) + " -> (" + String.join(" | ", targets) + ")");
    }

    add(FormulaSlot.SYS_INIT, exactlyOne(names, ""));
    add(FormulaSlot.SYS_SAFETY, exactlyOne(names, "'"));
    return cells;
  }

  private static String exactlyOne(List<String> names, String suffix) {
    List<String> terms = new ArrayList<>(names.size());
    for (String name : names) {
      StringBuilder term = new StringBuilder("(").append(name).append(suffix);
      for (String other : names) {
        if (!other.equals(name)) {
          term.append(" & (!").append(other).append(suffix).append(')');
        }
      }
      terms.add(term.append(')').toString());
    }
    return String.join("\n| ", terms);
  }

  /** Replaces symbols by formulas in all six slots until no symbol is left, see {@link SymbolSubstitution}. */
  public void symbolSubstitute(Map<String, String> substitutions) {
    if (substitutions.isEmpty()) {
      return;
    }
    new SymbolSubstitution(substitutions).applyTo(List.copyOf(formulas.values()));
  }

  // Checks

  /** Free variables of the formulas (primes removed) which are not declared. */
  public Set<String> undeclaredVariables() {
    Set<String> undeclared = new LinkedHashSet<>();
    for (List<String> list : formulas.values()) {
      for (String formula : list) {
        FormulaVariables.of(formula).stream().filter(name -> !isDeclared(name)).forEach(undeclared::add);
      }
    }
    return undeclared;
  }

  /**
   * Parses every conjunct.
   *
   * @throws IllegalArgumentException naming the first malformed conjunct
   */
  public void checkFormulas() {
    formulas.forEach((slot, list) -> {
      for (int i = 0; i < list.size(); i++) {
        try {
          FormulaVariables.of(list.get(i));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Malformed conjunct %d of %s".formatted(i, slot.gr1cLabel()), e);
        }
      }
    });
  }

  /**
   * Whether all conjuncts of an init or safety slot hold. For safety slots {@code next} is the
   * successor state.
   */
  public boolean satisfies(FormulaSlot slot, Valuation current, @Nullable Valuation next) {
    checkArgument(slot != FormulaSlot.ENV_PROGRESS && slot != FormulaSlot.SYS_PROGRESS,
        "Progress conditions cannot be evaluated on a single step");
    return formulas.get(slot).stream().allMatch(formula -> FormulaEvaluator.holds(formula, current, next));
  }

  // Output

  /** The specification in gr1c syntax. */
  public String toGr1c() {
    StringBuilder output = new StringBuilder(declarations());
    output.append(initSection(FormulaSlot.ENV_INIT));
    output.append(section(FormulaSlot.ENV_SAFETY, "[]")).append(";\n");
    output.append(section(FormulaSlot.ENV_PROGRESS, "[]<>")).append(";\n\n");
    output.append(initSection(FormulaSlot.SYS_INIT));
    output.append(section(FormulaSlot.SYS_SAFETY, "[]")).append(";\n");
    output.append(section(FormulaSlot.SYS_PROGRESS, "[]<>")).append(";\n");
    return output.toString();
  }

  /**
   * The specification as a gr1c reachability game, where the single system goal must be reached
   * once.
   *
   * @throws IllegalStateException if there is more than one system goal
   */
  public String toGr1cReachGame() {
    List<String> goals = formulas.get(FormulaSlot.SYS_PROGRESS);
    checkState(goals.size() <= 1, "Reachability games have at most one system goal, got %s", goals.size());
    StringBuilder output = new StringBuilder(declarations());
    output.append(initSection(FormulaSlot.ENV_INIT));
    output.append(section(FormulaSlot.ENV_SAFETY, "[]")).append(";\n");
    output.append(section(FormulaSlot.ENV_PROGRESS, "[]<>")).append(";\n\n");
    output.append(initSection(FormulaSlot.SYS_INIT));
    output.append(section(FormulaSlot.SYS_SAFETY, "[]")).append(";\n");
    output.append(goals.isEmpty() ? "SYSGOAL:;\n" : "SYSGOAL: <>(" + goals.get(0) + ");\n");
    return output.toString();
  }

  private String declarations() {
    StringBuilder output = new StringBuilder("ENV:");
    envVariables.forEach((name, domain) -> output.append(' ').append(name).append(domain.toGr1c()));
    output.append(";\nSYS:");
    sysVariables.forEach((name, domain) -> output.append(' ').append(name).append(domain.toGr1c()));
    return output.append(";\n\n").toString();
  }

  private String initSection(FormulaSlot slot) {
    return slot.gr1cLabel() + ": " + formulas.get(slot).stream()
        .map(formula -> "(" + formula + ")")
        .collect(Collectors.joining("\n& ")) + ";\n";
  }

  private String section(FormulaSlot slot, String operator) {
    List<String> list = formulas.get(slot);
    if (list.isEmpty()) {
      return slot.gr1cLabel() + ":";
    }
    return slot.gr1cLabel() + ": " + list.stream()
        .map(formula -> operator + "(" + formula + ")")
        .collect(Collectors.joining("\n& "));
  }

  public record JtlvSpec(String assumption, String guarantee) {}

  /** Assumption and guarantee in JTLV syntax, one commented block per nonempty slot. */
  public JtlvSpec toJtlv() {
    return new JtlvSpec(
        jtlv(List.of(
            new JtlvBlock(FormulaSlot.ENV_INIT, "-- valid initial env states", ""),
            new JtlvBlock(FormulaSlot.ENV_SAFETY, "-- safety assumption on environment", "[]"),
            new JtlvBlock(FormulaSlot.ENV_PROGRESS, "-- justice assumption on environment", "[]<>"))),
        jtlv(List.of(
            new JtlvBlock(FormulaSlot.SYS_INIT, "-- valid initial system states", ""),
            new JtlvBlock(FormulaSlot.SYS_SAFETY, "-- safety requirement on system", "[]"),
            new JtlvBlock(FormulaSlot.SYS_PROGRESS, "-- progress requirement on system", "[]<>"))));
  }

  private record JtlvBlock(FormulaSlot slot, String comment, String operator) {}

  private String jtlv(List<JtlvBlock> blocks) {
    StringBuilder output = new StringBuilder();
    for (JtlvBlock block : blocks) {
      boolean commented = false;
      for (String formula : formulas.get(block.slot())) {
        if (output.length() > 0) {
          output.append(" & \n");
        }
        if (!commented) {
          output.append(block.comment()).append('\n');
          commented = true;
        }
        output.append('\t');
        if (block.operator().isEmpty()) {
          output.append(formula);
        } else {
          output.append(block.operator()).append('(').append(formula).append(')');
        }
      }
    }
    return output.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof GrSpec other
        && envVariables.equals(other.envVariables)
        && sysVariables.equals(other.sysVariables)
        && formulas.equals(other.formulas)
        && List.copyOf(envVariables.keySet()).equals(List.copyOf(other.envVariables.keySet()))
        && List.copyOf(sysVariables.keySet()).equals(List.copyOf(other.sysVariables.keySet()));
  }

  @Override
  public int hashCode() {
    return Objects.hash(envVariables, sysVariables, formulas);
  }

  @Override
  public String toString() {
    return toGr1c();
  }

  public static final class Builder {
    private final GrSpec spec = new GrSpec();

    private Builder() {}

    public Builder env(String... names) {
      for (String name : names) {
        spec.addEnvVariable(name, Domain.BOOLEAN);
      }
      return this;
    }

    public Builder env(String name, Domain domain) {
      spec.addEnvVariable(name, domain);
      return this;
    }

    public Builder sys(String... names) {
      for (String name : names) {
        spec.addSysVariable(name, Domain.BOOLEAN);
      }
      return this;
    }

    public Builder sys(String name, Domain domain) {
      spec.addSysVariable(name, domain);
      return this;
    }

    public Builder envInit(String... formulas) {
      spec.add(FormulaSlot.ENV_INIT, formulas);
      return this;
    }

    public Builder envSafety(String... formulas) {
      spec.add(FormulaSlot.ENV_SAFETY, formulas);
      return this;
    }

    public Builder envProgress(String... formulas) {
      spec.add(FormulaSlot.ENV_PROGRESS, formulas);
      return this;
    }

    public Builder sysInit(String... formulas) {
      spec.add(FormulaSlot.SYS_INIT, formulas);
      return this;
    }

    public Builder sysSafety(String... formulas) {
      spec.add(FormulaSlot.SYS_SAFETY, formulas);
      return this;
    }

    public Builder sysProgress(String... formulas) {
      spec.add(FormulaSlot.SYS_PROGRESS, formulas);
      return this;
    }

    public GrSpec build() {
      return spec.copy();
    }
  }
}
