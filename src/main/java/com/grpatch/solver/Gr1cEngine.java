package com.grpatch.solver;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import com.grpatch.output.Gr1cAutWriter;
import com.grpatch.parser.AutomatonXmlParser;
import com.grpatch.parser.StrategyJsonParser;
import com.grpatch.spec.GrSpec;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * {@link SynthesisEngine} backed by the gr1c command line tool. Every call runs one gr1c process
 * and blocks until it has terminated; there is no timeout.
 */
public final class Gr1cEngine implements SynthesisEngine {
  private static final Logger log = Logger.getLogger(Gr1cEngine.class.getName());

  private final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
      .setThreadFactory(Executors.defaultThreadFactory())
      .setNameFormat("gr1c-io-%d")
      .setDaemon(true).build());
  private final EngineConfig config;

  public Gr1cEngine(EngineConfig config) {
    this.config = requireNonNull(config);
  }

  public Gr1cEngine() {
    this(EngineConfig.defaults());
  }

  public EngineConfig config() {
    return config;
  }

  /** Exit code and the two output streams of a finished gr1c process. */
  record Invocation(int exitCode, String output, String errors) {
    boolean succeeded() {
      return exitCode == 0;
    }
  }

  @Override
  public boolean checkSyntax(String specification) {
    return decide("Syntax check", List.of("-s"), specification);
  }

  @Override
  public boolean checkRealizable(GrSpec spec) {
    return checkRealizable(spec.toGr1c());
  }

  /** Realizability of a specification given in the gr1c input language. */
  public boolean checkRealizable(String specification) {
    return decide("Realizability check", List.of("-r"), specification);
  }

  @Override
  public Optional<Automaton> synthesize(GrSpec spec) {
    return synthesize(spec.toGr1c());
  }

  public Optional<Automaton> synthesize(String specification) {
    return strategy("Synthesis", withToolLog(List.of("-t", "json")), specification, StrategyJsonParser::parse);
  }

  @Override
  public Optional<Automaton> synthesizeReachGame(GrSpec spec) {
    List<String> arguments = new ArrayList<>(List.of("rg", "-t", "tulip"));
    arguments.addAll(config.toolLog().reachGameFlags());
    return strategy("Reachability game", arguments, spec.toGr1cReachGame(), AutomatonXmlParser::parse);
  }

  @Override
  public Optional<Automaton> patchLocalFixpoint(GrSpec spec, Automaton strategy, Collection<Valuation> neighborhood,
      List<ChangeCommand> changes) {
    String changeFile = ChangeFile.render(spec, neighborhood, changes);
    return patch("Local fixpoint patch", "patch_localfixpoint", spec, strategy, workspace -> List.of(
        "-e", workspace.write("changefile.edc", changeFile).toString()));
  }

  @Override
  public Optional<Automaton> addSysGoal(GrSpec spec, Automaton strategy, String goal, List<String> metricVariables) {
    return patch("Adding system goal", "add_sysgoal", spec, strategy, workspace -> List.of(
        "-f", goal, "-m", String.join(" ", metricVariables)));
  }

  @Override
  public Optional<Automaton> removeSysGoal(GrSpec spec, Automaton strategy, int index) {
    return patch("Removing system goal", "rm_sysgoal", spec, strategy, workspace -> List.of(
        "-r", Integer.toString(index)));
  }

  private interface PatchArguments {
    List<String> prepare(Workspace workspace) throws IOException;
  }

  private Optional<Automaton> patch(String operation, String baseName, GrSpec spec, Automaton strategy,
      PatchArguments patchArguments) {
    String strategyText = Gr1cAutWriter.toText(strategy, spec.variables());
    try (Workspace workspace = new Workspace(baseName)) {
      List<String> arguments = new ArrayList<>(withToolLog(List.of("patch")));
      arguments.addAll(List.of("-t", "json", "-a", "-"));
      arguments.addAll(patchArguments.prepare(workspace));
      arguments.add(workspace.write("specfile.spc", spec.toGr1c()).toString());
      return strategy(operation, arguments, strategyText, StrategyJsonParser::parse);
    } catch (IOException e) {
      log.log(Level.WARNING, "%s: could not write input files".formatted(operation), e);
      return Optional.empty();
    }
  }

  private List<String> withToolLog(List<String> arguments) {
    List<String> all = new ArrayList<>(arguments);
    all.addAll(config.toolLog().flags());
    return all;
  }

  private boolean decide(String operation, List<String> arguments, String input) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      Invocation invocation = run(withToolLog(arguments), input);
      log.log(Level.INFO, () -> "%s %s in %s".formatted(operation, invocation.succeeded() ? "passed" : "failed",
          stopwatch));
      if (!invocation.succeeded()) {
        logToolOutput(operation, invocation);
      }
      return invocation.succeeded();
    } catch (EngineExecutionException e) {
      log.log(Level.WARNING, operation + " could not run gr1c", e);
      return false;
    }
  }

  private Optional<Automaton> strategy(String operation, List<String> arguments, String input,
      Function<String, Automaton> parser) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Invocation invocation;
    try {
      invocation = run(arguments, input);
    } catch (EngineExecutionException e) {
      log.log(Level.WARNING, operation + " could not run gr1c", e);
      return Optional.empty();
    }
    if (!invocation.succeeded()) {
      log.log(Level.INFO, () -> "%s: no strategy (exit code %d) after %s".formatted(operation,
          invocation.exitCode(), stopwatch));
      logToolOutput(operation, invocation);
      return Optional.empty();
    }

    Automaton automaton;
    try {
      automaton = parser.apply(invocation.output());
    } catch (IllegalArgumentException e) {
      log.log(Level.WARNING, operation + ": malformed gr1c output", e);
      logToolOutput(operation, invocation);
      return Optional.empty();
    }
    if (automaton.isEmpty()) {
      log.log(Level.WARNING, () -> "%s: gr1c reported success but returned no nodes".formatted(operation));
      return Optional.empty();
    }
    log.log(Level.INFO, () -> "%s: strategy with %d nodes in %s".formatted(operation, automaton.size(), stopwatch));
    return Optional.of(automaton);
  }

  private void logToolOutput(String operation, Invocation invocation) {
    if (config.toolLog().enabled()) {
      log.log(Level.FINE, () -> "%s: gr1c output:%n%s%n%s".formatted(operation, invocation.output(),
          invocation.errors()));
    }
  }

  Invocation run(List<String> arguments, String input) {
    List<String> command = new ArrayList<>(arguments.size() + 1);
    command.add(config.binary());
    command.addAll(arguments);
    log.log(Level.FINE, () -> "Running " + String.join(" ", command));

    ProcessBuilder processBuilder = new ProcessBuilder(command);
    processBuilder.redirectErrorStream(false);
    Process process;
    try {
      process = processBuilder.start();
    } catch (IOException e) {
      throw new EngineExecutionException("gr1c process could not be started", e);
    }

    var writerFuture = executor.<Void>submit(() -> {
      try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(),
          StandardCharsets.UTF_8))) {
        writer.write(input);
      }
      return null;
    });
    var errorFuture = executor.submit(() -> {
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getErrorStream(),
          StandardCharsets.UTF_8))) {
        return reader.lines().collect(Collectors.joining("\n"));
      }
    });
    var readingFuture = executor.submit(() -> {
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(),
          StandardCharsets.UTF_8))) {
        return reader.lines().collect(Collectors.joining("\n"));
      }
    });

    try {
      Uninterruptibles.getUninterruptibly(writerFuture);
    } catch (ExecutionException e) {
      readingFuture.cancel(true);
      errorFuture.cancel(true);
      process.destroy();
      throw new EngineExecutionException("Failed to write to gr1c", e);
    }
    String errors;
    try {
      errors = Uninterruptibles.getUninterruptibly(errorFuture);
    } catch (ExecutionException e) {
      readingFuture.cancel(true);
      process.destroy();
      throw new EngineExecutionException("Failed to read from gr1c's error stream", e);
    }
    String output;
    try {
      output = Uninterruptibles.getUninterruptibly(readingFuture);
    } catch (ExecutionException e) {
      process.destroy();
      throw new EngineExecutionException("Failed to read from gr1c", e);
    }
    try {
      return new Invocation(Uninterruptibles.getUninterruptibly(process.onExit()).exitValue(), output, errors);
    } catch (ExecutionException e) {
      throw new EngineExecutionException("Failed to wait for gr1c", e);
    }
  }

  /** Input files of one call, removed again on close unless they are to be kept. */
  private final class Workspace implements AutoCloseable {
    private final String baseName;
    private final Path directory;
    private final boolean temporary;
    private final List<Path> files = new ArrayList<>();

    Workspace(String baseName) throws IOException {
      this.baseName = baseName;
      @Nullable Path configured = config.workDirectory();
      this.temporary = configured == null;
      this.directory = configured == null ? Files.createTempDirectory("grpatch") : configured;
    }

    Path write(String suffix, String content) throws IOException {
      Path file = directory.resolve(baseName + "_" + suffix);
      Files.writeString(file, content, StandardCharsets.UTF_8);
      files.add(file);
      return file;
    }

    @Override
    public void close() throws IOException {
      if (config.keepFiles()) {
        log.log(Level.FINE, () -> "Keeping %s".formatted(files));
        return;
      }
      for (Path file : files) {
        Files.deleteIfExists(file);
      }
      if (temporary) {
        Files.deleteIfExists(directory);
      }
    }
  }
}
