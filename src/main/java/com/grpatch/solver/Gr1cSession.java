package com.grpatch.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.util.concurrent.Uninterruptibles;
import com.grpatch.model.Valuation;
import com.grpatch.spec.GrSpec;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * Interactive gr1c session ({@code gr1c -i}). States are exchanged as integer vectors with the
 * environment variables first, in the order given at construction. gr1c has to be built without
 * GNU Readline, otherwise commands are echoed back.
 *
 * <p>Not thread safe. Every query blocks until the complete response has been read.
 */
public final class Gr1cSession implements AutoCloseable {
  private static final Logger log = Logger.getLogger(Gr1cSession.class.getName());
  private static final String END_OF_LIST = "---";

  private final EngineConfig config;
  private final List<String> envVariables;
  private final List<String> sysVariables;
  private Path specFile;
  @Nullable
  private Process process;
  @Nullable
  private BufferedReader reader;
  @Nullable
  private Writer writer;

  public Gr1cSession(EngineConfig config, Path specFile, List<String> envVariables, List<String> sysVariables) {
    this.config = requireNonNull(config);
    this.specFile = requireNonNull(specFile);
    this.envVariables = List.copyOf(envVariables);
    this.sysVariables = List.copyOf(sysVariables);
    start();
  }

  /** Writes {@code spec} to {@code specFile} and opens a session on it. */
  public static Gr1cSession open(EngineConfig config, GrSpec spec, Path specFile) throws IOException {
    Files.writeString(specFile, spec.toGr1c(), StandardCharsets.UTF_8);
    return new Gr1cSession(config, specFile, spec.envVariables(), spec.sysVariables());
  }

  private void start() {
    ProcessBuilder processBuilder = new ProcessBuilder(config.binary(), "-i", specFile.toString());
    processBuilder.redirectErrorStream(true);
    try {
      process = processBuilder.start();
    } catch (IOException e) {
      throw new EngineExecutionException("gr1c session could not be started", e);
    }
    reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    log.log(Level.FINE, () -> "Started interactive gr1c on %s".formatted(specFile));
  }

  public boolean isOpen() {
    return process != null;
  }

  public boolean isWinning(Valuation state) {
    send("winning " + vector(state));
    return readLine().contains("True");
  }

  /** Index of {@code state} in the winning set sequence for the given goal mode. */
  public int getIndex(Valuation state, int goalMode) {
    checkGoalMode(goalMode);
    send("getindex %s %d".formatted(vector(state), goalMode));
    return parseInt(readLine());
  }

  public List<Valuation> envNext(Valuation state) {
    send("envnext " + vector(state));
    return readMoves(envVariables);
  }

  /** Next system moves that are consistent with some winning strategy for the goal mode. */
  public List<Valuation> sysNextFeasible(Valuation state, Valuation envMove, int goalMode) {
    checkGoalMode(goalMode);
    send("sysnext %s %s %d".formatted(vector(state), envVector(envMove), goalMode));
    return readMoves(sysVariables);
  }

  /** All next system moves permitted by the safety formula, winning or not. */
  public List<Valuation> sysNextAll(Valuation state, Valuation envMove) {
    send("sysnexta %s %s".formatted(vector(state), envVector(envMove)));
    return readMoves(sysVariables);
  }

  /** Variable listing of gr1c, with the vector index of each variable in parentheses. */
  public String variables() {
    send("var");
    return readLine();
  }

  public int numGoals() {
    send("numgoals");
    return parseInt(readLine());
  }

  /**
   * Ends the running process and starts a new one on {@code newSpecFile}, or on the previous file
   * if null. Returns false, leaving the session closed, if the old process did not exit cleanly.
   */
  public boolean reset(@Nullable Path newSpecFile) {
    if (process != null && quit() != 0) {
      return false;
    }
    if (newSpecFile != null) {
      specFile = newSpecFile;
    }
    start();
    return true;
  }

  @Override
  public void close() {
    if (process != null) {
      int exitCode = quit();
      if (exitCode != 0) {
        log.log(Level.WARNING, () -> "gr1c session on %s exited with %d".formatted(specFile, exitCode));
      }
    }
  }

  private int quit() {
    Process running = requireNonNull(process);
    try {
      send("quit");
      return Uninterruptibles.getUninterruptibly(running.onExit()).exitValue();
    } catch (ExecutionException e) {
      throw new EngineExecutionException("Failed to wait for gr1c session", e);
    } finally {
      if (running.isAlive()) {
        running.destroy();
      }
      process = null;
      reader = null;
      writer = null;
    }
  }

  private void checkGoalMode(int goalMode) {
    int goals = numGoals();
    checkArgument(0 <= goalMode && goalMode < goals, "Invalid goal mode requested: %s", goalMode);
  }

  private String vector(Valuation state) {
    List<String> variables = new ArrayList<>(envVariables);
    variables.addAll(sysVariables);
    return ChangeCommand.vector(state.toVector(variables));
  }

  private String envVector(Valuation envMove) {
    return ChangeCommand.vector(envMove.toVector(envVariables));
  }

  private void send(String command) {
    checkState(writer != null, "Session is closed");
    log.log(Level.FINEST, () -> "gr1c <- " + command);
    try {
      writer.write(command);
      writer.write('\n');
      writer.flush();
    } catch (IOException e) {
      throw new EngineExecutionException("Failed to send '%s' to gr1c".formatted(command), e);
    }
  }

  private String readLine() {
    checkState(reader != null, "Session is closed");
    String line;
    try {
      line = reader.readLine();
    } catch (IOException e) {
      throw new EngineExecutionException("Failed to read from gr1c", e);
    }
    if (line == null) {
      throw new EngineExecutionException("gr1c session ended unexpectedly");
    }
    log.log(Level.FINEST, () -> "gr1c -> " + line);
    String prompt = config.prompt();
    if (!prompt.isEmpty() && line.contains(prompt)) {
      return line.substring(line.indexOf(prompt) + prompt.length());
    }
    return line;
  }

  private List<Valuation> readMoves(List<String> variables) {
    List<Valuation> moves = new ArrayList<>();
    for (String line = readLine(); !line.contains(END_OF_LIST); line = readLine()) {
      int[] values = Arrays.stream(line.trim().split("\\s+")).mapToInt(Gr1cSession::parseInt).toArray();
      if (values.length != variables.size()) {
        throw new EngineExecutionException("Expected %d values, got '%s'".formatted(variables.size(), line));
      }
      moves.add(Valuation.fromVector(variables, values));
    }
    return moves;
  }

  private static int parseInt(String text) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      throw new EngineExecutionException("Unexpected gr1c response '%s'".formatted(text), e);
    }
  }

  @Override
  public String toString() {
    return "Gr1cSession[%s, %s]".formatted(specFile, Stream.of(envVariables, sysVariables)
        .map(variables -> String.join(" ", variables))
        .collect(Collectors.joining(" | ")));
  }
}
