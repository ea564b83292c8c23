package com.grpatch.solver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import com.grpatch.output.Gr1cAutWriter;
import com.grpatch.spec.FormulaSlot;
import com.grpatch.spec.GrSpec;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Runs the engine against a shell script that records its arguments and replays canned output. */
public class Gr1cEngineTest {
  private static final String STRATEGY = """
      {"ENV": ["x"], "SYS": ["y"],
       "nodes": {
         "0": {"state": [1, 0], "mode": 0, "rgrad": 1, "initial": true, "trans": [1, 2]},
         "1": {"state": [0, 0], "mode": 0, "rgrad": 1, "initial": false, "trans": [1, 2]},
         "2": {"state": [1, 1], "mode": 1, "rgrad": 0, "initial": false, "trans": [1, 0]}
       }}
      """;

  private static final GrSpec SPEC = GrSpec.builder()
      .env("x")
      .sys("y")
      .envInit("x")
      .envProgress("x")
      .sysInit("y")
      .sysProgress("y & x", "!y")
      .build();

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private Path directory;
  private Path script;

  @Before
  public void setUp() throws IOException {
    assumeTrue("Needs a POSIX shell", new File("/bin/sh").canExecute());
    directory = folder.getRoot().toPath();
    script = directory.resolve("fake-gr1c");
  }

  private Gr1cEngine engine(String output, int exitCode) throws IOException {
    Files.writeString(directory.resolve("output"), output, StandardCharsets.UTF_8);
    Files.writeString(script, String.join("\n",
        "#!/bin/sh",
        "printf '%%s\\n' \"$@\" > '%s'".formatted(directory.resolve("args")),
        "cat > '%s'".formatted(directory.resolve("stdin")),
        "cat '%s'".formatted(directory.resolve("output")),
        "exit " + exitCode,
        ""), StandardCharsets.UTF_8);
    assumeTrue(script.toFile().setExecutable(true));
    return new Gr1cEngine(new EngineConfig(script.toString(), ToolLog.NONE, EngineConfig.DEFAULT_PROMPT,
        null, false));
  }

  private List<String> arguments() throws IOException {
    return Files.readAllLines(directory.resolve("args"), StandardCharsets.UTF_8);
  }

  private String input() throws IOException {
    return Files.readString(directory.resolve("stdin"), StandardCharsets.UTF_8);
  }

  @Test
  public void testSynthesize() throws IOException {
    Optional<Automaton> strategy = engine(STRATEGY, 0).synthesize(SPEC);
    assertTrue(strategy.isPresent());
    assertEquals(3, strategy.get().size());
    assertEquals(Valuation.of(Map.of("x", 1, "y", 1)), strategy.get().node(2).state());
    assertEquals(List.of("-t", "json"), arguments());
    assertEquals(SPEC.toGr1c(), input());
  }

  @Test
  public void testToolLogFlags() throws IOException {
    engine(STRATEGY, 0);
    Gr1cEngine verbose = new Gr1cEngine(new EngineConfig(script.toString(), ToolLog.VERBOSE,
        EngineConfig.DEFAULT_PROMPT, null, false));
    assertTrue(verbose.synthesize(SPEC).isPresent());
    assertEquals(List.of("-t", "json", "-l", "-vv"), arguments());
  }

  @Test
  public void testUnrealizable() throws IOException {
    Gr1cEngine engine = engine("", 1);
    assertTrue(engine.synthesize(SPEC).isEmpty());
    assertFalse(engine.checkRealizable(SPEC));
    assertEquals(List.of("-r"), arguments());
  }

  @Test
  public void testRealizable() throws IOException {
    assertTrue(engine("", 0).checkRealizable(SPEC));
  }

  @Test
  public void testSyntaxCheck() throws IOException {
    assertTrue(engine("", 0).checkSyntax("ENV:; SYS:;"));
    assertEquals(List.of("-s"), arguments());
    assertEquals("ENV:; SYS:;", input());
  }

  @Test
  public void testEmptyStrategyIsFailure() throws IOException {
    assertTrue(engine("{\"ENV\": [\"x\"], \"SYS\": [\"y\"], \"nodes\": {}}", 0).synthesize(SPEC).isEmpty());
  }

  @Test
  public void testMalformedOutputIsFailure() throws IOException {
    assertTrue(engine("Segmentation fault", 0).synthesize(SPEC).isEmpty());
  }

  @Test
  public void testWrongStrategyShapeIsFailure() throws IOException {
    assertTrue(engine("{\"ENV\": [], \"SYS\": [], \"nodes\": []}", 0).synthesize(SPEC).isEmpty());
  }

  @Test
  public void testMissingBinary() {
    Gr1cEngine engine = new Gr1cEngine(EngineConfig.defaults()
        .withBinary(directory.resolve("missing").toString())
        .withToolLog(ToolLog.NONE));
    assertTrue(engine.synthesize(SPEC).isEmpty());
    assertFalse(engine.checkSyntax("ENV:; SYS:;"));
  }

  @Test
  public void testReachGame() throws IOException {
    GrSpec reach = GrSpec.builder().env("x").sys("y").envInit("x").envProgress("x & y").sysInit("!y")
        .sysProgress("y").build();
    String xml = """
        <tulipcon xmlns="http://tulip-control.sourceforge.net/ns/1" version="1">
          <aut type="basic">
            <node><id>0</id><anno></anno><child_list></child_list>
              <state><item key="x" value="1" /><item key="y" value="1" /></state></node>
            <node><id>1</id><anno></anno><child_list></child_list>
              <state><item key="x" value="0" /><item key="y" value="1" /></state></node>
            <node><id>2</id><anno></anno><child_list> 1 0</child_list>
              <state><item key="x" value="1" /><item key="y" value="0" /></state></node>
          </aut>
        </tulipcon>
        """;
    Automaton strategy = engine(xml, 0).synthesizeReachGame(reach).orElseThrow();
    assertEquals(3, strategy.size());
    assertEquals(List.of("rg", "-t", "tulip"), arguments());
    assertEquals(reach.toGr1cReachGame(), input());
  }

  @Test
  public void testPatchLocalFixpoint() throws IOException {
    Path work = folder.newFolder("work").toPath();
    engine(STRATEGY, 0);
    Gr1cEngine engine = new Gr1cEngine(new EngineConfig(script.toString(), ToolLog.NONE,
        EngineConfig.DEFAULT_PROMPT, work, true));
    Automaton strategy = engine.synthesize(SPEC).orElseThrow();

    List<Valuation> neighborhood = List.of(Valuation.of(Map.of("x", 1, "y", 1)));
    List<ChangeCommand> changes = List.of(ChangeCommand.blockSys(Valuation.of("y", 1)));
    assertTrue(engine.patchLocalFixpoint(SPEC, strategy, neighborhood, changes).isPresent());

    Path changeFile = work.resolve("patch_localfixpoint_changefile.edc");
    Path specFile = work.resolve("patch_localfixpoint_specfile.spc");
    assertEquals(List.of("patch", "-t", "json", "-a", "-", "-e", changeFile.toString(), specFile.toString()),
        arguments());
    assertEquals(Gr1cAutWriter.toText(strategy, SPEC.variables()), input());
    assertEquals("1 1\nblocksys 1\n", Files.readString(changeFile, StandardCharsets.UTF_8));
    assertEquals(SPEC.toGr1c(), Files.readString(specFile, StandardCharsets.UTF_8));
  }

  @Test
  public void testPatchFilesAreRemoved() throws IOException {
    Path work = folder.newFolder("work").toPath();
    engine(STRATEGY, 0);
    Gr1cEngine engine = new Gr1cEngine(new EngineConfig(script.toString(), ToolLog.NONE,
        EngineConfig.DEFAULT_PROMPT, work, false));
    Automaton strategy = engine.synthesize(SPEC).orElseThrow();
    engine.removeSysGoal(SPEC, strategy, 1);

    assertEquals(List.of("patch", "-t", "json", "-a", "-", "-r", "1",
        work.resolve("rm_sysgoal_specfile.spc").toString()), arguments());
    try (var files = Files.list(work)) {
      assertEquals(0, files.count());
    }
  }

  @Test
  public void testAddSysGoal() throws IOException {
    Gr1cEngine engine = engine(STRATEGY, 0);
    Automaton strategy = engine.synthesize(SPEC).orElseThrow();
    GrSpec withoutGoal = SPEC.copy();
    withoutGoal.remove(FormulaSlot.SYS_PROGRESS, 1);
    assertTrue(engine.addSysGoal(withoutGoal, strategy, "!y", List.of("x", "y")).isPresent());
    List<String> arguments = arguments();
    assertEquals(List.of("patch", "-t", "json", "-a", "-", "-f", "!y", "-m", "x y"), arguments.subList(0, 9));
    assertTrue(arguments.get(9).endsWith("add_sysgoal_specfile.spc"));
  }

  @Test
  public void testAgainstGr1c() {
    Optional<String> binary = Gr1cBinary.find();
    assumeTrue("gr1c not installed", binary.isPresent());
    Gr1cEngine engine = new Gr1cEngine(EngineConfig.defaults().withBinary(binary.get()).withToolLog(ToolLog.NONE));

    assertFalse(engine.checkSyntax("[]foo"));
    GrSpec alternating = GrSpec.builder().env("x").sys("y").envInit("x").envProgress("x").sysInit("y")
        .sysSafety("y -> !y'", "!y -> y'").sysProgress("y & x").build();
    assertTrue(engine.checkSyntax(alternating.toGr1c()));
    assertFalse(engine.checkRealizable(alternating));
    alternating.set(FormulaSlot.SYS_SAFETY, List.of());
    assertTrue(engine.checkRealizable(alternating));

    Automaton strategy = engine.synthesize(SPEC).orElseThrow();
    assertEquals(3, strategy.size());
    assertTrue(strategy.findState(Valuation.of(Map.of("x", 1, "y", 0))).isPresent());
    assertTrue(strategy.findState(Valuation.of(Map.of("x", 0, "y", 0))).isPresent());
    assertTrue(strategy.findState(Valuation.of(Map.of("x", 1, "y", 1))).isPresent());
  }
}
