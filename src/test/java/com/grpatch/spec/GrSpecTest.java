package com.grpatch.spec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.grpatch.model.Domain;
import com.grpatch.model.Partition;
import com.grpatch.model.Region;
import com.grpatch.model.Valuation;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Before;
import org.junit.Test;

public class GrSpecTest {
  private GrSpec spec;

  @Before
  public void setUp() {
    spec = GrSpec.builder()
        .env("x")
        .sys("y")
        .envInit("x")
        .sysInit("!y")
        .sysSafety("y' -> x")
        .sysProgress("y")
        .build();
  }

  @Test
  public void testToGr1c() {
    assertEquals("""
        ENV: x;
        SYS: y;

        ENVINIT: (x);
        ENVTRANS:;
        ENVGOAL:;

        SYSINIT: (!y);
        SYSTRANS: [](y' -> x);
        SYSGOAL: []<>(y);
        """, spec.toGr1c());
  }

  @Test
  public void testIntegerDeclarationsAndConjunctions() {
    spec.addSysVariable("n", Domain.range(0, 3));
    spec.add(FormulaSlot.SYS_INIT, "n = 0");
    String text = spec.toGr1c();
    assertTrue(text.contains("SYS: y n [0,3];\n"));
    assertTrue(text.contains("SYSINIT: (!y)\n& (n = 0);\n"));
  }

  @Test
  public void testReachGame() {
    assertTrue(spec.toGr1cReachGame().endsWith("SYSGOAL: <>(y);\n"));
  }

  @Test(expected = IllegalStateException.class)
  public void testReachGameWithTwoGoals() {
    spec.addSysGoal("!y");
    spec.toGr1cReachGame();
  }

  @Test
  public void testCopyIsIndependent() {
    GrSpec copy = spec.copy();
    assertEquals(spec, copy);
    copy.addSysGoal("x");
    copy.addSysVariable("z", Domain.BOOLEAN);
    assertNotEquals(spec, copy);
    assertEquals(List.of("y"), spec.formulas(FormulaSlot.SYS_PROGRESS));
    assertFalse(spec.isDeclared("z"));
  }

  @Test
  public void testDeclarations() {
    assertFalse(spec.addEnvVariable("y", Domain.BOOLEAN));
    assertTrue(spec.isEnvVariable("x"));
    assertEquals(List.of("x", "y"), spec.variables());
    assertTrue(spec.removeVariable("x"));
    assertEquals(List.of("y"), spec.variables());
  }

  @Test
  public void testGoals() {
    spec.add(FormulaSlot.SYS_PROGRESS, "", "x");
    assertEquals(List.of("y", "x"), spec.formulas(FormulaSlot.SYS_PROGRESS));
    assertEquals("y", spec.removeSysGoal(0));
    assertEquals(List.of("x"), spec.formulas(FormulaSlot.SYS_PROGRESS));
  }

  @Test
  public void testUndeclaredVariables() {
    assertTrue(spec.undeclaredVariables().isEmpty());
    spec.add(FormulaSlot.ENV_SAFETY, "z' | w.v");
    assertEquals(Set.of("z", "w.v"), spec.undeclaredVariables());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedConjunct() {
    spec.add(FormulaSlot.SYS_SAFETY, "x &");
    spec.checkFormulas();
  }

  @Test
  public void testSatisfies() {
    Valuation current = Valuation.of(Map.of("x", 0, "y", 0));
    assertTrue(spec.satisfies(FormulaSlot.SYS_INIT, current, null));
    assertFalse(spec.satisfies(FormulaSlot.SYS_SAFETY, current, current.with("y", 1)));
    assertTrue(spec.satisfies(FormulaSlot.SYS_SAFETY, current, Valuation.of(Map.of("x", 1, "y", 0))));
    assertTrue(spec.satisfies(FormulaSlot.SYS_SAFETY, current.with("x", 1), current.with("y", 1)));
  }

  @Test
  public void testSymbolSubstitution() {
    spec.add(FormulaSlot.SYS_SAFETY, "y1 | y & p'");
    spec.symbolSubstitute(Map.of("y", "a | b", "p'", "q'"));
    assertEquals(List.of("y' -> x", "y1 | (a | b) & (q')"), spec.formulas(FormulaSlot.SYS_SAFETY));
    assertEquals(List.of("!(a | b)"), spec.formulas(FormulaSlot.SYS_INIT));
    assertEquals(List.of("(a | b)"), spec.formulas(FormulaSlot.SYS_PROGRESS));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCyclicSubstitution() {
    spec.symbolSubstitute(Map.of("y", "x", "x", "y"));
  }

  @Test
  public void testImportDiscDynamics() {
    GrSpec robot = GrSpec.builder().sys("park").sysProgress("park").build();
    boolean[][] transitions = {{true, true}, {false, true}};
    Partition partition = new Partition(List.of("park"),
        List.of(Region.of(Set.of("park"), null), Region.of(Set.of(), null)),
        transitions, transitions, null);

    Map<String, Region> cells = robot.importDiscDynamics(partition, "cellID");
    assertEquals(List.of("cellID_0", "cellID_1"), List.copyOf(cells.keySet()));
    assertEquals(List.of("cellID_0", "cellID_1"), robot.sysVariables());
    assertEquals(List.of("(cellID_0)"), robot.formulas(FormulaSlot.SYS_PROGRESS));
    List<String> safety = robot.formulas(FormulaSlot.SYS_SAFETY);
    assertEquals("cellID_0 -> (cellID_0')", safety.get(0));
    assertEquals("cellID_1 -> (cellID_0' | cellID_1')", safety.get(1));
    assertTrue(robot.undeclaredVariables().isEmpty());
  }

  @Test
  public void testJtlv() {
    GrSpec.JtlvSpec jtlv = spec.toJtlv();
    assertEquals("-- valid initial env states\n\tx", jtlv.assumption());
    assertTrue(jtlv.guarantee().startsWith("-- valid initial system states\n\t!y & \n"));
    assertTrue(jtlv.guarantee().endsWith("[]<>(y)"));
  }
}
