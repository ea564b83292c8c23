package com.grpatch.gridworld;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.grpatch.model.Valuation;
import com.grpatch.spec.FormulaSlot;
import com.grpatch.spec.GrSpec;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

public class TrollsTest {
  private MovingObstacleGridWorld world;

  @Before
  public void setUp() {
    world = MovingObstacleGridWorld.load(GridWorlds.REFERENCE_TROLLS, "Y");
  }

  @Test
  public void testBooleanTrolls() {
    Trolls.TrollSpec trolls = Trolls.addTrolls(world, world.trolls(), "X", false, false);
    GrSpec spec = trolls.spec();
    assertEquals(60, spec.sysVariables().size());
    // 3x2 home at the left border and 2x2 home in the bottom-right corner
    assertEquals(10, spec.envVariables().size());
    assertTrue(spec.envVariables().contains("X_0_1_0"));
    assertTrue(spec.envVariables().contains("X_1_5_9"));
    assertTrue(spec.formulas(FormulaSlot.SYS_SAFETY).contains("!(Y_1_0' & X_0_1_0')"));
    assertTrue(spec.formulas(FormulaSlot.ENV_PROGRESS).containsAll(List.of("X_0_1_0", "X_1_5_9")));
    assertTrue(spec.undeclaredVariables().isEmpty());

    assertEquals(2, trolls.moves().size());
    assertEquals(5, trolls.moves().get(0).size());
    assertEquals(3, trolls.moves().get(1).size());
    assertEquals(1, trolls.moves().get(1).get(0).get("X_1_4_8"));
  }

  @Test
  public void testIntegerTrolls() {
    Trolls.TrollSpec trolls = Trolls.addTrolls(world, world.trolls(), "X", false, true);
    GrSpec spec = trolls.spec();
    assertEquals(List.of("Y_r", "Y_c"), spec.sysVariables());
    assertEquals(List.of("X_0_r", "X_0_c", "X_1_r", "X_1_c"), spec.envVariables());
    assertEquals(1, spec.domain("X_1_r").high());
    assertTrue(trolls.moves().get(1).contains(Valuation.of(Map.of("X_1_r", 1, "X_1_c", 1))));
  }

  @Test
  public void testStartAnywhere() {
    GrSpec fixed = Trolls.addTrolls(world, world.trolls(), "X", false, false).spec();
    GrSpec anywhere = Trolls.addTrolls(world, world.trolls(), "X", true, false).spec();
    assertEquals(fixed.formulas(FormulaSlot.ENV_INIT).size(), anywhere.formulas(FormulaSlot.ENV_INIT).size());
    assertTrue(anywhere.formulas(FormulaSlot.ENV_INIT).get(0).contains(" | "));
    assertFalse(fixed.formulas(FormulaSlot.ENV_INIT).get(0).contains(" | "));
  }

  @Test
  public void testMspecMatchesAddTrolls() {
    assertEquals(Trolls.addTrolls(world, world.trolls(), "X", false, false).spec(), world.mspec("X", false));
  }
}
