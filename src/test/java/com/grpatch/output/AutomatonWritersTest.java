package com.grpatch.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.grpatch.model.Automaton;
import com.grpatch.model.Domain;
import com.grpatch.model.Valuation;
import com.grpatch.spec.GrSpec;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class AutomatonWritersTest {
  private Automaton automaton;

  @Before
  public void setUp() {
    automaton = new Automaton();
    automaton.addNode(0, Valuation.builder().put("x", 1).put("y", 0).build(), IntList.of(1, 0), 0, 2, true);
    automaton.addNode(1, Valuation.builder().put("x", 0).put("y", 1).build(), IntList.of());
  }

  @Test
  public void testXmlV0() {
    assertEquals(String.join("\n",
        "<aut>",
        "  <node>",
        "    <id>0</id><name></name>",
        "    <child_list>1 0</child_list>",
        "    <state><item key=\"x\" value=\"1\" /><item key=\"y\" value=\"0\" /></state>",
        "  </node>",
        "  <node>",
        "    <id>1</id><name></name>",
        "    <child_list></child_list>",
        "    <state><item key=\"x\" value=\"0\" /><item key=\"y\" value=\"1\" /></state>",
        "  </node>",
        "</aut>",
        ""), AutomatonXmlWriter.toXml(automaton, AutomatonXmlWriter.Schema.V0));
  }

  @Test
  public void testXmlV1Annotations() {
    String xml = AutomatonXmlWriter.toXml(automaton, AutomatonXmlWriter.Schema.V1);
    assertEquals(0, xml.indexOf("<aut type=\"basic\">\n"));
    assertTrue(xml.contains("<id>0</id><anno>0 2</anno>"));
    assertTrue(xml.contains("<id>1</id><anno>-1 -1</anno>"));
  }

  @Test
  public void testXmlEscapesNames() {
    Automaton named = new Automaton();
    named.addNode(0, Valuation.of("a<\"b\">", 1), IntList.of());
    assertTrue(AutomatonXmlWriter.toXml(named, AutomatonXmlWriter.Schema.V0)
        .contains("<item key=\"a&lt;&quot;b&quot;&gt;\" value=\"1\" />"));
  }

  @Test
  public void testJtlv() {
    assertEquals("State 0 with rank # -> <x:1, y:0>\n"
        + "\tWith successors : 1, 0\n"
        + "State 1 with rank # -> <x:0, y:1>\n"
        + "\tWith no successors.\n", JtlvAutomatonWriter.toText(automaton));
  }

  @Test
  public void testGr1cAut() {
    assertEquals("1\n0 1 0 1 0 2 1 0\n1 0 1 0 -1 -1\n", Gr1cAutWriter.toText(automaton, List.of("x", "y")));
    assertEquals("1\n0 0 1 1 0 2 1 0\n1 1 0 0 -1 -1\n", Gr1cAutWriter.toText(automaton, List.of("y", "x")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGr1cAutMissingVariable() {
    Gr1cAutWriter.toText(automaton, List.of("x", "y", "z"));
  }

  @Test
  public void testStrategyJson() {
    GrSpec spec = GrSpec.builder().env("x").sys("y").sys("n", Domain.range(0, 3)).build();
    Automaton counting = automaton.copy();
    counting.updateStates(state -> state.with("n", 2));
    JsonObject json = StrategyJsonWriter.toJson(counting, spec);

    assertEquals(1, json.get("version").getAsInt());
    assertEquals("boolean", json.getAsJsonArray("ENV").get(0).getAsJsonObject().get("x").getAsString());
    JsonArray range = json.getAsJsonArray("SYS").get(1).getAsJsonObject().getAsJsonArray("n");
    assertEquals(0, range.get(0).getAsInt());
    assertEquals(3, range.get(1).getAsInt());

    JsonObject first = json.getAsJsonObject("nodes").getAsJsonObject("0");
    assertEquals("[1,0,2]", first.get("state").toString());
    assertEquals("[1,0]", first.get("trans").toString());
    assertTrue(first.get("initial").getAsBoolean());
    assertEquals(2, first.get("rgrad").getAsInt());
  }
}
