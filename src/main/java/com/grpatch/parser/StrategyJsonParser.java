package com.grpatch.parser;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import com.grpatch.model.Valuation;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads strategies in the JSON format of gr1c. Variables are declared in the {@code ENV} and
 * {@code SYS} arrays, either as plain names or as single entry objects mapping the name to its
 * domain; their order defines the positional state vectors of the nodes.
 */
public final class StrategyJsonParser {
  private StrategyJsonParser() {}

  public static Automaton parse(String json) {
    try {
      return parse(JsonParser.parseString(json).getAsJsonObject());
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalArgumentException("Malformed strategy JSON", e);
    }
  }

  /** @throws IllegalArgumentException if an element is missing or has the wrong JSON type */
  public static Automaton parse(JsonObject json) {
    try {
      return parseNodes(json);
    } catch (ClassCastException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
      throw new IllegalArgumentException("Malformed strategy JSON", e);
    }
  }

  private static Automaton parseNodes(JsonObject json) {
    List<String> variables = new ArrayList<>(variables(json, "ENV"));
    variables.addAll(variables(json, "SYS"));

    Automaton automaton = new Automaton();
    JsonObject nodes = json.getAsJsonObject("nodes");
    checkArgument(nodes != null, "Missing nodes");
    for (Map.Entry<String, JsonElement> entry : nodes.entrySet()) {
      int id = ParseUtil.parseInt(entry.getKey(), "node id");
      JsonObject node = entry.getValue().getAsJsonObject();
      int[] vector = ParseUtil.stream(requiredArray(node, "state", "state of node " + id))
          .mapToInt(JsonElement::getAsInt)
          .toArray();
      if (vector.length != variables.size()) {
        throw new IllegalArgumentException("State of node %d has %d entries, expected %d"
            .formatted(id, vector.length, variables.size()));
      }
      IntList successors = IntList.of(ParseUtil.stream(requiredArray(node, "trans", "transitions of node " + id))
          .mapToInt(JsonElement::getAsInt)
          .toArray());
      automaton.addNode(id, Valuation.fromVector(variables, vector), successors,
          optionalInt(node, "mode"), optionalInt(node, "rgrad"),
          node.has("initial") && node.getAsJsonPrimitive("initial").getAsBoolean());
    }
    automaton.validate();
    return automaton;
  }

  private static List<String> variables(JsonObject json, String key) {
    return ParseUtil.stream(requiredArray(json, key, key + " variables"))
        .map(element -> {
          if (element.isJsonPrimitive()) {
            return element.getAsString();
          }
          JsonObject declaration = element.getAsJsonObject();
          if (declaration.size() != 1) {
            throw new IllegalArgumentException("Malformed variable declaration " + declaration);
          }
          return declaration.keySet().iterator().next();
        })
        .toList();
  }

  private static JsonArray requiredArray(JsonObject object, String key, String description) {
    JsonArray array = object.getAsJsonArray(key);
    checkArgument(array != null, "Missing %s", description);
    return array;
  }

  private static int optionalInt(JsonObject node, String key) {
    return node.has(key) ? node.getAsJsonPrimitive(key).getAsInt() : AutomatonNode.UNSET;
  }
}
