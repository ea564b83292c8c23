package com.grpatch.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import com.grpatch.model.Domain;
import com.grpatch.spec.GrSpec;
import java.io.PrintStream;
import java.util.List;

/** Writes strategies in the JSON format of gr1c, as read by {@code StrategyJsonParser}. */
public final class StrategyJsonWriter {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private StrategyJsonWriter() {
    }

    public static JsonObject toJson(Automaton automaton, GrSpec spec) {
        JsonObject json = new JsonObject();
        json.addProperty("version", 1);
        json.add("ENV", declarations(spec, spec.envVariables()));
        json.add("SYS", declarations(spec, spec.sysVariables()));
        List<String> variables = spec.variables();
        JsonObject nodes = new JsonObject();
        for (AutomatonNode node : automaton.nodes()) {
            JsonObject data = new JsonObject();
            JsonArray state = new JsonArray();
            for (int value : node.state().toVector(variables)) {
                state.add(value);
            }
            data.add("state", state);
            data.addProperty("mode", node.mode());
            data.addProperty("rgrad", node.rgrad());
            data.addProperty("initial", node.initial());
            JsonArray transitions = new JsonArray();
            for (int successor : node.successors()) {
                transitions.add(successor);
            }
            data.add("trans", transitions);
            nodes.add(Integer.toString(node.id()), data);
        }
        json.add("nodes", nodes);
        return json;
    }

    public static void write(Automaton automaton, GrSpec spec, PrintStream writer) {
        writer.append(GSON.toJson(toJson(automaton, spec))).append('\n');
    }

    private static JsonArray declarations(GrSpec spec, List<String> names) {
        JsonArray declarations = new JsonArray();
        for (String name : names) {
            Domain domain = spec.domain(name);
            JsonObject declaration = new JsonObject();
            if (domain.bool()) {
                declaration.addProperty(name, "boolean");
            } else {
                JsonArray range = new JsonArray();
                range.add(domain.low());
                range.add(domain.high());
                declaration.add(name, range);
            }
            declarations.add(declaration);
        }
        return declarations;
    }
}
