package com.grpatch.parser;

import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import java.util.Collection;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the line oriented strategy format of JTLV:
 *
 * <pre>
 * State 0 with rank 0 -&gt; &lt;park:1, cellID:0&gt;
 *     With successors : 1, 2
 * </pre>
 *
 * <p>Other lines are ignored. Ranks are not kept.
 */
public final class JtlvAutomatonParser {
    private static final Logger log = Logger.getLogger(JtlvAutomatonParser.class.getName());

    private static final Pattern STATE = Pattern.compile("State (\\d+)");
    private static final Pattern ASSIGNMENT = Pattern.compile("([\\w.]+):(-?\\w+)");
    private static final Pattern SUCCESSOR = Pattern.compile(" (\\d+)");

    private JtlvAutomatonParser() {
    }

    /**
     * @param variables expected variable names; if not empty, unknown and unassigned variables are
     *     reported as warnings
     */
    public static Automaton parse(String text, Collection<String> variables) {
        Automaton automaton = new Automaton();
        int current = -1;
        for (String line : text.split("\\R")) {
            if (line.contains("State ")) {
                Matcher state = STATE.matcher(line);
                if (!state.find()) {
                    continue;
                }
                current = ParseUtil.parseInt(state.group(1), "state id");
                int id = current;
                String valuation = line.substring(line.indexOf("->") + 1);
                Valuation.Builder builder = Valuation.builder();
                Matcher assignment = ASSIGNMENT.matcher(valuation);
                while (assignment.find()) {
                    String name = assignment.group(1);
                    if (!variables.isEmpty() && !variables.contains(name)) {
                        log.log(Level.WARNING, () -> "Unknown variable %s in state %d".formatted(name, id));
                    }
                    builder.put(name, ParseUtil.parseValue(assignment.group(2), "state " + id));
                }
                Valuation parsed = builder.build();
                for (String name : variables) {
                    if (!parsed.contains(name)) {
                        log.log(Level.WARNING, () -> "Variable %s not assigned in state %d".formatted(name, id));
                    }
                }
                automaton.setState(id, parsed);
            }
            if (line.contains("successors") && current >= 0) {
                IntLinkedOpenHashSet successors = new IntLinkedOpenHashSet();
                Matcher successor = SUCCESSOR.matcher(line);
                while (successor.find()) {
                    successors.add(ParseUtil.parseInt(successor.group(1), "successor of state " + current));
                }
                automaton.setTransitions(current, successors);
            }
        }
        automaton.validate();
        return automaton;
    }
}
