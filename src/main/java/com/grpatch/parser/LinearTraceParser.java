package com.grpatch.parser;

import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads counterexample traces of model checkers as a lasso shaped automaton. A new node is only
 * created when the valuation changed since the previous state marker; the last node loops back to
 * the node following the loop marker, or has no successors if there is none.
 */
public final class LinearTraceParser {
    private static final Logger log = Logger.getLogger(LinearTraceParser.class.getName());

    public enum Dialect {
        SPIN("\\(state (\\d+)\\)", "^\\s*((?:\\w+\\(\\d+\\):)?\\w+) = (-?\\w+)", "<<<<<START OF CYCLE>>>>>"),
        SMV("State: \\d+\\.(\\d+)", "([\\w.]+) = (-?\\w+)", "-- Loop starts here");

        private final Pattern state;
        private final Pattern assignment;
        private final String loop;

        Dialect(String state, String assignment, String loop) {
            this.state = Pattern.compile(state);
            this.assignment = Pattern.compile(assignment);
            this.loop = loop;
        }
    }

    private LinearTraceParser() {
    }

    /**
     * @param variables expected variable names; if not empty, unknown variables are reported as
     *     warnings
     */
    public static Automaton parse(String trace, Dialect dialect, Collection<String> variables) {
        Automaton automaton = new Automaton();
        Map<String, Integer> valuation = new LinkedHashMap<>();
        int current = -1;
        int loop = -1;
        boolean changed = true;
        for (String line : trace.split("\\R")) {
            if (dialect.state.matcher(line).find()) {
                if (changed) {
                    if (current >= 0) {
                        automaton.setState(current, Valuation.of(valuation));
                        automaton.setTransitions(current, IntList.of(current + 1));
                    }
                    current++;
                }
                changed = false;
            } else if (line.contains(dialect.loop)) {
                loop = current + 1;
            } else {
                Matcher assignment = dialect.assignment.matcher(line);
                if (!assignment.find()) {
                    continue;
                }
                String name = assignment.group(1);
                if (!variables.isEmpty() && !variables.contains(name)) {
                    log.log(Level.WARNING, () -> "Unknown variable " + name);
                }
                int value = ParseUtil.parseValue(assignment.group(2), "assignment to " + name);
                Integer previous = valuation.put(name, value);
                if (previous == null || previous != value) {
                    changed = true;
                }
            }
        }
        if (current < 0) {
            return automaton;
        }
        automaton.setState(current, Valuation.of(valuation));
        if (loop >= 0) {
            automaton.setTransitions(current, IntList.of(Math.min(loop, current)));
        } else {
            automaton.setTransitions(current, IntList.of());
        }
        return automaton;
    }
}
