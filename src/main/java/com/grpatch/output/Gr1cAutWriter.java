package com.grpatch.output;

import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Writes the plain text strategy format of gr1c, which its patching commands read. */
public final class Gr1cAutWriter {
    private Gr1cAutWriter() {
    }

    public static String toText(Automaton automaton, List<String> variables) {
        return Rendering.render(stream -> write(automaton, variables, stream));
    }

    /**
     * @param variables environment then system variables, in declaration order; every node must
     *     assign all of them
     */
    public static void write(Automaton automaton, List<String> variables, PrintStream writer) {
        writer.append("1\n");
        for (AutomatonNode node : automaton.nodes()) {
            IntStream fields = IntStream.concat(
                IntStream.concat(IntStream.of(node.id()), Arrays.stream(node.state().toVector(variables))),
                IntStream.concat(IntStream.of(node.initial() ? 1 : 0, node.mode(), node.rgrad()),
                    node.successors().intStream()));
            writer.append(fields.mapToObj(Integer::toString).collect(Collectors.joining(" "))).append('\n');
        }
    }
}
