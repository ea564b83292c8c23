package com.grpatch.output;

import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import java.io.PrintStream;
import java.util.stream.Collectors;

/**
 * Writes the line oriented JTLV strategy format. Mode and rgrad are not part of the format and
 * get lost when reading the output back.
 */
public final class JtlvAutomatonWriter {
    private JtlvAutomatonWriter() {
    }

    public static String toText(Automaton automaton) {
        return Rendering.render(stream -> write(automaton, stream));
    }

    public static void write(Automaton automaton, PrintStream writer) {
        for (AutomatonNode node : automaton.nodes()) {
            writer.append("State %d with rank # -> <%s>\n".formatted(node.id(), node.state().asMap().entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining(", "))));
            if (node.successors().isEmpty()) {
                writer.append("\tWith no successors.\n");
            } else {
                writer.append("\tWith successors : %s\n".formatted(node.successors().intStream()
                    .mapToObj(Integer::toString)
                    .collect(Collectors.joining(", "))));
            }
        }
    }
}
