package com.grpatch.output;

import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;
import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import java.io.PrintStream;
import java.util.Map;
import java.util.stream.Collectors;

/** Writes automata in the tulipcon XML format read by {@code AutomatonXmlParser}. */
public final class AutomatonXmlWriter {
    private static final Escaper ATTRIBUTE = XmlEscapers.xmlAttributeEscaper();

    /** {@code V0} has an empty name per node, {@code V1} annotates each node with its mode and rgrad. */
    public enum Schema {
        V0, V1
    }

    private AutomatonXmlWriter() {
    }

    public static String toXml(Automaton automaton, Schema schema) {
        return Rendering.render(stream -> write(automaton, schema, stream));
    }

    public static void write(Automaton automaton, Schema schema, PrintStream writer) {
        writer.append(schema == Schema.V1 ? "<aut type=\"basic\">\n" : "<aut>\n");
        for (AutomatonNode node : automaton.nodes()) {
            writer.append("  <node>\n");
            if (schema == Schema.V1) {
                writer.append("    <id>%d</id><anno>%d %d</anno>\n".formatted(node.id(), node.mode(), node.rgrad()));
            } else {
                writer.append("    <id>%d</id><name></name>\n".formatted(node.id()));
            }
            writer.append("    <child_list>%s</child_list>\n".formatted(node.successors().intStream()
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(" "))));
            writer.append("    <state>");
            for (Map.Entry<String, Integer> entry : node.state().asMap().entrySet()) {
                writer.append("<item key=\"%s\" value=\"%d\" />".formatted(ATTRIBUTE.escape(entry.getKey()),
                    entry.getValue()));
            }
            writer.append("</state>\n");
            writer.append("  </node>\n");
        }
        writer.append("</aut>\n");
    }
}
