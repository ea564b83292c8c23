package com.grpatch.parser;

import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.List;

/**
 * Reads the plain text strategy format of gr1c, version 1. The first line holds the version, every
 * further line one node: {@code id s_1 .. s_n initial mode rgrad successor ..}, where
 * {@code s_1 .. s_n} are the values of the environment variables followed by the system variables.
 */
public final class Gr1cAutParser {
    public static final int VERSION = 1;

    private Gr1cAutParser() {
    }

    /** @param variables environment then system variables, in declaration order */
    public static Automaton parse(String text, List<String> variables) {
        Automaton automaton = new Automaton();
        boolean versionSeen = false;
        int lineNumber = 0;
        for (String line : text.split("\\R")) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (!versionSeen) {
                int version = ParseUtil.parseInt(trimmed, "version line");
                if (version != VERSION) {
                    throw new IllegalArgumentException("Unsupported gr1c aut version " + version);
                }
                versionSeen = true;
                continue;
            }

            String[] fields = trimmed.split("\\s+");
            String context = "line " + lineNumber;
            if (fields.length < variables.size() + 4) {
                throw new IllegalArgumentException("Too few fields in " + context);
            }
            int id = ParseUtil.parseInt(fields[0], context);
            int[] vector = new int[variables.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = ParseUtil.parseInt(fields[i + 1], context);
            }
            int position = variables.size() + 1;
            boolean initial = ParseUtil.parseInt(fields[position], context) != 0;
            int mode = ParseUtil.parseInt(fields[position + 1], context);
            int rgrad = ParseUtil.parseInt(fields[position + 2], context);
            IntArrayList successors = new IntArrayList();
            for (int i = position + 3; i < fields.length; i++) {
                successors.add(ParseUtil.parseInt(fields[i], context));
            }
            automaton.addNode(id, Valuation.fromVector(variables, vector), successors, mode, rgrad, initial);
        }
        automaton.validate();
        return automaton;
    }
}
