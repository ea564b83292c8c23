package com.grpatch.output;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

final class Rendering {
    private Rendering() {
    }

    static String render(Consumer<PrintStream> writer) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream stream = new PrintStream(buffer, false, StandardCharsets.UTF_8)) {
            writer.accept(stream);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
