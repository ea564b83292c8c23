package com.grpatch.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.grpatch.grammar.Gr1cFormulaLexer;
import com.grpatch.grammar.Gr1cFormulaParser;
import com.grpatch.grammar.Gr1cFormulaVisitor;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

public final class ParseUtil {
    private static final BaseErrorListener THROWING_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ParseCancellationException("%d:%d %s".formatted(line, charPositionInLine, msg), e);
        }
    };

    private ParseUtil() {
    }

    /** Parses a single gr1c formula and applies the visitor to it. */
    public static <T> T parse(String formula, Gr1cFormulaVisitor<T> visitor) {
        try {
            Gr1cFormulaLexer lexer = new Gr1cFormulaLexer(CharStreams.fromString(formula));
            lexer.removeErrorListeners();
            lexer.addErrorListener(THROWING_LISTENER);
            CommonTokenStream tokens = new CommonTokenStream(lexer);
            Gr1cFormulaParser parser = new Gr1cFormulaParser(tokens);
            parser.removeErrorListeners();
            parser.setErrorHandler(new BailErrorStrategy());
            return visitor.visit(parser.formula());
        } catch (ParseCancellationException e) {
            throw new IllegalArgumentException("Failed to parse formula " + formula, e);
        }
    }

    static Stream<JsonElement> stream(JsonArray array) {
        if (array.isEmpty()) {
            return Stream.of();
        }
        return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
                Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
    }

    static int parseInt(String value, String context) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer '%s' in %s".formatted(value, context), e);
        }
    }

    /** Like {@link #parseInt}, but also accepts the boolean constants of model checker traces. */
    static int parseValue(String value, String context) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return 1;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return 0;
        }
        return parseInt(trimmed, context);
    }
}
