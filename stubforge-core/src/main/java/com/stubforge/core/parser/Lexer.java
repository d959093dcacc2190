package com.stubforge.core.parser;

import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Splits stub generator text into tokens.
 *
 * <p>Every line is split on single spaces, so runs of spaces produce empty tokens. An
 * {@link #EOL} token follows each line. Consumers decide whether empty tokens matter.
 */
public final class Lexer {

    /** End-of-line sentinel. Cannot collide with a real token since tokens never span lines. */
    public static final String EOL = "\n";

    private Lexer() {
    }

    /**
     * Returns a lazy token stream over {@code text}.
     *
     * @param text stub generator text
     * @return tokens, with {@link #EOL} after every line
     */
    public static Stream<String> tokens(String text) {
        return text.lines()
            .flatMap(line -> Stream.concat(Arrays.stream(line.split(" ", -1)), Stream.of(EOL)));
    }

    public static boolean isEol(String token) {
        return EOL.equals(token);
    }
}
