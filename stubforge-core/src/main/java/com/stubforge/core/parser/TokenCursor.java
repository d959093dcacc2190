package com.stubforge.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Position over an indexed token list.
 *
 * <p>Tracks the 1-based source line of the next token so parse errors can point at it.
 */
final class TokenCursor {

    private final List<String> tokens;
    private int position;
    private int line = 1;

    TokenCursor(List<String> tokens) {
        this.tokens = tokens;
    }

    static TokenCursor over(String text) {
        return new TokenCursor(Lexer.tokens(text).toList());
    }

    boolean atEnd() {
        return position >= tokens.size();
    }

    int line() {
        return line;
    }

    Optional<String> peek() {
        return atEnd() ? Optional.empty() : Optional.of(tokens.get(position));
    }

    Optional<String> next() {
        if (atEnd()) {
            return Optional.empty();
        }
        String token = tokens.get(position++);
        if (Lexer.isEol(token)) {
            line++;
        }
        return Optional.of(token);
    }

    /**
     * Skips empty and end-of-line tokens and returns the next meaningful one.
     *
     * @return next non-blank token, or empty at end of input
     */
    Optional<String> nextSignificant() {
        while (!atEnd()) {
            String token = next().orElseThrow();
            if (!token.isEmpty() && !Lexer.isEol(token)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * Consumes the remaining tokens of the current line, including its end-of-line token.
     *
     * @return the tokens joined by single spaces, as they appeared in the source
     */
    String restOfLine() {
        List<String> parts = new ArrayList<>();
        while (!atEnd()) {
            String token = next().orElseThrow();
            if (Lexer.isEol(token)) {
                break;
            }
            parts.add(token);
        }
        return String.join(" ", parts);
    }

    /**
     * Reads the block of lines that starts at the current position and ends at a blank
     * line or at end of input. The terminating blank line is consumed.
     *
     * @return trimmed lines of the block
     */
    List<String> textBlock() {
        List<String> lines = new ArrayList<>();
        while (!atEnd()) {
            String line = restOfLine().trim();
            if (line.isEmpty()) {
                break;
            }
            lines.add(line);
        }
        return lines;
    }
}
