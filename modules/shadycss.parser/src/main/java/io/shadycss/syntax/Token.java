package io.shadycss.syntax;

import io.shadycss.ast.Range;
import java.util.Objects;

/**
 * A lexeme of the token stream.
 * <p>
 * {@code start} and {@code end} are the half-open character offsets of the lexeme in the source
 * text, and {@code index} is its position in the stream of the {@link Tokenizer} that produced it.
 * Neighbouring tokens are looked up through {@link Tokenizer#previous(Token)} and
 * {@link Tokenizer#next(Token)}.
 */
public record Token(TokenType type, int start, int end, int index) {

    public Token {
        Objects.requireNonNull(type, "type cannot be null");

        if (type.isCategory()) {
            throw new IllegalArgumentException("type cannot be a category: " + type);
        }

        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid offsets: [" + start + ", " + end + ")");
        }

        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative");
        }
    }

    public boolean is(TokenType type) {
        return type.matches(this.type);
    }

    public int length() {
        return end - start;
    }

    public Range range() {
        return new Range(start, end);
    }

    @Override
    public String toString() {
        return "<" + type.name().toLowerCase().replace('_', '-') + ">[" + start + ", " + end + ")";
    }
}
