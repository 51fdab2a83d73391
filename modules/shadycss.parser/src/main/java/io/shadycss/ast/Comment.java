package io.shadycss.ast;

import java.util.Objects;

/**
 * A comment, with {@code value} holding its text including the opening and closing delimiters.
 */
public record Comment(String value, Range range) implements Rule {

    public Comment {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.COMMENT;
    }
}
