package io.shadycss.ast;

import java.util.Objects;

/**
 * The opaque text of a declaration value, without surrounding whitespace.
 */
public record Expression(String text, Range range) implements DeclarationValue {

    public Expression {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.EXPRESSION;
    }
}
