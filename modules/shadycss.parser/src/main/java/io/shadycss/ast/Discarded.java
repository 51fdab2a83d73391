package io.shadycss.ast;

import java.util.Objects;

/**
 * Source text that could not be parsed as any other kind of rule. {@code text} is the verbatim
 * slice of the source covered by {@code range}.
 */
public record Discarded(String text, Range range) implements Rule {

    public Discarded {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.DISCARDED;
    }
}
