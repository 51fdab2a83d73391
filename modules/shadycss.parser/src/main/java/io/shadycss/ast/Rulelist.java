package io.shadycss.ast;

import java.util.List;
import java.util.Objects;

/**
 * The rules enclosed in one {@code { ... }} block, in source order. The range includes the braces.
 */
public record Rulelist(List<Rule> rules, Range range) implements DeclarationValue {

    public Rulelist {
        rules = List.copyOf(rules);
        Objects.requireNonNull(range, "range cannot be null");
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.RULELIST;
    }
}
