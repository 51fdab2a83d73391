package io.shadycss.ast;

import java.util.Objects;

/**
 * A selector followed by a block of rules, such as {@code a:hover { color: red; }}.
 */
public record Ruleset(String selector, Rulelist rulelist, Range selectorRange, Range range) implements Rule {

    public Ruleset {
        Objects.requireNonNull(selector, "selector cannot be null");
        Objects.requireNonNull(rulelist, "rulelist cannot be null");
        Objects.requireNonNull(selectorRange, "selectorRange cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.RULESET;
    }
}
