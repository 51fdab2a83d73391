package io.shadycss.ast;

import java.util.List;
import java.util.Objects;

/**
 * The root of the syntax tree.
 *
 * @param rules the top-level rules, in source order
 * @param range the range of the entire source text
 */
public record Stylesheet(List<Rule> rules, Range range) implements Node {

    public Stylesheet {
        rules = List.copyOf(rules);
        Objects.requireNonNull(range, "range cannot be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.STYLESHEET;
    }
}
