package io.shadycss.ast;

import java.util.Objects;

/**
 * An at-rule, such as {@code @media screen { ... }} or {@code @apply --mixin;}.
 *
 * @param name the name of the at-rule without the leading {@code @}, for example {@code media}
 * @param parameters the text between the name and the body or terminator, or an empty string
 * @param rulelist the body of a block-form at-rule, or {@code null} for a statement-form at-rule
 * @param nameRange the range of {@code name}
 * @param parametersRange the range of {@code parameters}, or {@code null} if there are none
 * @param range the range of the entire at-rule, starting at the {@code @}
 */
public record AtRule(String name,
                     String parameters,
                     Rulelist rulelist,
                     Range nameRange,
                     Range parametersRange,
                     Range range)
        implements Rule {

    public AtRule {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Objects.requireNonNull(nameRange, "nameRange cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }

    public boolean hasRulelist() {
        return rulelist != null;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.AT_RULE;
    }
}
