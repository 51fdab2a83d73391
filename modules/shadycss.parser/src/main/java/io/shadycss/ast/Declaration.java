package io.shadycss.ast;

import java.util.Objects;

/**
 * A property declaration.
 * <p>
 * The value is an {@link Expression} for an ordinary declaration such as {@code color: red;},
 * a {@link Rulelist} for a mixin-like declaration such as {@code --mixin: { color: red; };},
 * or {@code null} if nothing follows the name.
 */
public record Declaration(String name, DeclarationValue value, Range nameRange, Range range) implements Rule {

    public Declaration {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(nameRange, "nameRange cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isMixin() {
        return value instanceof Rulelist;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.DECLARATION;
    }
}
