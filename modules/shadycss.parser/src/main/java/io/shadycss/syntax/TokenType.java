package io.shadycss.syntax;

/**
 * Kinds of tokens produced by the {@link Tokenizer}.
 * <p>
 * {@link #BOUNDARY} and {@link #PROPERTY_BOUNDARY} are categories rather than kinds: no token
 * has one of them as its type, but {@link Token#is(TokenType)} matches every member kind of a
 * category.
 */
public enum TokenType {

    WHITESPACE(0),
    COMMENT(0),
    WORD(0),
    AT(Flags.BOUNDARY),
    COLON(Flags.BOUNDARY),
    SEMICOLON(Flags.BOUNDARY | Flags.PROPERTY_BOUNDARY),
    OPEN_BRACE(Flags.BOUNDARY | Flags.PROPERTY_BOUNDARY),
    CLOSE_BRACE(Flags.BOUNDARY | Flags.PROPERTY_BOUNDARY),
    OPEN_PARENTHESIS(Flags.BOUNDARY),
    CLOSE_PARENTHESIS(Flags.BOUNDARY),

    /** Any structural symbol: {@code @ : ; { } ( )}. */
    BOUNDARY(Flags.BOUNDARY, true),

    /** The structural symbols that can terminate a declaration or ruleset: {@code { } ;}. */
    PROPERTY_BOUNDARY(Flags.PROPERTY_BOUNDARY, true);

    private final int flags;
    private final boolean category;

    TokenType(int flags) {
        this(flags, false);
    }

    TokenType(int flags, boolean category) {
        this.flags = flags;
        this.category = category;
    }

    public boolean isCategory() {
        return category;
    }

    /**
     * Returns whether a token of the specified kind matches this type, either because it is
     * the same kind or because this type is a category that includes it.
     */
    public boolean matches(TokenType kind) {
        if (this == kind) {
            return true;
        }

        return category && (kind.flags & flags) == flags;
    }

    private static final class Flags {
        static final int BOUNDARY = 1;
        static final int PROPERTY_BOUNDARY = 1 << 1;
    }
}
