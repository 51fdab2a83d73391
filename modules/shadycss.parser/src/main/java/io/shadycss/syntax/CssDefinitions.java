package io.shadycss.syntax;

/*
 * Code points the shady CSS tokenizer treats specially.
 */
public final class CssDefinitions {

    public static final char QUOTATION_MARK = '"';
    public static final char APOSTROPHE = '\'';
    public static final char LEFT_PARENTHESIS = '(';
    public static final char RIGHT_PARENTHESIS = ')';
    public static final char LEFT_CURLY_BRACKET = '{';
    public static final char RIGHT_CURLY_BRACKET = '}';
    public static final char COLON = ':';
    public static final char SEMICOLON = ';';
    public static final char COMMERCIAL_AT = '@';
    public static final char SOLIDUS = '/';
    public static final char REVERSE_SOLIDUS = '\\';
    public static final char ASTERISK = '*';
    public static final char SPACE = ' ';
    public static final char CHARACTER_TABULATION = '\t';
    public static final char LINE_FEED = '\n';
    public static final char CARRIAGE_RETURN = '\r';
    public static final char FORM_FEED = '\u000C';

    private CssDefinitions() {}

    // https://www.w3.org/TR/css-syntax-3/#whitespace
    public static boolean isWhitespace(int codePoint) {
        return codePoint == SPACE
            || codePoint == CHARACTER_TABULATION
            || codePoint == LINE_FEED
            || codePoint == CARRIAGE_RETURN
            || codePoint == FORM_FEED;
    }

    public static boolean isNewline(int codePoint) {
        return codePoint == LINE_FEED || codePoint == CARRIAGE_RETURN || codePoint == FORM_FEED;
    }

    /**
     * Returns whether the code point is emitted as a single-character token of its own.
     */
    public static boolean isStructural(int codePoint) {
        return switch (codePoint) {
            case COMMERCIAL_AT, COLON, SEMICOLON,
                 LEFT_CURLY_BRACKET, RIGHT_CURLY_BRACKET,
                 LEFT_PARENTHESIS, RIGHT_PARENTHESIS -> true;
            default -> false;
        };
    }

    public static boolean isQuote(int codePoint) {
        return codePoint == QUOTATION_MARK || codePoint == APOSTROPHE;
    }
}
