package io.shadycss.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.shadycss.syntax.CssDefinitions.*;

/**
 * Pull-based tokenizer for shady CSS.
 * <p>
 * The source text is scanned once, left to right, and only as far as callers ask for tokens.
 * Every token that has been scanned stays in an append-only list owned by the tokenizer, so the
 * neighbours of a token can be found by index in constant time.
 * <p>
 * The tokenizer recognizes the following lexemes:
 * <ul>
 *     <li>a run of whitespace, as one {@link TokenType#WHITESPACE} token
 *     <li>a comment {@code /* ... *}{@code /}, as one {@link TokenType#COMMENT} token; an unterminated
 *         comment extends to the end of the input
 *     <li>each of {@code @ : ; { } ( )}, as a single-character token of its own kind
 *     <li>everything else, as a {@link TokenType#WORD} token that runs until the next whitespace,
 *         structural symbol or comment; quoted strings and backslash escapes are part of the word
 * </ul>
 * Parentheses are not balanced here; that is left to the parser.
 * <p>
 * Instances are single-use and not thread-safe.
 */
public final class Tokenizer {

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int offset;
    private int cursor;

    public Tokenizer(String text) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    public String text() {
        return text;
    }

    /**
     * Returns the token at the read cursor without consuming it.
     *
     * @return the current token, or {@code null} if the end of the stream has been reached
     */
    public Token currentToken() {
        return tokenAt(cursor);
    }

    /**
     * Returns the token at the read cursor and moves the cursor to the next token.
     *
     * @return the consumed token, or {@code null} if the end of the stream has been reached
     */
    public Token advance() {
        Token token = tokenAt(cursor);
        if (token != null) {
            cursor++;
        }

        return token;
    }

    /**
     * Returns the token that precedes the specified token in the stream.
     *
     * @return the previous token, or {@code null} if {@code token} is the first token
     */
    public Token previous(Token token) {
        int index = checkOwned(token).index();
        return index > 0 ? tokens.get(index - 1) : null;
    }

    /**
     * Returns the token that follows the specified token in the stream, scanning it if necessary.
     *
     * @return the next token, or {@code null} if {@code token} is the last token
     */
    public Token next(Token token) {
        return tokenAt(checkOwned(token).index() + 1);
    }

    /**
     * Returns the source text of a single token.
     */
    public String slice(Token token) {
        return slice(token, null);
    }

    /**
     * Returns the source text that spans from the start of {@code from} to the end of {@code to},
     * including both tokens. If {@code to} is {@code null}, the text of {@code from} is returned.
     */
    public String slice(Token from, Token to) {
        Objects.requireNonNull(from, "from cannot be null");
        Token last = to != null ? to : from;

        if (last.end() < from.start()) {
            throw new IllegalArgumentException(from + " does not precede " + last);
        }

        return text.substring(from.start(), last.end());
    }

    private Token checkOwned(Token token) {
        Objects.requireNonNull(token, "token cannot be null");

        if (token.index() >= tokens.size() || tokens.get(token.index()) != token) {
            throw new IllegalArgumentException(token + " was not produced by this tokenizer");
        }

        return token;
    }

    private Token tokenAt(int index) {
        while (index >= tokens.size()) {
            if (!consumeToken()) {
                return null;
            }
        }

        return tokens.get(index);
    }

    /**
     * Scans a single token at the current offset and appends it to the token list.
     *
     * @return {@code false} if the end of the input has been reached
     */
    private boolean consumeToken() {
        if (offset >= text.length()) {
            return false;
        }

        int start = offset;
        TokenType type = switch (text.charAt(offset)) {
            case COMMERCIAL_AT -> consumeSymbol(TokenType.AT);
            case COLON -> consumeSymbol(TokenType.COLON);
            case SEMICOLON -> consumeSymbol(TokenType.SEMICOLON);
            case LEFT_CURLY_BRACKET -> consumeSymbol(TokenType.OPEN_BRACE);
            case RIGHT_CURLY_BRACKET -> consumeSymbol(TokenType.CLOSE_BRACE);
            case LEFT_PARENTHESIS -> consumeSymbol(TokenType.OPEN_PARENTHESIS);
            case RIGHT_PARENTHESIS -> consumeSymbol(TokenType.CLOSE_PARENTHESIS);
            default -> {
                if (isWhitespace(text.charAt(offset))) {
                    yield consumeWhitespace();
                }

                if (startsComment(offset)) {
                    yield consumeComment();
                }

                yield consumeWord();
            }
        };

        tokens.add(new Token(type, start, offset, tokens.size()));
        return true;
    }

    private TokenType consumeSymbol(TokenType type) {
        offset++;
        return type;
    }

    private TokenType consumeWhitespace() {
        do {
            offset++;
        } while (offset < text.length() && isWhitespace(text.charAt(offset)));

        return TokenType.WHITESPACE;
    }

    /*
     * The opening solidus and asterisk have not been consumed yet.
     */
    private TokenType consumeComment() {
        int close = text.indexOf("*/", offset + 2);
        offset = close < 0 ? text.length() : close + 2;
        return TokenType.COMMENT;
    }

    private TokenType consumeWord() {
        while (offset < text.length()) {
            char c = text.charAt(offset);

            if (isWhitespace(c) || isStructural(c) || startsComment(offset)) {
                break;
            }

            if (isQuote(c)) {
                consumeString(c);
            } else if (c == REVERSE_SOLIDUS) {
                offset = Math.min(offset + 2, text.length());
            } else {
                offset++;
            }
        }

        return TokenType.WORD;
    }

    /**
     * Consumes a quoted string, including its delimiters. An unterminated string ends before the
     * first unescaped newline, or at the end of the input.
     */
    private void consumeString(char quote) {
        offset++;

        while (offset < text.length()) {
            char c = text.charAt(offset);

            if (c == quote) {
                offset++;
                return;
            }

            if (c == REVERSE_SOLIDUS) {
                offset = Math.min(offset + 2, text.length());
            } else if (isNewline(c)) {
                return;
            } else {
                offset++;
            }
        }
    }

    private boolean startsComment(int index) {
        return index + 1 < text.length()
            && text.charAt(index) == SOLIDUS
            && text.charAt(index + 1) == ASTERISK;
    }
}
