package io.shadycss;

import io.shadycss.ast.DeclarationValue;
import io.shadycss.ast.Range;
import io.shadycss.ast.Rule;
import io.shadycss.ast.Rulelist;
import io.shadycss.ast.Stylesheet;
import io.shadycss.syntax.Token;
import io.shadycss.syntax.Tokenizer;
import io.shadycss.util.Logging;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.shadycss.syntax.TokenType.*;

/**
 * Recursive-descent parser for shady CSS, the CSS dialect that extends standard CSS with mixin-like
 * declarations of the form {@code --name: { ... };}.
 * <p>
 * The parser does not validate its input. Text that cannot be classified is preserved verbatim in
 * {@link io.shadycss.ast.Discarded} nodes, and parsing resumes at the next structural boundary, so
 * {@link #parse(String)} always returns a stylesheet.
 * <p>
 * Nested blocks are parsed recursively. To bound the stack usage for adversarial input, the contents
 * of a block that is nested deeper than {@link #getMaxNestingDepth()} are not parsed, but preserved as
 * a single discarded node. The default bound can be configured with the
 * {@value #MAX_NESTING_DEPTH_PROPERTY} system property.
 * <p>
 * A parser holds no state between calls to {@code parse}; it can be shared between threads if its
 * {@link NodeFactory} is thread-safe.
 */
public class ShadyCssParser {

    public static final String MAX_NESTING_DEPTH_PROPERTY = "shadycss.maxNestingDepth";
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final System.Logger LOGGER = Logging.getParserLogger();

    private final NodeFactory nodeFactory;
    private final int maxNestingDepth;

    public ShadyCssParser() {
        this(DefaultNodeFactory.INSTANCE);
    }

    /**
     * Creates a parser that delegates node creation to the specified factory. A specialized factory
     * can be used to implement streaming analysis and manipulation of the syntax tree.
     */
    public ShadyCssParser(NodeFactory nodeFactory) {
        this(nodeFactory, configuredMaxNestingDepth());
    }

    public ShadyCssParser(NodeFactory nodeFactory, int maxNestingDepth) {
        this.nodeFactory = Objects.requireNonNull(nodeFactory, "nodeFactory cannot be null");

        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }

        this.maxNestingDepth = maxNestingDepth;
    }

    public NodeFactory getNodeFactory() {
        return nodeFactory;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * Parses shady CSS text.
     *
     * @param cssText the text to parse
     * @return the syntax tree, with nodes created by this parser's {@link NodeFactory}
     */
    public Stylesheet parse(String cssText) {
        Objects.requireNonNull(cssText, "cssText cannot be null");
        Stylesheet stylesheet = parseStylesheet(new Tokenizer(cssText));

        if (LOGGER.isLoggable(System.Logger.Level.TRACE)) {
            LOGGER.log(System.Logger.Level.TRACE, "Parsed {0} top-level rules from {1} characters",
                       stylesheet.rules().size(), cssText.length());
        }

        return stylesheet;
    }

    /**
     * Reads all remaining characters from the reader and parses them. The reader is not closed.
     */
    public Stylesheet parse(Reader reader) throws IOException {
        var writer = new StringWriter();
        reader.transferTo(writer);
        return parse(writer.toString());
    }

    /**
     * Reads all remaining bytes from the input stream, decodes them with the specified charset, and
     * parses the resulting text. The stream is not closed.
     */
    public Stylesheet parse(InputStream input, Charset charset) throws IOException {
        return parse(new String(input.readAllBytes(), charset));
    }

    /**
     * Consumes all tokens of the tokenizer to parse a stylesheet.
     */
    public Stylesheet parseStylesheet(Tokenizer tokenizer) {
        return nodeFactory.stylesheet(parseRules(tokenizer), new Range(0, tokenizer.text().length()));
    }

    /**
     * Consumes all tokens of the tokenizer to parse a sequence of top-level rules.
     *
     * @return the rules, which for the {@link DefaultNodeFactory} are comments, at-rules, rulesets,
     *         declarations and discarded nodes
     */
    public List<Rule> parseRules(Tokenizer tokenizer) {
        var rules = new ArrayList<Rule>();

        while (tokenizer.currentToken() != null) {
            Rule rule = parseRule(tokenizer, 0);
            if (rule != null) {
                rules.add(rule);
            }
        }

        return rules;
    }

    /**
     * Parses a single rule at the current token.
     *
     * @param depth the number of blocks enclosing the rule
     * @return the rule, or {@code null} if only whitespace was consumed
     */
    private Rule parseRule(Tokenizer tokenizer, int depth) {
        Token token = tokenizer.currentToken();

        if (token == null) {
            return null;
        }

        if (token.is(WHITESPACE)) {
            tokenizer.advance();
            return null;
        } else if (token.is(COMMENT)) {
            return parseComment(tokenizer);
        } else if (token.is(WORD) || token.is(COLON)) {
            return parseDeclarationOrRuleset(tokenizer, depth);
        } else if (token.is(PROPERTY_BOUNDARY)) {
            return parseUnknown(tokenizer, depth);
        } else if (token.is(AT)) {
            return parseAtRule(tokenizer, depth);
        } else {
            return parseUnknown(tokenizer, depth);
        }
    }

    private Rule parseComment(Tokenizer tokenizer) {
        Token token = tokenizer.advance();
        return nodeFactory.comment(tokenizer.slice(token), token.range());
    }

    /**
     * Consumes the current token and all boundary tokens that immediately follow it, producing a
     * discarded node. Inside a block, a closing brace is left for the enclosing rulelist.
     */
    private Rule parseUnknown(Tokenizer tokenizer, int depth) {
        Token start = tokenizer.advance();
        Token end = start;
        Token token;

        while ((token = tokenizer.currentToken()) != null && token.is(BOUNDARY)) {
            if (depth > 0 && token.is(CLOSE_BRACE)) {
                break;
            }

            end = tokenizer.advance();
        }

        return nodeFactory.discarded(tokenizer.slice(start, end), span(start, end));
    }

    /**
     * Parses an at-rule. The current token is the {@code @}.
     */
    private Rule parseAtRule(Tokenizer tokenizer, int depth) {
        Token at = tokenizer.advance();
        Token nameStart = null, nameEnd = null;
        Token parametersStart = null, parametersEnd = null;
        Token last = at;
        Rulelist rulelist = null;
        Token token;

        while ((token = tokenizer.currentToken()) != null && token.is(WORD)) {
            nameEnd = tokenizer.advance();
            if (nameStart == null) {
                nameStart = nameEnd;
            }
        }

        while ((token = tokenizer.currentToken()) != null) {
            if (token.is(WHITESPACE)) {
                tokenizer.advance();
            } else if (token.is(OPEN_BRACE)) {
                rulelist = parseRulelist(tokenizer, depth);
                break;
            } else if (token.is(SEMICOLON)) {
                last = tokenizer.advance();
                break;
            } else if (token.is(CLOSE_BRACE)) {
                // The closing brace belongs to the enclosing block.
                break;
            } else {
                parametersEnd = tokenizer.advance();
                if (parametersStart == null) {
                    parametersStart = parametersEnd;
                }
            }
        }

        String name = "";
        Range nameRange = new Range(at.end(), at.end());
        if (nameStart != null) {
            name = tokenizer.slice(nameStart, nameEnd);
            nameRange = span(nameStart, nameEnd);
        }

        String parameters = "";
        Range parametersRange = null;
        if (parametersStart != null) {
            parameters = tokenizer.slice(parametersStart, parametersEnd);
            parametersRange = span(parametersStart, parametersEnd);
        }

        int end;
        if (rulelist != null) {
            end = rulelist.range().end();
        } else if (last != at) {
            end = last.end();
        } else if (parametersRange != null) {
            end = parametersRange.end();
        } else {
            end = nameRange.end();
        }

        return nodeFactory.atRule(name, parameters, rulelist, nameRange, parametersRange, new Range(at.start(), end));
    }

    /**
     * Parses a block of rules. The current token is the opening brace.
     *
     * @param depth the number of blocks enclosing the block
     */
    private Rulelist parseRulelist(Tokenizer tokenizer, int depth) {
        Token open = tokenizer.advance();

        if (depth + 1 > maxNestingDepth) {
            return discardRulelist(tokenizer, open);
        }

        var rules = new ArrayList<Rule>();
        Token token;

        while ((token = tokenizer.currentToken()) != null) {
            if (token.is(CLOSE_BRACE)) {
                Token close = tokenizer.advance();
                return nodeFactory.rulelist(rules, span(open, close));
            }

            Rule rule = parseRule(tokenizer, depth + 1);
            if (rule != null) {
                rules.add(rule);
            }
        }

        // Unterminated block: it extends to the end of the input.
        return nodeFactory.rulelist(rules, new Range(open.start(), tokenizer.text().length()));
    }

    /**
     * Skips a block without parsing it, preserving its contents in a single discarded node. The
     * opening brace has already been consumed. Braces are balanced without recursion.
     */
    private Rulelist discardRulelist(Tokenizer tokenizer, Token open) {
        if (LOGGER.isLoggable(System.Logger.Level.WARNING)) {
            LOGGER.log(System.Logger.Level.WARNING,
                       "Block at offset {0} exceeds the maximum nesting depth of {1} and is discarded",
                       open.start(), maxNestingDepth);
        }

        Token first = null, last = null, close = null;
        int nesting = 1;
        Token token;

        while ((token = tokenizer.advance()) != null) {
            if (token.is(OPEN_BRACE)) {
                nesting++;
            } else if (token.is(CLOSE_BRACE) && --nesting == 0) {
                close = token;
                break;
            }

            if (!token.is(WHITESPACE)) {
                if (first == null) {
                    first = token;
                }

                last = token;
            }
        }

        List<Rule> rules = new ArrayList<>();
        if (first != null) {
            Rule discarded = nodeFactory.discarded(tokenizer.slice(first, last), span(first, last));
            if (discarded != null) {
                rules.add(discarded);
            }
        }

        int end = close != null ? close.end() : tokenizer.text().length();
        return nodeFactory.rulelist(rules, new Range(open.start(), end));
    }

    /**
     * Parses either a declaration or a ruleset, which cannot be told apart until the end of the
     * prelude has been seen.
     * <p>
     * The prelude is scanned up to the next opening brace or property boundary. Whitespace is
     * skipped, and parenthesized groups are consumed as a whole, so that a colon in a value like
     * {@code url(http://host:80/)} is not taken for the separator between name and value.
     * <ul>
     *     <li>A prelude that ends at a semicolon or closing brace is a declaration; its name and value
     *         are separated by the first colon. Without a colon, the declaration has no value.
     *     <li>A prelude that ends with a colon followed by an opening brace is a mixin-like declaration
     *         whose value is the block.
     *     <li>Any other prelude followed by an opening brace is the selector of a ruleset.
     *     <li>A prelude that runs to the end of the input is discarded.
     * </ul>
     */
    private Rule parseDeclarationOrRuleset(Tokenizer tokenizer, int depth) {
        Token ruleStart = null, ruleEnd = null, beforeRuleEnd = null;
        Token colon = null, beforeColon = null;
        Token token;

        while ((token = tokenizer.currentToken()) != null) {
            if (token.is(WHITESPACE)) {
                tokenizer.advance();
            } else if (token.is(OPEN_PARENTHESIS)) {
                if (ruleStart == null) {
                    ruleStart = token;
                }

                beforeRuleEnd = ruleEnd;
                ruleEnd = skipParenthesizedGroup(tokenizer);
            } else if (token.is(PROPERTY_BOUNDARY)) {
                break;
            } else {
                if (colon == null && token.is(COLON)) {
                    colon = token;
                    beforeColon = ruleEnd;
                }

                beforeRuleEnd = ruleEnd;
                ruleEnd = tokenizer.advance();
                if (ruleStart == null) {
                    ruleStart = ruleEnd;
                }
            }
        }

        Objects.requireNonNull(ruleStart, "a rule must start with a word or colon");

        if (token == null) {
            if (LOGGER.isLoggable(System.Logger.Level.DEBUG)) {
                LOGGER.log(System.Logger.Level.DEBUG,
                           "Unterminated rule at offset {0} is discarded", ruleStart.start());
            }

            return nodeFactory.discarded(tokenizer.slice(ruleStart, ruleEnd), span(ruleStart, ruleEnd));
        }

        if (!token.is(OPEN_BRACE)) {
            return createDeclaration(tokenizer, ruleStart, ruleEnd, colon, beforeColon);
        }

        if (ruleEnd.is(COLON)) {
            Range nameRange = beforeRuleEnd != null
                ? span(ruleStart, beforeRuleEnd)
                : new Range(ruleStart.start(), ruleStart.start());
            String name = nameRange.substring(tokenizer.text());
            Rulelist rulelist = parseRulelist(tokenizer, depth);
            int end = rulelist.range().end();

            if ((token = tokenizer.currentToken()) != null && token.is(SEMICOLON)) {
                end = tokenizer.advance().end();
            }

            return nodeFactory.declaration(name, rulelist, nameRange, new Range(ruleStart.start(), end));
        }

        Range selectorRange = span(ruleStart, ruleEnd);
        Rulelist rulelist = parseRulelist(tokenizer, depth);

        return nodeFactory.ruleset(
            tokenizer.slice(ruleStart, ruleEnd),
            rulelist,
            selectorRange,
            new Range(ruleStart.start(), rulelist.range().end()));
    }

    /**
     * Creates a declaration whose prelude was terminated by a semicolon or closing brace. A terminating
     * semicolon is consumed and included in the range of the declaration.
     */
    private Rule createDeclaration(Tokenizer tokenizer, Token ruleStart, Token ruleEnd,
                                   Token colon, Token beforeColon) {
        String name;
        Range nameRange;
        DeclarationValue value = null;

        if (colon == null) {
            name = tokenizer.slice(ruleStart, ruleEnd);
            nameRange = span(ruleStart, ruleEnd);
        } else {
            nameRange = beforeColon != null
                ? span(ruleStart, beforeColon)
                : new Range(colon.start(), colon.start());
            name = nameRange.substring(tokenizer.text());

            if (colon != ruleEnd) {
                Token valueStart = tokenizer.next(colon);
                while (valueStart.is(WHITESPACE)) {
                    valueStart = tokenizer.next(valueStart);
                }

                value = nodeFactory.expression(tokenizer.slice(valueStart, ruleEnd), span(valueStart, ruleEnd));
            }
        }

        int end = ruleEnd.end();
        Token token = tokenizer.currentToken();
        if (token != null && token.is(SEMICOLON)) {
            end = tokenizer.advance().end();
        }

        return nodeFactory.declaration(name, value, nameRange, new Range(ruleStart.start(), end));
    }

    /**
     * Consumes a parenthesized group, including nested groups. The current token is the opening
     * parenthesis. An unbalanced group extends to the end of the input.
     *
     * @return the last consumed token
     */
    private static Token skipParenthesizedGroup(Tokenizer tokenizer) {
        Token last = tokenizer.advance();
        int nesting = 1;

        while (nesting > 0 && tokenizer.currentToken() != null) {
            last = tokenizer.advance();

            if (last.is(OPEN_PARENTHESIS)) {
                nesting++;
            } else if (last.is(CLOSE_PARENTHESIS)) {
                nesting--;
            }
        }

        return last;
    }

    private static Range span(Token from, Token to) {
        return new Range(from.start(), to.end());
    }

    private static int configuredMaxNestingDepth() {
        Integer value = Integer.getInteger(MAX_NESTING_DEPTH_PROPERTY);

        if (value == null) {
            return DEFAULT_MAX_NESTING_DEPTH;
        }

        if (value < 1) {
            if (LOGGER.isLoggable(System.Logger.Level.WARNING)) {
                LOGGER.log(System.Logger.Level.WARNING, "Ignoring {0}={1}, using {2}",
                           MAX_NESTING_DEPTH_PROPERTY, value, DEFAULT_MAX_NESTING_DEPTH);
            }

            return DEFAULT_MAX_NESTING_DEPTH;
        }

        return value;
    }
}
