package io.shadycss;

import io.shadycss.ast.DeclarationValue;
import io.shadycss.ast.Range;
import io.shadycss.ast.Rule;
import io.shadycss.ast.Rulelist;
import io.shadycss.ast.Stylesheet;
import java.util.List;

/**
 * Creates the nodes of the syntax tree on behalf of {@link ShadyCssParser}.
 * <p>
 * A node factory is the extension point of the parser: an implementation can observe nodes as
 * they are created, return modified nodes, or substitute its own {@link Rule} implementations.
 * Methods that create rules may return {@code null}, in which case the rule is left out of its
 * rule list; {@link #stylesheet} and {@link #rulelist} must not return {@code null}. All ranges are half-open character offsets into the parsed text.
 * <p>
 * A factory that is shared between parsers used on different threads must be thread-safe.
 *
 * @see DefaultNodeFactory
 */
public interface NodeFactory {

    /**
     * Creates a stylesheet node.
     *
     * @param rules the top-level rules of the stylesheet
     * @param range the range of the entire text
     */
    Stylesheet stylesheet(List<Rule> rules, Range range);

    /**
     * Creates an at-rule node.
     *
     * @param name the name of the at-rule, for example {@code charset}
     * @param parameters the parameters of the at-rule, for example {@code "utf-8"}
     * @param rulelist the body of the at-rule, or {@code null} for a statement-form at-rule
     * @param nameRange the range of the name
     * @param parametersRange the range of the parameters, or {@code null} if there are none
     * @param range the range of the at-rule
     */
    Rule atRule(String name, String parameters, Rulelist rulelist,
                Range nameRange, Range parametersRange, Range range);

    /**
     * Creates a comment node.
     *
     * @param value the text of the comment, including the opening and closing delimiters
     * @param range the range of the comment
     */
    Rule comment(String value, Range range);

    /**
     * Creates a rulelist node.
     *
     * @param rules the rules inside the block
     * @param range the range of the block, including its braces
     */
    Rulelist rulelist(List<Rule> rules, Range range);

    /**
     * Creates a ruleset node.
     *
     * @param selector the selector, for example {@code #foo > .bar}
     * @param rulelist the body of the ruleset
     * @param selectorRange the range of the selector
     * @param range the range of the ruleset
     */
    Rule ruleset(String selector, Rulelist rulelist, Range selectorRange, Range range);

    /**
     * Creates a declaration node.
     *
     * @param name the property name, for example {@code color}
     * @param value an expression, a rulelist for a mixin-like declaration, or {@code null}
     * @param nameRange the range of the name
     * @param range the range of the declaration
     */
    Rule declaration(String name, DeclarationValue value, Range nameRange, Range range);

    /**
     * Creates an expression node.
     *
     * @param text the text of the value, for example {@code url(img.jpg)}
     * @param range the range of the value
     */
    DeclarationValue expression(String text, Range range);

    /**
     * Creates a discarded node for text that could not be parsed.
     *
     * @param text the discarded text
     * @param range the range of the discarded text
     */
    Rule discarded(String text, Range range);
}
