package io.shadycss;

import io.shadycss.ast.AtRule;
import io.shadycss.ast.Comment;
import io.shadycss.ast.Declaration;
import io.shadycss.ast.DeclarationValue;
import io.shadycss.ast.Discarded;
import io.shadycss.ast.Expression;
import io.shadycss.ast.Range;
import io.shadycss.ast.Rule;
import io.shadycss.ast.Rulelist;
import io.shadycss.ast.Ruleset;
import io.shadycss.ast.Stylesheet;
import java.util.List;

/**
 * Stateless {@link NodeFactory} that creates the node types of the {@code io.shadycss.ast} package.
 * Subclasses can override individual methods to hook the creation of a particular kind of node.
 */
public class DefaultNodeFactory implements NodeFactory {

    public static final DefaultNodeFactory INSTANCE = new DefaultNodeFactory();

    public DefaultNodeFactory() {}

    @Override
    public Stylesheet stylesheet(List<Rule> rules, Range range) {
        return new Stylesheet(rules, range);
    }

    @Override
    public Rule atRule(String name, String parameters, Rulelist rulelist,
                       Range nameRange, Range parametersRange, Range range) {
        return new AtRule(name, parameters, rulelist, nameRange, parametersRange, range);
    }

    @Override
    public Rule comment(String value, Range range) {
        return new Comment(value, range);
    }

    @Override
    public Rulelist rulelist(List<Rule> rules, Range range) {
        return new Rulelist(rules, range);
    }

    @Override
    public Rule ruleset(String selector, Rulelist rulelist, Range selectorRange, Range range) {
        return new Ruleset(selector, rulelist, selectorRange, range);
    }

    @Override
    public Rule declaration(String name, DeclarationValue value, Range nameRange, Range range) {
        return new Declaration(name, value, nameRange, range);
    }

    @Override
    public DeclarationValue expression(String text, Range range) {
        return new Expression(text, range);
    }

    @Override
    public Rule discarded(String text, Range range) {
        return new Discarded(text, range);
    }
}
