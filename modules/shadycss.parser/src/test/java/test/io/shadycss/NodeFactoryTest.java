package test.io.shadycss;

import io.shadycss.DefaultNodeFactory;
import io.shadycss.ShadyCssParser;
import io.shadycss.ast.Declaration;
import io.shadycss.ast.DeclarationValue;
import io.shadycss.ast.Expression;
import io.shadycss.ast.Node;
import io.shadycss.ast.NodeType;
import io.shadycss.ast.Range;
import io.shadycss.ast.Rule;
import io.shadycss.ast.Rulelist;
import io.shadycss.ast.Ruleset;
import io.shadycss.ast.Stylesheet;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeFactoryTest {

    /**
     * Records the type of every node in the order in which the parser creates them.
     */
    private static class RecordingNodeFactory extends DefaultNodeFactory {
        final List<NodeType> created = new ArrayList<>();

        @Override
        public Stylesheet stylesheet(List<Rule> rules, Range range) {
            return track(super.stylesheet(rules, range));
        }

        @Override
        public Rule atRule(String name, String parameters, Rulelist rulelist,
                           Range nameRange, Range parametersRange, Range range) {
            return track(super.atRule(name, parameters, rulelist, nameRange, parametersRange, range));
        }

        @Override
        public Rule comment(String value, Range range) {
            return track(super.comment(value, range));
        }

        @Override
        public Rulelist rulelist(List<Rule> rules, Range range) {
            return track(super.rulelist(rules, range));
        }

        @Override
        public Rule ruleset(String selector, Rulelist rulelist, Range selectorRange, Range range) {
            return track(super.ruleset(selector, rulelist, selectorRange, range));
        }

        @Override
        public Rule declaration(String name, DeclarationValue value, Range nameRange, Range range) {
            return track(super.declaration(name, value, nameRange, range));
        }

        @Override
        public DeclarationValue expression(String text, Range range) {
            return track(super.expression(text, range));
        }

        @Override
        public Rule discarded(String text, Range range) {
            return track(super.discarded(text, range));
        }

        private <T extends Node> T track(T node) {
            created.add(node.nodeType());
            return node;
        }
    }

    private record CustomPropertyDefinition(String name, String value, Range range) implements Rule {
        @Override
        public NodeType nodeType() {
            return NodeType.DECLARATION;
        }
    }

    @Test
    public void testNodesAreCreatedBottomUp() {
        var factory = new RecordingNodeFactory();
        new ShadyCssParser(factory).parse("/* x */ @media print { a { b: c; } } }");

        assertEquals(
            List.of(NodeType.COMMENT,
                    NodeType.EXPRESSION, NodeType.DECLARATION, NodeType.RULELIST, NodeType.RULESET,
                    NodeType.RULELIST, NodeType.AT_RULE,
                    NodeType.DISCARDED,
                    NodeType.STYLESHEET),
            factory.created);
    }

    @Test
    public void testFactoryCanDropRules() {
        var factory = new DefaultNodeFactory() {
            @Override
            public Rule comment(String value, Range range) {
                return null;
            }
        };

        Stylesheet stylesheet = new ShadyCssParser(factory).parse("/* x */ a { /* y */ b: c; }");
        assertEquals(1, stylesheet.rules().size());

        Ruleset ruleset = assertInstanceOf(Ruleset.class, stylesheet.rules().get(0));
        assertEquals(1, ruleset.rulelist().rules().size());
        assertInstanceOf(Declaration.class, ruleset.rulelist().rules().get(0));
    }

    @Test
    public void testFactoryCanRewriteNodes() {
        var factory = new DefaultNodeFactory() {
            @Override
            public Rule ruleset(String selector, Rulelist rulelist, Range selectorRange, Range range) {
                return super.ruleset(".scope " + selector, rulelist, selectorRange, range);
            }
        };

        Stylesheet stylesheet = new ShadyCssParser(factory).parse("a, b { c: d; }");
        assertEquals(".scope a, b", assertInstanceOf(Ruleset.class, stylesheet.rules().get(0)).selector());
    }

    @Test
    public void testFactoryCanSubstituteRuleTypes() {
        var factory = new DefaultNodeFactory() {
            @Override
            public Rule declaration(String name, DeclarationValue value, Range nameRange, Range range) {
                if (name.startsWith("--") && value instanceof Expression expression) {
                    return new CustomPropertyDefinition(name, expression.text(), range);
                }

                return super.declaration(name, value, nameRange, range);
            }
        };

        Stylesheet stylesheet = new ShadyCssParser(factory).parse(":root { --gap: 4px; margin: var(--gap); }");
        List<Rule> rules = assertInstanceOf(Ruleset.class, stylesheet.rules().get(0)).rulelist().rules();
        assertEquals(new CustomPropertyDefinition("--gap", "4px", new Range(8, 19)), rules.get(0));
        assertEquals("margin", assertInstanceOf(Declaration.class, rules.get(1)).name());
    }

    @Test
    public void testDefaultFactory() {
        var parser = new ShadyCssParser();
        assertSame(DefaultNodeFactory.INSTANCE, parser.getNodeFactory());

        Rule rule = DefaultNodeFactory.INSTANCE.discarded("}", new Range(0, 1));
        assertEquals(NodeType.DISCARDED, rule.nodeType());
    }
}
