package io.shadycss.ast;

/**
 * A node of the shady CSS syntax tree.
 * <p>
 * Every node covers a range of the source text it was parsed from. Nodes are immutable.
 */
public interface Node {

    NodeType nodeType();

    Range range();
}
