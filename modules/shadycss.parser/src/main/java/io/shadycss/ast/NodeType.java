package io.shadycss.ast;

public enum NodeType {
    STYLESHEET,
    COMMENT,
    AT_RULE,
    RULELIST,
    RULESET,
    DECLARATION,
    EXPRESSION,
    DISCARDED
}
