package io.shadycss.ast;

/**
 * A node that can appear in the rule list of a {@link Stylesheet} or a {@link Rulelist}.
 */
public interface Rule extends Node {}
