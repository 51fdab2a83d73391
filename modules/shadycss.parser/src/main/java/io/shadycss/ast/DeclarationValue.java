package io.shadycss.ast;

/**
 * The value of a {@link Declaration}: an {@link Expression}, or a {@link Rulelist} for
 * mixin-like declarations.
 */
public interface DeclarationValue extends Node {}
