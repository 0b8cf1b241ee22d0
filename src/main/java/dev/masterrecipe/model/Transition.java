package dev.masterrecipe.model;

/**
 * A transition between two steps, gated by a textual condition.
 */
public record Transition(
    String id,
    String condition
) {}
