package io.github.cyfko.truthtable.core.api;

/**
 * Grouping rule for operators of equal precedence.
 *
 * @since 1.0.0
 */
public enum Associativity {
    /** Group leftmost first: {@code A+B+C} is {@code (A+B)+C}. */
    LEFT,
    /** Group rightmost first. No operator of the language uses it. */
    RIGHT
}
