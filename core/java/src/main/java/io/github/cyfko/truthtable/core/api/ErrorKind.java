package io.github.cyfko.truthtable.core.api;

/**
 * Reasons an expression can be rejected. Both are terminal: no partial table is produced.
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * A right bracket without a matching left bracket, or a left bracket never closed.
     * Reported by the infix-to-postfix conversion.
     */
    MISMATCHED_BRACKET,

    /**
     * The postfix sequence does not reduce to exactly one value: an operator lacks
     * operands, or the expression yields zero or several values.
     * Reported by evaluation.
     */
    EXPRESSION_SYNTAX
}
