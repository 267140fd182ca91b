package io.github.cyfko.truthtable.core.api;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Boolean operators of the expression language, with their parsing metadata.
 * <p>
 * This enum is the process-wide operator table: it fixes the symbol, precedence,
 * associativity and arity of every operator, and its truth function.
 * </p>
 *
 * <table border="1">
 * <caption>Operator reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Arity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>OR</td><td>+</td><td>0</td><td>Left</td><td>2</td></tr>
 * <tr><td>XOR</td><td>^</td><td>1</td><td>Left</td><td>2</td></tr>
 * <tr><td>AND</td><td>.</td><td>2</td><td>Left</td><td>2</td></tr>
 * <tr><td>NOT</td><td>'</td><td>3</td><td>Left</td><td>1</td></tr>
 * </tbody>
 * </table>
 *
 * <p>NOT is unary but carries a left associativity so that the converter applies one
 * comparison rule to every operator. {@code A''} therefore converts to {@code A ' '}.</p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Operator op = Operator.fromSymbol('^').orElseThrow();
 * boolean out = op.apply(true, false); // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator implements Token {

    OR('+', 0, Associativity.LEFT, 2) {
        @Override
        public boolean apply(boolean... operands) {
            checkArity(operands);
            return operands[0] || operands[1];
        }
    },

    XOR('^', 1, Associativity.LEFT, 2) {
        @Override
        public boolean apply(boolean... operands) {
            checkArity(operands);
            boolean a = operands[0];
            boolean b = operands[1];
            return (a && !b) || (!a && b);
        }
    },

    AND('.', 2, Associativity.LEFT, 2) {
        @Override
        public boolean apply(boolean... operands) {
            checkArity(operands);
            return operands[0] && operands[1];
        }
    },

    NOT('\'', 3, Associativity.LEFT, 1) {
        @Override
        public boolean apply(boolean... operands) {
            checkArity(operands);
            return !operands[0];
        }
    };

    private static final Map<Character, Operator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final char symbol;
    private final int precedence;
    private final Associativity associativity;
    private final int arity;

    Operator(char symbol, int precedence, Associativity associativity, int arity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
        this.arity = arity;
    }

    /**
     * Computes this operator's truth function.
     *
     * @param operands the operand values, leftmost first; exactly {@link #arity()} values
     * @return the result
     * @throws IllegalArgumentException if the number of operands differs from the arity
     */
    public abstract boolean apply(boolean... operands);

    @Override
    public char symbol() {
        return symbol;
    }

    /**
     * Binding strength; a higher value binds tighter.
     *
     * @return the precedence rank
     */
    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    /**
     * Number of operands consumed from the value stack.
     *
     * @return 1 for NOT, 2 otherwise
     */
    public int arity() {
        return arity;
    }

    /**
     * Tells whether an operator already on the conversion stack must be emitted before
     * this one is pushed.
     *
     * @param top the operator on top of the stack
     * @return true if {@code top} must be popped to the output first
     */
    public boolean yieldsTo(Operator top) {
        return (associativity == Associativity.LEFT && precedence <= top.precedence)
                || precedence < top.precedence;
    }

    /**
     * Looks an operator up by its source character.
     *
     * @param symbol the character to look up
     * @return the operator, or empty if {@code symbol} denotes none
     */
    public static Optional<Operator> fromSymbol(char symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    void checkArity(boolean[] operands) {
        if (operands.length != arity) {
            throw new IllegalArgumentException(String.format(
                    "Operator %s requires %d operand(s), got %d", name(), arity, operands.length
            ));
        }
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
