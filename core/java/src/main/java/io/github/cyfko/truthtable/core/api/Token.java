package io.github.cyfko.truthtable.core.api;

import java.util.Optional;

/**
 * A lexical unit of a boolean-algebra expression.
 * <p>
 * A token is one of four immutable variants:
 * </p>
 * <table border="1">
 * <caption>Token variants</caption>
 * <thead>
 * <tr><th>Variant</th><th>Type</th><th>Source characters</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Identifier</td><td>{@link Identifier}</td><td>{@code A}-{@code Z}</td></tr>
 * <tr><td>Constant</td><td>{@link Constant}</td><td>{@code 1} (true), {@code 0} (false)</td></tr>
 * <tr><td>Operator</td><td>{@link Operator}</td><td>{@code +} {@code ^} {@code .} {@code '}</td></tr>
 * <tr><td>Bracket</td><td>{@link Bracket}</td><td>{@code (} {@code )}</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Each character of the source text maps to at most one token, independently of its
 * neighbours. {@link #of(char)} is that mapping.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.truthtable.core.parsing.Tokenizer
 */
public interface Token {

    /**
     * Source character this token was read from.
     *
     * @return the character denoting this token in an expression
     */
    char symbol();

    /**
     * Classifies a single source character.
     *
     * @param c the character to classify
     * @return the matching token, or empty when the character denotes nothing
     */
    static Optional<Token> of(char c) {
        if (Identifier.ALPHABET.indexOf(c) >= 0) {
            return Optional.of(new Identifier(c));
        }
        if (c == Constant.TRUE.symbol()) {
            return Optional.of(Constant.TRUE);
        }
        if (c == Constant.FALSE.symbol()) {
            return Optional.of(Constant.FALSE);
        }
        if (c == Bracket.LEFT.symbol()) {
            return Optional.of(Bracket.LEFT);
        }
        if (c == Bracket.RIGHT.symbol()) {
            return Optional.of(Bracket.RIGHT);
        }
        return Operator.fromSymbol(c).map(Token.class::cast);
    }

    /**
     * A boolean variable named by a single uppercase letter.
     *
     * @param name the variable name, one of {@link #ALPHABET}
     */
    record Identifier(char name) implements Token {

        /**
         * Characters accepted as identifier names.
         */
        public static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

        public Identifier {
            if (ALPHABET.indexOf(name) < 0) {
                throw new IllegalArgumentException("Identifier must be one of " + ALPHABET + ", got: '" + name + "'");
            }
        }

        @Override
        public char symbol() {
            return name;
        }

        @Override
        public String toString() {
            return String.valueOf(name);
        }
    }

    /**
     * A literal truth value.
     *
     * @param value the literal value
     */
    record Constant(boolean value) implements Token {

        public static final Constant TRUE = new Constant(true);
        public static final Constant FALSE = new Constant(false);

        @Override
        public char symbol() {
            return value ? '1' : '0';
        }

        @Override
        public String toString() {
            return String.valueOf(symbol());
        }
    }

    /**
     * Grouping markers. Brackets never appear in a postfix sequence.
     */
    enum Bracket implements Token {
        LEFT('('),
        RIGHT(')');

        private final char symbol;

        Bracket(char symbol) {
            this.symbol = symbol;
        }

        @Override
        public char symbol() {
            return symbol;
        }

        @Override
        public String toString() {
            return String.valueOf(symbol);
        }
    }
}
