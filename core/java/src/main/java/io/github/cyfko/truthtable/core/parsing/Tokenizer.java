package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scans expression text into tokens.
 * <p>
 * Each character is classified on its own by {@link Token#of(char)}; characters that denote
 * no token (whitespace, lowercase letters, digits other than {@code 0}/{@code 1}, unknown
 * symbols) are skipped without being reported. Malformed input therefore surfaces later,
 * in {@link PostfixConverter} or {@link TruthTableGenerator}.
 * </p>
 *
 * <pre>{@code
 * Tokenizer.tokenize("A . (b + C')");
 * // [A, ., (, +, C, ', )]  ('b' is dropped)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private Tokenizer() {}

    /**
     * Tokenizes an expression. Never fails on content.
     *
     * @param source the expression text
     * @return tokens in source order
     * @throws NullPointerException if {@code source} is null
     */
    public static List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source cannot be null");

        List<Token> tokens = new ArrayList<>(source.length());
        for (int i = 0; i < source.length(); i++) {
            Token.of(source.charAt(i)).ifPresent(tokens::add);
        }
        return tokens;
    }
}
