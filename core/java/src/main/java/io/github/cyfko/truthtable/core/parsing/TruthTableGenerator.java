package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.Result;
import io.github.cyfko.truthtable.core.api.Row;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.config.EvaluationPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Evaluates a postfix expression under every assignment of its identifiers.
 * <p>
 * Identifiers are sorted alphabetically and enumerated as a binary counter: the first
 * identifier is the most significant bit and the last one the least significant. The
 * counter starts at all-false and is incremented {@code 2^n - 1} times, so row {@code i}
 * holds the bits of {@code i}.
 * </p>
 *
 * <pre>{@code
 * List<Token> postfix = PostfixConverter.toPostfix(Tokenizer.tokenize("A.B")).getValue();
 * TruthTable table = TruthTableGenerator.evaluateAll(postfix).getValue();
 * table.outputs(); // [false, false, false, true]
 * }</pre>
 *
 * <p>The first evaluation failure aborts generation; no partial table is returned.
 * Cost is {@code 2^n} evaluations of O(length) each.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableGenerator {

    private TruthTableGenerator() {}

    public static Result<TruthTable> evaluateAll(List<Token> postfix) {
        return evaluateAll(postfix, EvaluationPolicy.defaults());
    }

    /**
     * Builds the truth table of a postfix expression.
     *
     * @param postfix bracket-free postfix tokens
     * @param policy  evaluation settings
     * @return the table, or the first evaluation failure
     * @throws NullPointerException if an argument is null
     */
    public static Result<TruthTable> evaluateAll(List<Token> postfix, EvaluationPolicy policy) {
        Objects.requireNonNull(postfix, "postfix cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        List<Character> identifiers = identifiersOf(postfix);
        int rowCount = 1 << identifiers.size();
        List<Row> rows = new ArrayList<>(rowCount);

        boolean[] bits = new boolean[identifiers.size()];
        for (int i = 0; i < rowCount; i++) {
            Assignment assignment = Assignment.of(identifiers, bits);
            Result<Boolean> output = PostfixEvaluator.evaluate(postfix, assignment, policy);
            if (!output.isSuccess()) {
                return Result.failure(output.getError());
            }
            rows.add(new Row(assignment, output.getValue()));
            increment(bits);
        }

        return Result.success(new TruthTable(identifiers, rows));
    }

    /**
     * Distinct identifiers referenced by a token sequence.
     *
     * @param tokens the tokens to scan
     * @return identifier names, sorted alphabetically
     */
    public static List<Character> identifiersOf(List<Token> tokens) {
        return tokens.stream()
                .filter(Token.Identifier.class::isInstance)
                .map(token -> ((Token.Identifier) token).name())
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    // binary increment, last position least significant; wraps to all-false after all-true
    private static void increment(boolean[] bits) {
        for (int i = bits.length - 1; i >= 0; i--) {
            bits[i] = !bits[i];
            if (bits[i]) {
                break;
            }
        }
    }
}
