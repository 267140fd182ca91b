package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.api.Result;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TruthTableError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Infix to postfix converter based on the shunting-yard algorithm.
 * <p>
 * Operands go straight to the output; operators wait on a stack until an operator of lower
 * precedence, a closing bracket or the end of input releases them. The only check performed
 * is bracket balancing; operand/operator arity is left to evaluation.
 * </p>
 *
 * <p><strong>Rules:</strong></p>
 * <pre>
 * Identifier, Constant -> output
 * Operator op          -> pop every stacked operator op yields to, then push op
 * (                    -> push
 * )                    -> pop operators until '(' and discard it ('(' missing: MISMATCHED_BRACKET)
 * end of input         -> pop everything ('(' left: MISMATCHED_BRACKET)
 * </pre>
 *
 * <p>Every operator is left-associative, so an operator pops any stacked operator of equal or
 * higher precedence ({@link Operator#yieldsTo(Operator)}).</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Result<List<Token>> postfix = PostfixConverter.toPostfix(Tokenizer.tokenize("A + B . C"));
 * // [A, B, C, ., +]
 *
 * PostfixConverter.toPostfix(Tokenizer.tokenize("(A.B"));
 * // failure: MISMATCHED_BRACKET
 * }</pre>
 *
 * <p>Time and space are O(n) in the number of tokens.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PostfixEvaluator
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * Converts infix tokens to postfix order.
     *
     * @param tokens infix tokens as produced by {@link Tokenizer}
     * @return the postfix sequence, bracket-free, or a {@link ErrorKind#MISMATCHED_BRACKET} failure
     * @throws NullPointerException if {@code tokens} is null
     */
    public static Result<List<Token>> toPostfix(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");

        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> stack = new ArrayDeque<>();

        for (Token token : tokens) {
            if (token instanceof Token.Identifier || token instanceof Token.Constant) {
                output.add(token);
            } else if (token instanceof Operator op) {
                while (!stack.isEmpty() && stack.peek() instanceof Operator top && op.yieldsTo(top)) {
                    output.add(stack.pop());
                }
                stack.push(op);
            } else if (token == Token.Bracket.LEFT) {
                stack.push(token);
            } else if (token == Token.Bracket.RIGHT) {
                while (!stack.isEmpty() && stack.peek() != Token.Bracket.LEFT) {
                    output.add(stack.pop());
                }
                if (stack.isEmpty()) {
                    return Result.failure(TruthTableError.mismatchedBracket("Mismatched brackets: unmatched ')'"));
                }
                stack.pop();
            }
        }

        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top instanceof Token.Bracket) {
                return Result.failure(TruthTableError.mismatchedBracket("Mismatched brackets: unmatched '('"));
            }
            output.add(top);
        }

        return Result.success(List.copyOf(output));
    }
}
