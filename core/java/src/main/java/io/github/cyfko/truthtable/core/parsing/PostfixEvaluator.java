package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.api.Result;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TruthTableError;
import io.github.cyfko.truthtable.core.config.EvaluationPolicy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a postfix sequence under one {@link Assignment}.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token of the postfix sequence:
 *   - Identifier: push its assigned value
 *   - Constant:   push its literal value
 *   - Operator:   pop arity values (first popped = rightmost operand), push the result
 *
 * The stack should contain exactly ONE value at the end.
 * </pre>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>Stack underflow (operator without enough operands)</li>
 *   <li>Empty stack at the end (nothing to evaluate)</li>
 *   <li>Several values at the end, unless {@link EvaluationPolicy#requireSingleResult()} is off,
 *   in which case the first value pushed wins</li>
 *   <li>Identifier without a value in the assignment</li>
 * </ul>
 * All of them are reported as {@link ErrorKind#EXPRESSION_SYNTAX}.
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TruthTableGenerator
 */
public final class PostfixEvaluator {

    private PostfixEvaluator() {}

    public static Result<Boolean> evaluate(List<Token> postfix, Assignment assignment) {
        return evaluate(postfix, assignment, EvaluationPolicy.defaults());
    }

    /**
     * Evaluates a postfix sequence.
     *
     * @param postfix    bracket-free postfix tokens
     * @param assignment values of the identifiers referenced by {@code postfix}
     * @param policy     evaluation settings
     * @return the value of the expression, or an {@link ErrorKind#EXPRESSION_SYNTAX} failure
     * @throws NullPointerException if an argument is null
     */
    public static Result<Boolean> evaluate(List<Token> postfix, Assignment assignment, EvaluationPolicy policy) {
        Objects.requireNonNull(postfix, "postfix cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        Deque<Boolean> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            if (token instanceof Token.Identifier identifier) {
                if (!assignment.contains(identifier.name())) {
                    return Result.failure(TruthTableError.expressionSyntax(String.format(
                            "Identifier '%s' has no value. Assigned identifiers: %s",
                            identifier.name(), assignment.identifiers()
                    )));
                }
                stack.push(assignment.valueOf(identifier.name()));
            } else if (token instanceof Token.Constant constant) {
                stack.push(constant.value());
            } else if (token instanceof Operator op) {
                if (stack.size() < op.arity()) {
                    return Result.failure(TruthTableError.expressionSyntax(String.format(
                            "Malformed expression: %s operator (%s) requires %d operand(s), stack contains %d",
                            op.name(), op.symbol(), op.arity(), stack.size()
                    )));
                }
                boolean[] operands = new boolean[op.arity()];
                for (int i = operands.length - 1; i >= 0; i--) {
                    operands[i] = stack.pop();
                }
                stack.push(op.apply(operands));
            } else {
                return Result.failure(TruthTableError.expressionSyntax(
                        "Malformed postfix expression: unexpected token '" + token.symbol() + "'"));
            }
        }

        if (stack.isEmpty()) {
            return Result.failure(TruthTableError.expressionSyntax(
                    "Malformed expression: evaluation resulted in an empty stack"));
        }

        if (stack.size() > 1 && policy.requireSingleResult()) {
            return Result.failure(TruthTableError.expressionSyntax(String.format(
                    "Malformed expression: evaluation resulted in %d values (expected 1). " +
                    "Expression may have too many operands or missing operators. Policy applied: %s",
                    stack.size(), policy.policyName()
            )));
        }

        // bottom of the stack: the first value pushed
        return Result.success(stack.peekLast());
    }
}
