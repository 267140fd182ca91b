package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.Result;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.api.TruthTableEngine;
import io.github.cyfko.truthtable.core.config.EvaluationPolicy;
import io.github.cyfko.truthtable.core.parsing.PostfixConverter;
import io.github.cyfko.truthtable.core.parsing.Tokenizer;
import io.github.cyfko.truthtable.core.parsing.TruthTableGenerator;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Default {@link TruthTableEngine} running the three-phase pipeline.
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link Tokenizer#tokenize(String)} - text to tokens, unknown characters dropped</li>
 *   <li><strong>Phase 2</strong>: {@link PostfixConverter#toPostfix(List)} - shunting-yard conversion, bracket check</li>
 *   <li><strong>Phase 3</strong>: {@link TruthTableGenerator#evaluateAll(List, EvaluationPolicy)} - exhaustive evaluation</li>
 * </ol>
 *
 * <p>The engine keeps no state between calls besides its {@link EvaluationPolicy}, so one
 * instance can be shared freely.</p>
 *
 * <pre>{@code
 * // Default configuration: leftover operands are an error
 * TruthTableEngine engine = new BasicTruthTableEngine();
 *
 * // Legacy configuration: the first operand wins
 * TruthTableEngine legacy = new BasicTruthTableEngine(EvaluationPolicy.legacy());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicTruthTableEngine implements TruthTableEngine {

    private static final Logger log = Logger.getLogger(BasicTruthTableEngine.class.getName());

    private final EvaluationPolicy evaluationPolicy;

    /**
     * Default constructor using {@link EvaluationPolicy#defaults()}.
     */
    public BasicTruthTableEngine() {
        this(EvaluationPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param evaluationPolicy the evaluation settings
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicTruthTableEngine(EvaluationPolicy evaluationPolicy) {
        if (evaluationPolicy == null) {
            throw new IllegalArgumentException("Evaluation policy is required");
        }
        this.evaluationPolicy = evaluationPolicy;
    }

    @Override
    public Result<TruthTable> computeTruthTable(String expression) {
        Objects.requireNonNull(expression, "expression cannot be null");

        List<Token> tokens = Tokenizer.tokenize(expression);
        log.fine(() -> String.format("Tokenized '%s' into %d token(s)", expression, tokens.size()));

        Result<TruthTable> result = PostfixConverter.toPostfix(tokens)
                .flatMap(postfix -> {
                    log.fine(() -> "Postfix: " + join(postfix));
                    return TruthTableGenerator.evaluateAll(postfix, evaluationPolicy);
                });

        if (result.isSuccess()) {
            log.fine(() -> String.format(
                    "Truth table of '%s' computed: identifiers=%s, rows=%d",
                    expression, result.getValue().identifiers(), result.getValue().size()
            ));
        } else {
            log.fine(() -> String.format("Expression '%s' rejected: %s", expression, result.getError()));
        }
        return result;
    }

    private static String join(List<Token> postfix) {
        return postfix.stream().map(Token::toString).collect(Collectors.joining(" "));
    }
}
