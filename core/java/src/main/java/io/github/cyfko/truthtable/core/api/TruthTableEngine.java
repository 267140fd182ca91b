package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.render.TableRenderer;

/**
 * Computes truth tables of boolean-algebra expressions.
 *
 * <h2>Expression Grammar</h2>
 * <table border="1">
 * <caption>Expression Language Reference</caption>
 * <thead>
 * <tr><th>Element</th><th>Symbol</th><th>Precedence</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Brackets</td><td>( )</td><td>Highest</td><td>(A+B).C</td></tr>
 * <tr><td>NOT</td><td>'</td><td>3</td><td>A'</td></tr>
 * <tr><td>AND</td><td>.</td><td>2</td><td>A.B</td></tr>
 * <tr><td>XOR</td><td>^</td><td>1</td><td>A^B</td></tr>
 * <tr><td>OR</td><td>+</td><td>0</td><td>A+B</td></tr>
 * <tr><td>Identifier</td><td>A-Z</td><td>-</td><td>Q</td></tr>
 * <tr><td>Constant</td><td>1 0</td><td>-</td><td>A.1</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Any other character, whitespace included, is ignored.</p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * TruthTableEngine engine = new BasicTruthTableEngine();
 *
 * TruthTable table = engine.computeTruthTable("(A+B).(A+C)").orElseThrow();
 * table.identifiers(); // [A, B, C]
 * table.size();        // 8
 *
 * String grid = engine.render("A^B", new BorderedTableRenderer()).orElseThrow();
 * }</pre>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>{@link ErrorKind#MISMATCHED_BRACKET}: {@code "(A.B"}, {@code "A.)"}</li>
 *   <li>{@link ErrorKind#EXPRESSION_SYNTAX}: {@code ".A"}, {@code "A.."}, {@code ""}</li>
 * </ul>
 *
 * <p>Implementations must be deterministic: computing the same expression twice yields
 * equal tables.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TruthTableEngine {

    /**
     * Computes the truth table of an expression.
     *
     * @param expression the infix expression
     * @return the table, or the reason the expression was rejected
     * @throws NullPointerException if {@code expression} is null
     */
    Result<TruthTable> computeTruthTable(String expression);

    /**
     * Computes the truth table of an expression and renders it.
     * The renderer is not invoked when the expression is rejected.
     *
     * @param expression the infix expression, also passed to the renderer
     * @param renderer   produces the display string
     * @return the rendered table, or the reason the expression was rejected
     */
    default Result<String> render(String expression, TableRenderer renderer) {
        return computeTruthTable(expression).map(table -> renderer.render(expression, table));
    }
}
