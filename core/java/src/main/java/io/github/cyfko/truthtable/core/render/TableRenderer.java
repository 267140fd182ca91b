package io.github.cyfko.truthtable.core.render;

import io.github.cyfko.truthtable.core.api.TruthTable;

/**
 * Turns a computed truth table into a display string.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see BorderedTableRenderer
 */
@FunctionalInterface
public interface TableRenderer {

    /**
     * @param expression the source expression, echoed in the output
     * @param table      the table to display
     * @return the rendered table
     */
    String render(String expression, TruthTable table);
}
