package io.github.cyfko.truthtable.core.render;

import io.github.cyfko.truthtable.core.api.Row;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.config.RenderPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a truth table as a bordered text grid.
 *
 * <pre>
 *         A . (B + C') = OUT
 *  -------------------------------
 * |   A   |   B   |   C   |  OUT  |
 * |-------------------------------|
 * |   0   |   0   |   0   |   0   |
 * |   0   |   0   |   1   |   0   |
 * ...
 * |   1   |   1   |   1   |   1   |
 *  -------------------------------
 * </pre>
 *
 * <p>Cells are centered the way Python's {@code str.center} does it: when the margin is odd,
 * the extra space goes to the left only if the total width is odd. Lines are joined with
 * {@code \n}, without a trailing newline.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BorderedTableRenderer implements TableRenderer {

    private final RenderPolicy renderPolicy;

    public BorderedTableRenderer() {
        this(RenderPolicy.defaults());
    }

    public BorderedTableRenderer(RenderPolicy renderPolicy) {
        this.renderPolicy = Objects.requireNonNull(renderPolicy, "renderPolicy cannot be null");
    }

    @Override
    public String render(String expression, TruthTable table) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(table, "table cannot be null");

        int width = renderPolicy.cellWidth();
        int columns = table.identifiers().size() + 1;
        String rule = "-".repeat(columns * (width + 1) - 1);

        List<String> headings = new ArrayList<>(columns);
        table.identifiers().forEach(identifier -> headings.add(String.valueOf(identifier)));
        headings.add(renderPolicy.outputHeading());

        StringBuilder sb = new StringBuilder();
        sb.append(center(expression + " = " + renderPolicy.outputHeading(), columns * (width + 1) + 2)).append('\n');
        sb.append(' ').append(rule).append(" \n");
        appendLine(sb, headings);
        sb.append('\n').append('|').append(rule).append('|');
        for (Row row : table.rows()) {
            List<String> cells = new ArrayList<>(columns);
            for (Character identifier : table.identifiers()) {
                cells.add(String.valueOf(renderPolicy.symbolOf(row.assignment().valueOf(identifier))));
            }
            cells.add(String.valueOf(renderPolicy.symbolOf(row.output())));
            sb.append('\n');
            appendLine(sb, cells);
        }
        sb.append('\n').append(' ').append(rule);
        return sb.toString();
    }

    private void appendLine(StringBuilder sb, List<String> cells) {
        sb.append('|');
        for (String cell : cells) {
            sb.append(center(cell, renderPolicy.cellWidth())).append('|');
        }
    }

    /**
     * Pads {@code text} with spaces to {@code width} characters, centered.
     * Text longer than {@code width} is returned unchanged.
     */
    static String center(String text, int width) {
        int margin = width - text.length();
        if (margin <= 0) {
            return text;
        }
        int left = margin / 2 + (margin & width & 1);
        return " ".repeat(left) + text + " ".repeat(margin - left);
    }
}
