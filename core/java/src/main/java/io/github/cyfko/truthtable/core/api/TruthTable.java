package io.github.cyfko.truthtable.core.api;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Complete truth table of an expression.
 * <p>
 * Rows enumerate every assignment of {@link #identifiers()} in binary counting order:
 * the first identifier is the most significant bit, the first row is all-false and
 * the last row all-true. Row {@code i} therefore reads as the binary form of {@code i}.
 * </p>
 *
 * @param identifiers the distinct identifiers of the expression, sorted alphabetically
 * @param rows        one row per assignment, {@code 2^identifiers.size()} in total
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(List<Character> identifiers, List<Row> rows) {

    public TruthTable {
        identifiers = List.copyOf(Objects.requireNonNull(identifiers, "identifiers cannot be null"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows cannot be null"));
    }

    /**
     * Expression outputs in row order.
     *
     * @return one value per row
     */
    public List<Boolean> outputs() {
        return rows.stream().map(Row::output).collect(Collectors.toList());
    }

    public int size() {
        return rows.size();
    }
}
