package io.github.cyfko.truthtable.core.api;

import java.util.Objects;

/**
 * One line of a truth table.
 *
 * @param assignment the identifier values of this line
 * @param output     the value of the expression under {@code assignment}
 * @since 1.0.0
 */
public record Row(Assignment assignment, boolean output) {

    public Row {
        Objects.requireNonNull(assignment, "assignment cannot be null");
    }
}
