package io.github.cyfko.truthtable.core.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable mapping of identifiers to truth values, iterated in alphabetical order.
 *
 * <pre>{@code
 * Assignment a = Assignment.of(Map.of('B', true, 'A', false));
 * a.identifiers();  // [A, B]
 * a.valueOf('B');   // true
 * a.toString();     // "A=0 B=1"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignment {

    private final Map<Character, Boolean> values;

    private Assignment(Map<Character, Boolean> values) {
        this.values = values;
    }

    /**
     * Creates an assignment from an arbitrary map.
     *
     * @param values identifier values; no null keys or values
     * @return the assignment
     * @throws NullPointerException if {@code values} or one of its entries is null
     */
    public static Assignment of(Map<Character, Boolean> values) {
        Objects.requireNonNull(values, "values cannot be null");
        TreeMap<Character, Boolean> sorted = new TreeMap<>();
        values.forEach((identifier, value) -> sorted.put(
                Objects.requireNonNull(identifier, "identifier cannot be null"),
                Objects.requireNonNull(value, "value cannot be null")
        ));
        return new Assignment(Collections.unmodifiableSortedMap(sorted));
    }

    /**
     * Creates an assignment from parallel identifier and value sequences.
     *
     * @param identifiers identifiers in alphabetical order
     * @param bits        the value of each identifier, same length as {@code identifiers}
     * @return the assignment
     */
    public static Assignment of(List<Character> identifiers, boolean[] bits) {
        if (identifiers.size() != bits.length) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d values, got %d", identifiers.size(), bits.length
            ));
        }
        TreeMap<Character, Boolean> sorted = new TreeMap<>();
        for (int i = 0; i < bits.length; i++) {
            sorted.put(identifiers.get(i), bits[i]);
        }
        return new Assignment(Collections.unmodifiableSortedMap(sorted));
    }

    public List<Character> identifiers() {
        return List.copyOf(values.keySet());
    }

    public boolean contains(char identifier) {
        return values.containsKey(identifier);
    }

    /**
     * Value bound to an identifier.
     *
     * @param identifier the identifier
     * @return its value
     * @throws IllegalArgumentException if the identifier is not assigned
     */
    public boolean valueOf(char identifier) {
        Boolean value = values.get(identifier);
        if (value == null) {
            throw new IllegalArgumentException("Identifier '" + identifier + "' is not assigned. Assigned: " + values.keySet());
        }
        return value;
    }

    public Map<Character, Boolean> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        return values.equals(((Assignment) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        values.forEach((identifier, value) -> {
            if (sb.length() > 0) sb.append(' ');
            sb.append(identifier).append('=').append(value ? '1' : '0');
        });
        return sb.toString();
    }
}
