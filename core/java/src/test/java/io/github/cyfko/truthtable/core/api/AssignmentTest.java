package io.github.cyfko.truthtable.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Assignment Tests")
class AssignmentTest {

    @Test
    @DisplayName("Identifiers are ordered alphabetically")
    void testOrdering() {
        Assignment assignment = Assignment.of(Map.of('C', true, 'A', false, 'B', true));

        assertEquals(List.of('A', 'B', 'C'), assignment.identifiers());
        assertEquals("A=0 B=1 C=1", assignment.toString());
    }

    @Test
    @DisplayName("Parallel sequences build the same assignment")
    void testFromBits() {
        Assignment fromBits = Assignment.of(List.of('A', 'B'), new boolean[]{true, false});

        assertEquals(Assignment.of(Map.of('A', true, 'B', false)), fromBits);
        assertTrue(fromBits.valueOf('A'));
        assertFalse(fromBits.valueOf('B'));
    }

    @Test
    @DisplayName("Later changes to the source array do not leak in")
    void testDefensiveCopy() {
        boolean[] bits = {false};
        Assignment assignment = Assignment.of(List.of('A'), bits);
        bits[0] = true;

        assertFalse(assignment.valueOf('A'));
    }

    @Test
    @DisplayName("Assignment cannot be modified")
    void testImmutable() {
        Map<Character, Boolean> source = new HashMap<>(Map.of('A', true));
        Assignment assignment = Assignment.of(source);
        source.put('B', false);

        assertEquals(1, assignment.size());
        assertThrows(UnsupportedOperationException.class, () -> assignment.asMap().put('C', true));
    }

    @Test
    @DisplayName("Unassigned identifier is reported")
    void testUnassigned() {
        Assignment assignment = Assignment.of(Map.of('A', true));

        assertFalse(assignment.contains('B'));
        assertThrows(IllegalArgumentException.class, () -> assignment.valueOf('B'));
    }

    @Test
    @DisplayName("Length mismatch is rejected")
    void testLengthMismatch() {
        assertThrows(IllegalArgumentException.class, () -> Assignment.of(List.of('A', 'B'), new boolean[]{true}));
    }
}
