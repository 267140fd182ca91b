package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TruthTableExceptionTest {

    @Test
    @DisplayName("Should create MismatchedBracketException with default message")
    void shouldCreateMismatchedBracketExceptionWithDefaultMessage() {
        // When
        MismatchedBracketException exception = new MismatchedBracketException();

        // Then
        assertEquals("No matching bracket found.", exception.getMessage());
        assertEquals(ErrorKind.MISMATCHED_BRACKET, exception.getKind());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should create ExpressionSyntaxException with default message")
    void shouldCreateExpressionSyntaxExceptionWithDefaultMessage() {
        // When
        ExpressionSyntaxException exception = new ExpressionSyntaxException();

        // Then
        assertEquals("Invalid Boolean Algebra expression syntax", exception.getMessage());
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, exception.getKind());
    }

    @Test
    @DisplayName("Should create exception with message and cause")
    void shouldCreateExceptionWithMessageAndCause() {
        // Given
        String message = "Stack underflow";
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        ExpressionSyntaxException exception = new ExpressionSyntaxException(message, cause);

        // Then
        assertEquals(message, exception.getMessage());
        assertEquals(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should be catchable as TruthTableException")
    void shouldBeCatchableAsBaseException() {
        // When & Then
        TruthTableException thrown = assertThrows(TruthTableException.class, () -> {
            throw new MismatchedBracketException("Mismatched brackets: unmatched ')'");
        });
        assertEquals(ErrorKind.MISMATCHED_BRACKET, thrown.getKind());
        assertInstanceOf(RuntimeException.class, thrown);
    }
}
