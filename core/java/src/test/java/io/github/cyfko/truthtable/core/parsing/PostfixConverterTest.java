package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.api.Result;
import io.github.cyfko.truthtable.core.api.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link PostfixConverter}.
 * <p>
 * Expected postfix sequences are written as space-separated symbols.
 * </p>
 */
@DisplayName("PostfixConverter Tests")
class PostfixConverterTest {

    private static Result<List<Token>> convert(String infix) {
        return PostfixConverter.toPostfix(Tokenizer.tokenize(infix));
    }

    private static String postfixOf(String infix) {
        Result<List<Token>> result = convert(infix);
        assertTrue(result.isSuccess(), () -> "Conversion failed: " + result);
        return result.getValue().stream().map(Token::toString).collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("Valid Expressions - Conversion Tests")
    class ValidConversionTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @DisplayName("Precedence and associativity")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "A            | A",
                "A.B          | A B .",
                "A+B          | A B +",
                "A^B          | A B ^",
                "A+B.C        | A B C . +",
                "A.B+C        | A B . C +",
                "A+B^C        | A B C ^ +",
                "A^B+C        | A B ^ C +",
                "A^B.C        | A B C . ^",
                "A.B.C        | A B . C .",
                "A+B+C        | A B + C +",
                "A^B^C        | A B ^ C ^",
                "(A+B).C      | A B + C .",
                "(A+B).(A+C)  | A B + A C + .",
                "((A))        | A",
                "A.1+0        | A 1 . 0 +"
        })
        void testConversion(String infix, String expected) {
            assertEquals(expected, postfixOf(infix));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @DisplayName("NOT binds tightest and is left-associative")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "A'       | A '",
                "'A       | A '",
                "A''      | A ' '",
                "A.B'     | A B ' .",
                "A'.B     | A ' B .",
                "'A.B     | A ' B .",
                "(A.B)'   | A B . '",
                "(A+B')'  | A B ' + '"
        })
        void testNot(String infix, String expected) {
            assertEquals(expected, postfixOf(infix));
        }

        @Test
        @DisplayName("Output never contains brackets")
        void testBracketsRemoved() {
            List<Token> postfix = convert("((A+(B.C))^(D'))").getValue();
            assertTrue(postfix.stream().noneMatch(Token.Bracket.class::isInstance));
            assertEquals(8, postfix.size());
            assertEquals("A B C . + D ' ^", postfixOf("((A+(B.C))^(D'))"));
        }

        @Test
        @DisplayName("Empty input and empty brackets convert to an empty sequence")
        void testEmpty() {
            assertEquals(List.of(), convert("").getValue());
            assertEquals(List.of(), convert("()").getValue());
        }

        @Test
        @DisplayName("Operators without operands are not rejected at this stage")
        void testArityNotChecked() {
            assertEquals("A .", postfixOf(".A"));
            assertEquals("A . B .", postfixOf("A..B"));
        }
    }

    @Nested
    @DisplayName("Mismatched Brackets")
    class MismatchedBracketTests {

        @ParameterizedTest
        @DisplayName("Unbalanced brackets are rejected")
        @ValueSource(strings = {"(A.B", "A.)", ")", "(", "A)(", "((A)", "(A))", "(A+B).(C", "A.(B+C))"})
        void testMismatched(String infix) {
            Result<List<Token>> result = convert(infix);

            assertFalse(result.isSuccess());
            assertEquals(ErrorKind.MISMATCHED_BRACKET, result.getError().kind());
        }

        @Test
        @DisplayName("Unmatched right bracket is reported as such")
        void testUnmatchedRight() {
            assertEquals("Mismatched brackets: unmatched ')'", convert("A.)").getError().message());
        }

        @Test
        @DisplayName("Unmatched left bracket is reported as such")
        void testUnmatchedLeft() {
            assertEquals("Mismatched brackets: unmatched '('", convert("(A.B").getError().message());
        }
    }

    @Test
    @DisplayName("Null tokens are rejected")
    void testNull() {
        assertThrows(NullPointerException.class, () -> PostfixConverter.toPostfix(null));
    }
}
