package io.github.cyfko.truthtable.core.render;

import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.config.RenderPolicy;
import io.github.cyfko.truthtable.core.impl.BasicTruthTableEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BorderedTableRenderer Tests")
class BorderedTableRendererTest {

    private static TruthTable tableOf(String expression) {
        return new BasicTruthTableEngine().computeTruthTable(expression).orElseThrow();
    }

    @Test
    @DisplayName("Default layout")
    void testDefaultLayout() {
        String expression = "A . (B + C')";

        String expected = String.join("\n",
                "        A . (B + C') = OUT        ",
                " ------------------------------- ",
                "|   A   |   B   |   C   |  OUT  |",
                "|-------------------------------|",
                "|   0   |   0   |   0   |   0   |",
                "|   0   |   0   |   1   |   0   |",
                "|   0   |   1   |   0   |   0   |",
                "|   0   |   1   |   1   |   0   |",
                "|   1   |   0   |   0   |   1   |",
                "|   1   |   0   |   1   |   0   |",
                "|   1   |   1   |   0   |   1   |",
                "|   1   |   1   |   1   |   1   |",
                " -------------------------------"
        );

        assertEquals(expected, new BorderedTableRenderer().render(expression, tableOf(expression)));
    }

    @Test
    @DisplayName("Custom policy")
    void testCustomPolicy() {
        RenderPolicy policy = RenderPolicy.builder()
                .cellWidth(3)
                .symbols('T', 'F')
                .outputHeading("Q")
                .build();

        String expected = String.join("\n",
                "  A' = Q  ",
                " ------- ",
                "| A | Q |",
                "|-------|",
                "| F | T |",
                "| T | F |",
                " -------"
        );

        assertEquals(expected, new BorderedTableRenderer(policy).render("A'", tableOf("A'")));
    }

    @Test
    @DisplayName("Expression without identifiers has a single column")
    void testConstantExpression() {
        String rendered = new BorderedTableRenderer().render("1.0", tableOf("1.0"));

        assertTrue(rendered.contains("\n|  OUT  |\n"));
        assertTrue(rendered.contains("\n|   0   |\n"));
        assertEquals(6, rendered.split("\n").length);
    }

    @ParameterizedTest(name = "center(\"{0}\", {1})")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "OUT  | 7 | \"  OUT  \"",
            "1    | 7 | \"   1   \"",
            "AB   | 7 | \"   AB  \"",
            "AB   | 6 | \"  AB  \"",
            "ABC  | 6 | \" ABC  \"",
            "ABCD | 2 | ABCD"
    })
    @DisplayName("Centering matches Python's str.center")
    void testCenter(String text, int width, String expected) {
        assertEquals(expected, BorderedTableRenderer.center(text, width));
    }
}
