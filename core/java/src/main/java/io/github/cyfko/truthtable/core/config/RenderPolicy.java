package io.github.cyfko.truthtable.core.config;

/**
 * Layout settings of the bordered table renderer.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>cellWidth</strong>: width of every column, borders excluded (default: 7)</li>
 *   <li><strong>trueSymbol</strong> / <strong>falseSymbol</strong>: cell text of each value (default: 1 / 0)</li>
 *   <li><strong>outputHeading</strong>: heading of the result column (default: OUT)</li>
 * </ul>
 *
 * <pre>{@code
 * RenderPolicy compact = RenderPolicy.builder()
 *     .cellWidth(3)
 *     .symbols('T', 'F')
 *     .build();
 * }</pre>
 *
 * @param cellWidth     column width, positive
 * @param trueSymbol    rendering of true
 * @param falseSymbol   rendering of false
 * @param outputHeading heading of the output column, not blank, at most {@code cellWidth} wide
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RenderPolicy(
        int cellWidth,
        char trueSymbol,
        char falseSymbol,
        String outputHeading
) {

    public RenderPolicy {
        if (cellWidth <= 0) {
            throw new IllegalArgumentException("cellWidth must be positive, got: " + cellWidth);
        }
        if (outputHeading == null || outputHeading.isBlank()) {
            throw new IllegalArgumentException("outputHeading is required");
        }
        if (outputHeading.length() > cellWidth) {
            throw new IllegalArgumentException(String.format(
                    "outputHeading '%s' is wider than cellWidth %d", outputHeading, cellWidth));
        }
    }

    public static RenderPolicy defaults() {
        return new RenderPolicy(
                7,      // cellWidth
                '1',    // trueSymbol
                '0',    // falseSymbol
                "OUT"   // outputHeading
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public char symbolOf(boolean value) {
        return value ? trueSymbol : falseSymbol;
    }

    public static class Builder {
        private int _cellWidth = 7;
        private char _trueSymbol = '1';
        private char _falseSymbol = '0';
        private String _outputHeading = "OUT";

        private Builder() {}

        public RenderPolicy build() {
            return new RenderPolicy(_cellWidth, _trueSymbol, _falseSymbol, _outputHeading);
        }

        public Builder cellWidth(int cellWidth) { this._cellWidth = cellWidth; return this; }
        public Builder symbols(char trueSymbol, char falseSymbol) { this._trueSymbol = trueSymbol; this._falseSymbol = falseSymbol; return this; }
        public Builder outputHeading(String outputHeading) { this._outputHeading = outputHeading; return this; }
    }
}
