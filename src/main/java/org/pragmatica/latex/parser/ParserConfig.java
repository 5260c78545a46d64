package org.pragmatica.latex.parser;

import java.util.Set;

/**
 * Parser configuration options.
 *
 * @param textCommands       commands whose braced argument is captured verbatim as a text block
 * @param matrixEnvironments environment names accepted by {@code \begin}
 * @param maxInputSize       largest accepted input, in UTF-16 code units
 * @param maxNestingDepth    deepest accepted nesting of groups, fractions, roots and environments
 */
public record ParserConfig(
    Set<String> textCommands,
    Set<String> matrixEnvironments,
    int maxInputSize,
    int maxNestingDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        Set.of("\\text", "\\textrm", "\\textbf", "\\textit", "\\textsf", "\\texttt", "\\mathrm", "\\operatorname"),
        Set.of("matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix", "smallmatrix"),
        1_000_000,
        256
    );

    public ParserConfig {
        textCommands = Set.copyOf(textCommands);
        matrixEnvironments = Set.copyOf(matrixEnvironments);
        if (maxInputSize < 0) {
            throw new IllegalArgumentException("maxInputSize must be non-negative, got " + maxInputSize);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public ParserConfig withTextCommands(Set<String> commands) {
        return new ParserConfig(commands, matrixEnvironments, maxInputSize, maxNestingDepth);
    }

    public ParserConfig withMatrixEnvironments(Set<String> environments) {
        return new ParserConfig(textCommands, environments, maxInputSize, maxNestingDepth);
    }

    public ParserConfig withMaxInputSize(int size) {
        return new ParserConfig(textCommands, matrixEnvironments, size, maxNestingDepth);
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(textCommands, matrixEnvironments, maxInputSize, depth);
    }
}
