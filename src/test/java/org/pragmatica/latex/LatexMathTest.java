package org.pragmatica.latex;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.lexer.TokenKind;
import org.pragmatica.latex.parser.ParserConfig;
import org.pragmatica.latex.tree.Node;
import org.pragmatica.latex.zipper.Zipper;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LatexMathTest {

    @Test
    void parse_thenToLatex_normalizesWhitespace() {
        var ast = LatexMath.parse("\\frac { a } { b } ^ 2");

        assertEquals("\\frac{a}{b}^2", LatexMath.toLatex(ast));
    }

    @Test
    void parse_withConfig_restrictsEnvironments() {
        var config = ParserConfig.DEFAULT.withMatrixEnvironments(Set.of("matrix"));

        assertThrows(org.pragmatica.latex.error.ParseException.class,
                     () -> LatexMath.parse("\\begin{pmatrix}a\\end{pmatrix}", config));
        assertInstanceOf(Node.MatrixEnv.class,
                         LatexMath.parse("\\begin{matrix}a\\end{matrix}", config).children().get(0));
    }

    @Test
    void tokenize_endsWithEof() {
        var tokens = LatexMath.tokenize("x^2");

        assertEquals(TokenKind.EOF, tokens.get(tokens.size() - 1).kind());
        assertEquals(4, tokens.size());
    }

    @Test
    void zipper_editAndSerialize() {
        var ast = LatexMath.parse("\\frac{a}{b}^2");
        var replacement = LatexMath.parse("c").children().get(0);

        var edited = LatexMath.zipper(ast)
                              .downFirst()
                              .flatMap(Zipper::downFirst)
                              .map(z -> z.replace(replacement))
                              .map(Zipper::toAst)
                              .orElseThrow();

        assertEquals("c^2", LatexMath.toLatex(edited));
    }
}
