package org.pragmatica.latex.serializer;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.tree.Node;
import org.pragmatica.latex.tree.NodeFactory;
import org.pragmatica.latex.tree.Nodes;
import org.pragmatica.latex.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LatexSerializerTest {

    private static String roundTrip(String source) {
        return LatexSerializer.toLatex(LatexParser.parse(source));
    }

    // === Smart bracing ===

    @Test
    void toLatex_singleCharacterScript_isBare() {
        assertThat(roundTrip("x^2")).contains("^2").doesNotContain("{");
    }

    @Test
    void toLatex_multiCharacterScript_keepsBraces() {
        assertThat(roundTrip("x^{ab}")).contains("^{ab}");
    }

    @Test
    void toLatex_emptyScript_isEmptyBraces() {
        assertEquals("x^{}", roundTrip("x^{}"));
    }

    @Test
    void toLatex_commandScript_isBraced() {
        assertEquals("x^{\\alpha}", roundTrip("x^\\alpha"));
    }

    @Test
    void toLatex_bothScripts_superscriptFirst() {
        assertEquals("x^2_i", roundTrip("x_i^2"));
    }

    @Test
    void toLatex_textRunScript_isBraced() {
        assertEquals("x^{23}", roundTrip("x^23"));
        assertEquals("x^{23}", roundTrip("x^{23}"));
    }

    @Test
    void toLatex_bracedSingleCharacter_staysBraced() {
        assertEquals("x^{2}", roundTrip("x^{2}"));
    }

    // === Structures ===

    @Test
    void toLatex_fraction() {
        assertEquals("\\frac{a}{b}", roundTrip("\\frac{a}{b}"));
        assertEquals("\\frac1 2", roundTrip("\\frac 1 2"));
        assertEquals("\\frac a b", roundTrip("\\frac a b"));
        assertEquals("\\frac\\alpha\\beta", roundTrip("\\frac\\alpha\\beta"));
        assertEquals("\\frac\\alpha b", roundTrip("\\frac\\alpha b"));
    }

    @Test
    void toLatex_sqrt() {
        assertEquals("\\sqrt[3]{x}", roundTrip("\\sqrt[3]{x}"));
        assertEquals("\\sqrt x", roundTrip("\\sqrt x"));
        assertEquals("\\sqrt\\pi", roundTrip("\\sqrt\\pi"));
    }

    @Test
    void toLatex_textBlock_isVerbatim() {
        assertEquals("\\text{a%b}", roundTrip("\\text{a%b}"));
        assertEquals("\\textbf{ two  words }", roundTrip("\\textbf{ two  words }"));
    }

    @Test
    void toLatex_emptyGroup() {
        assertEquals("{}", roundTrip("{ }"));
    }

    @Test
    void toLatex_matrix_rowsOnSeparateLines() {
        assertEquals("\\begin{pmatrix}\na & b \\\\\nc & d\n\\end{pmatrix}",
                     roundTrip("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}"));
    }

    @Test
    void toLatex_commentsAreDropped() {
        assertEquals("a+b", roundTrip("a+b % sum"));
    }

    // === Token boundaries ===

    @Test
    void toLatex_controlWordBeforeLetter_insertsSpace() {
        assertEquals("\\alpha b", roundTrip("\\alpha b"));
        assertEquals("\\alpha+b", roundTrip("\\alpha +b"));
        assertEquals("\\alpha\\beta", roundTrip("\\alpha \\beta"));
    }

    @Test
    void toLatex_adjacentTextRuns_areSeparated() {
        assertEquals("x y", roundTrip("x y"));
    }

    @Test
    void toLatex_controlSymbol_needsNoSpace() {
        assertEquals("a\\,b", roundTrip("a \\, b"));
    }

    @Test
    void toLatex_constructedTree_usesNodeContents() {
        var nodes = NodeFactory.create();
        var base = nodes.symbol(SourceSpan.at(0), "y");
        var script = nodes.group(SourceSpan.at(0), List.of(nodes.symbol(SourceSpan.at(0), "n"),
                                                          nodes.symbol(SourceSpan.at(0), "\\pi")));
        var supSub = nodes.supSub(SourceSpan.at(0), base, Optional.empty(), Optional.of(script));
        var root = nodes.sequence(SourceSpan.at(0), List.of(supSub, nodes.placeholder(0)));

        assertEquals("y_{n\\pi}{}", LatexSerializer.toLatex(root));
    }

    @Test
    void toLatex_fractionOfTextRuns_separatesArguments() {
        var nodes = NodeFactory.create();
        var fraction = nodes.fraction(SourceSpan.at(0),
                                      nodes.symbol(SourceSpan.at(0), "ab"),
                                      nodes.symbol(SourceSpan.at(0), "c"));

        assertEquals("\\frac ab c", LatexSerializer.toLatex(fraction));
    }

    @Test
    void toLatex_editedFractionPart_isBracedOnlyWhenNotOneArgument() {
        var nodes = NodeFactory.create();
        var sum = nodes.sequence(SourceSpan.at(0), List.of(nodes.symbol(SourceSpan.at(0), "a"),
                                                          nodes.symbol(SourceSpan.at(0), "\\pm"),
                                                          nodes.symbol(SourceSpan.at(0), "b")));
        var square = nodes.supSub(SourceSpan.at(0), nodes.symbol(SourceSpan.at(0), "c"),
                                  Optional.of(nodes.symbol(SourceSpan.at(0), "2")), Optional.empty());
        var fraction = nodes.fraction(SourceSpan.at(0), sum, square);
        var root = nodes.root(SourceSpan.at(0), nodes.symbol(SourceSpan.at(0), ""), Optional.empty());

        assertEquals("\\frac{a\\pm b}{c^2}", LatexSerializer.toLatex(fraction));
        assertEquals("\\sqrt{}", LatexSerializer.toLatex(root));
        var reparsed = (Node.Fraction) LatexParser.parse(LatexSerializer.toLatex(fraction)).children().get(0);
        assertEquals(3, ((Node.Group) reparsed.numerator()).children().size());
        assertInstanceOf(Node.SupSub.class, ((Node.Group) reparsed.denominator()).children().get(0));
    }

    // === Round trip ===

    @ParameterizedTest
    @ValueSource(strings = {
        "x^2",
        "x_i^2",
        "x^{ab}",
        "x^{}",
        "x^23",
        "x^\\alpha",
        "\\frac{a}{b}",
        "\\frac 1 2",
        "\\sqrt\\pi",
        "x^{23}",
        "\\frac a b",
        "\\frac\\alpha\\beta",
        "\\frac{\\frac{1}{2}}{3}",
        "\\sqrt[3]{x+1}",
        "\\sqrt x",
        "\\alpha\\beta",
        "\\alpha b",
        "x y",
        "a \\, b",
        "{a}{b}{c}",
        "[a]",
        "^2",
        "\\left( x \\right)",
        "\\text{a%b}",
        "\\text{x}^2",
        "\\mathrm{d}x",
        "\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}",
        "\\begin{pmatrix} a & \\\\ & b \\end{pmatrix}",
        "\\begin{matrix}a\\\\\\end{matrix}",
        "\\begin{matrix}\\end{matrix}",
        "e^{i\\pi} + 1 = 0 % Euler",
        "\\sum_{k=0}^{n} \\binom{n}{k} x^k"
    })
    void toLatex_reparsesToEquivalentTree(String source) {
        var original = LatexParser.parse(source);
        var serialized = LatexSerializer.toLatex(original);
        var reparsed = LatexParser.parse(serialized);

        assertTrue(Nodes.equivalent(original, reparsed),
                   () -> source + " serialized as " + serialized + " did not reparse to an equivalent tree");
    }

    @Test
    void toLatex_isDeterministic() {
        Node ast = LatexParser.parse("\\frac{x^2}{\\sqrt[n]{y}}");

        assertEquals(LatexSerializer.toLatex(ast), LatexSerializer.toLatex(ast));
    }
}
