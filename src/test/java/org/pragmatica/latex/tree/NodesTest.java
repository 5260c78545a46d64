package org.pragmatica.latex.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.parser.ParserConfig;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodesTest {

    private final NodeFactory nodes = NodeFactory.create();

    // === childrenOf ===

    @Test
    void childrenOf_root_putsIndexBeforeRadicand() {
        var radicand = nodes.symbol(SourceSpan.of(8, 9), "x");
        var index = nodes.sequence(SourceSpan.of(6, 7), List.of(nodes.symbol(SourceSpan.of(6, 7), "3")));
        var root = nodes.root(SourceSpan.of(0, 9), radicand, Optional.of(index));

        assertEquals(List.of(index, radicand), Nodes.childrenOf(root));
    }

    @Test
    void childrenOf_supSub_ordersBaseSuperscriptSubscript() {
        var supSub = (Node.SupSub) LatexParser.parse("x_i^2").children().get(0);

        var children = Nodes.childrenOf(supSub);

        assertThat(children).extracting(child -> ((Node.Symbol) child).text())
                            .containsExactly("x", "2", "i");
    }

    @Test
    void childrenOf_leaves_areEmpty() {
        assertTrue(Nodes.childrenOf(nodes.symbol(SourceSpan.of(0, 1), "a")).isEmpty());
        assertTrue(Nodes.childrenOf(nodes.textBlock(SourceSpan.of(0, 8), "\\text", "ab")).isEmpty());
    }

    @Test
    void childrenOf_matrixEnv_returnsRows() {
        var env = (Node.MatrixEnv) LatexParser.parse("\\begin{matrix}a\\\\b\\end{matrix}").children().get(0);

        assertEquals(List.copyOf(env.rows()), Nodes.childrenOf(env));
    }

    // === replaceChildById ===

    @Test
    void replaceChildById_inSequence_keepsIdAndRecomputesSpan() {
        var a = nodes.symbol(SourceSpan.of(0, 1), "a");
        var b = nodes.symbol(SourceSpan.of(1, 2), "b");
        var sequence = nodes.sequence(SourceSpan.of(0, 2), List.of(a, b));
        var wide = nodes.symbol(SourceSpan.of(1, 6), "bbbbb");

        var updated = (Node.Sequence) Nodes.replaceChildById(sequence, b.id(), wide);

        assertEquals(sequence.id(), updated.id());
        assertEquals(List.of(a, wide), updated.children());
        assertEquals(SourceSpan.of(0, 6), updated.span());
    }

    @Test
    void replaceChildById_inFraction_replacesOnlyMatchingSlot() {
        var fraction = (Node.Fraction) LatexParser.parse("\\frac{a}{b}").children().get(0);
        var replacement = nodes.symbol(SourceSpan.of(8, 9), "c");

        var updated = (Node.Fraction) Nodes.replaceChildById(fraction, fraction.denominator().id(), replacement);

        assertEquals(fraction.id(), updated.id());
        assertSame(fraction.numerator(), updated.numerator());
        assertSame(replacement, updated.denominator());
    }

    @Test
    void replaceChildById_supSubScript_replacesScript() {
        var supSub = (Node.SupSub) LatexParser.parse("x^2").children().get(0);
        var replacement = nodes.symbol(SourceSpan.of(2, 3), "3");

        var updated = (Node.SupSub) Nodes.replaceChildById(supSub, supSub.superscript().orElseThrow().id(), replacement);

        assertEquals(Optional.of(replacement), updated.superscript());
        assertEquals(supSub.base(), updated.base());
    }

    @Test
    void replaceChildById_noMatch_returnsParentUnchanged() {
        var sequence = LatexParser.parse("{a}{b}");

        assertSame(sequence, Nodes.replaceChildById(sequence, "missing", nodes.symbol(SourceSpan.at(0), "z")));
    }

    @Test
    void replaceChildById_nonRowIntoMatrix_throws() {
        var env = (Node.MatrixEnv) LatexParser.parse("\\begin{matrix}a\\end{matrix}").children().get(0);
        var symbol = nodes.symbol(SourceSpan.at(0), "z");

        assertThrows(IllegalArgumentException.class,
                     () -> Nodes.replaceChildById(env, env.rows().get(0).id(), symbol));
    }

    // === Lookup and traversal ===

    @Test
    void preorder_visitsParentsBeforeChildren() {
        var ast = LatexParser.parse("\\frac{a}{b}");

        var kinds = Nodes.preorder(ast).stream().map(Node::kind).toList();

        assertEquals(List.of(NodeKind.SEQUENCE, NodeKind.FRACTION, NodeKind.GROUP, NodeKind.SYMBOL,
                             NodeKind.GROUP, NodeKind.SYMBOL), kinds);
    }

    @Test
    void findById_locatesNestedNode() {
        var ast = LatexParser.parse("\\sqrt[3]{x}");
        var symbolX = Nodes.preorder(ast).stream()
                           .filter(node -> node instanceof Node.Symbol symbol && symbol.text().equals("x"))
                           .findFirst()
                           .orElseThrow();

        assertEquals(Optional.of(symbolX), Nodes.findById(ast, symbolX.id()));
        assertEquals(Optional.empty(), Nodes.findById(ast, "node-999"));
    }

    @Test
    void preorder_parse_hasUniqueIdentities() {
        var ast = LatexParser.parse("\\frac{x^2}{\\sqrt[n]{y_i}} + \\begin{pmatrix} a & b \\\\ c & \\text{d} \\end{pmatrix}");
        var all = Nodes.preorder(ast);

        var ids = new HashSet<String>();
        all.forEach(node -> ids.add(node.id()));

        assertEquals(all.size(), ids.size());
    }

    // === Equivalence ===

    @Test
    void equivalent_ignoresIdentitiesAndSpans() {
        var first = LatexParser.parse("x^2");
        var second = LatexParser.parse("  x ^ 2", ParserConfig.DEFAULT, NodeFactory.using(NodeIds.startingAt(50)));

        assertNotEquals(first, second);
        assertTrue(Nodes.equivalent(first, second));
    }

    @Test
    void equivalent_differentLeafText_isFalse() {
        assertFalse(Nodes.equivalent(LatexParser.parse("x^2"), LatexParser.parse("x^3")));
        assertFalse(Nodes.equivalent(LatexParser.parse("\\text{a}"), LatexParser.parse("\\textbf{a}")));
    }

    @Test
    void equivalent_bracedSingletonArgument_matchesBareArgument() {
        assertTrue(Nodes.equivalent(LatexParser.parse("x^2"), LatexParser.parse("x^{2}")));
        assertTrue(Nodes.equivalent(LatexParser.parse("\\frac 1 2"), LatexParser.parse("\\frac{1}{2}")));
        assertFalse(Nodes.equivalent(LatexParser.parse("{2}"), LatexParser.parse("2")));
    }

    // === Identities ===

    @Test
    void nodeIds_continuing_resumesAfterLargestIdentity() {
        var ast = LatexParser.parse("x^2", ParserConfig.DEFAULT, NodeFactory.using(NodeIds.startingAt(7)));

        var ids = NodeIds.continuing(ast);

        // x, 2, the sup/sub and the root sequence
        assertEquals(11, ids.peek());
        assertEquals("node-11", ids.next());
    }

    @Test
    void nodeIds_startingAt_negative_throws() {
        assertThrows(IllegalArgumentException.class, () -> NodeIds.startingAt(-1));
    }
}
