package org.pragmatica.latex.tree;

import java.util.List;
import java.util.Optional;

/**
 * Creates nodes with identities minted by a shared {@link NodeIds}.
 */
public final class NodeFactory {
    private final NodeIds ids;

    private NodeFactory(NodeIds ids) {
        this.ids = ids;
    }

    public static NodeFactory create() {
        return new NodeFactory(NodeIds.create());
    }

    public static NodeFactory using(NodeIds ids) {
        return new NodeFactory(ids);
    }

    public NodeIds ids() {
        return ids;
    }

    public Node.Sequence sequence(SourceSpan span, List<Node> children) {
        return new Node.Sequence(ids.next(), span, children);
    }

    public Node.Group group(SourceSpan span, List<Node> children) {
        return new Node.Group(ids.next(), span, children);
    }

    public Node.Fraction fraction(SourceSpan span, Node numerator, Node denominator) {
        return new Node.Fraction(ids.next(), span, numerator, denominator);
    }

    public Node.Root root(SourceSpan span, Node radicand, Optional<Node> index) {
        return new Node.Root(ids.next(), span, radicand, index);
    }

    public Node.SupSub supSub(SourceSpan span, Node base, Optional<Node> superscript, Optional<Node> subscript) {
        return new Node.SupSub(ids.next(), span, base, superscript, subscript);
    }

    public Node.Symbol symbol(SourceSpan span, String text) {
        return new Node.Symbol(ids.next(), span, text);
    }

    public Node.TextBlock textBlock(SourceSpan span, String command, String rawText) {
        return new Node.TextBlock(ids.next(), span, command, rawText);
    }

    public Node.MatrixRow matrixRow(SourceSpan span, List<Node> cells) {
        return new Node.MatrixRow(ids.next(), span, cells);
    }

    public Node.MatrixEnv matrixEnv(SourceSpan span, String environment, List<Node.MatrixRow> rows) {
        return new Node.MatrixEnv(ids.next(), span, environment, rows);
    }

    /**
     * Empty group standing in for a required child that was removed.
     */
    public Node.Group placeholder(int offset) {
        return group(SourceSpan.at(offset), List.of());
    }
}
