package org.pragmatica.latex.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AST node for the supported LaTeX math subset.
 *
 * <p>Nodes are immutable values. Children do not reference their parent; editing
 * goes through {@link org.pragmatica.latex.zipper.Zipper}, which rebuilds ancestors on demand.
 * Structural recursion is done with {@link Visitor}, so each new variant has to be handled
 * by every traversal at compile time.
 */
public sealed interface Node {
    /**
     * Identity, unique within one AST generation.
     */
    String id();

    /**
     * The source range this node was derived from.
     */
    SourceSpan span();

    NodeKind kind();

    <R> R accept(Visitor<R> visitor);

    /**
     * Concatenation of terms. The root of every parse is a sequence.
     */
    record Sequence(String id, SourceSpan span, List<Node> children) implements Node {
        public Sequence {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SEQUENCE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * Brace-delimited subexpression {@code {...}}.
     */
    record Group(String id, SourceSpan span, List<Node> children) implements Node {
        public Group {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GROUP;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroup(this);
        }
    }

    record Fraction(String id, SourceSpan span, Node numerator, Node denominator) implements Node {
        public Fraction {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(numerator, "numerator");
            Objects.requireNonNull(denominator, "denominator");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FRACTION;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFraction(this);
        }
    }

    /**
     * {@code \sqrt[index]{radicand}}; the index is optional.
     */
    record Root(String id, SourceSpan span, Node radicand, Optional<Node> index) implements Node {
        public Root {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(radicand, "radicand");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ROOT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRoot(this);
        }
    }

    /**
     * Base with an optional superscript and an optional subscript.
     */
    record SupSub(String id,
                  SourceSpan span,
                  Node base,
                  Optional<Node> superscript,
                  Optional<Node> subscript) implements Node {
        public SupSub {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(superscript, "superscript");
            Objects.requireNonNull(subscript, "subscript");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUP_SUB;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSupSub(this);
        }
    }

    /**
     * Terminal: a text run, a single script-argument character, a bracket, or a command kept verbatim.
     */
    record Symbol(String id, SourceSpan span, String text) implements Node {
        public Symbol {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(text, "text");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SYMBOL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymbol(this);
        }
    }

    /**
     * Text-mode command such as {@code \text{...}}. Content is stored verbatim and never re-parsed.
     */
    record TextBlock(String id, SourceSpan span, String command, String rawText) implements Node {
        public TextBlock {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(command, "command");
            Objects.requireNonNull(rawText, "rawText");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TEXT_BLOCK;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTextBlock(this);
        }
    }

    /**
     * One row of a matrix environment. The parser produces a {@link Sequence} per cell.
     */
    record MatrixRow(String id, SourceSpan span, List<Node> cells) implements Node {
        public MatrixRow {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            cells = List.copyOf(cells);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MATRIX_ROW;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatrixRow(this);
        }
    }

    /**
     * {@code \begin{environment} ... \end{environment}} for the matrix family.
     */
    record MatrixEnv(String id, SourceSpan span, String environment, List<MatrixRow> rows) implements Node {
        public MatrixEnv {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(environment, "environment");
            rows = List.copyOf(rows);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MATRIX_ENV;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatrixEnv(this);
        }
    }

    /**
     * One method per variant.
     */
    interface Visitor<R> {
        R visitSequence(Sequence node);

        R visitGroup(Group node);

        R visitFraction(Fraction node);

        R visitRoot(Root node);

        R visitSupSub(SupSub node);

        R visitSymbol(Symbol node);

        R visitTextBlock(TextBlock node);

        R visitMatrixRow(MatrixRow node);

        R visitMatrixEnv(MatrixEnv node);
    }
}
