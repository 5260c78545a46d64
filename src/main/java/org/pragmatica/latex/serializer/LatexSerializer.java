package org.pragmatica.latex.serializer;

import org.pragmatica.latex.lexer.LatexLexer;
import org.pragmatica.latex.lexer.TokenKind;
import org.pragmatica.latex.tree.Node;

import java.util.List;
import java.util.Optional;

/**
 * Converts a tree back to LaTeX source.
 *
 * <p>Output reparses to an equivalent tree but is not byte-identical to the original input:
 * whitespace and comments are dropped, and a single space is emitted where two adjacent pieces
 * would otherwise lex as one token ({@code \alpha} followed by {@code b}, or two text runs).
 */
public final class LatexSerializer {
    private static final Renderer RENDERER = new Renderer();

    private LatexSerializer() {}

    public static String toLatex(Node node) {
        return node.accept(RENDERER);
    }

    /**
     * Concatenates rendered pieces, separating those that would fuse into one token.
     */
    static String join(List<String> pieces) {
        var sb = new StringBuilder();
        for (var piece : pieces) {
            append(sb, piece, true);
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String piece, boolean separateTextRuns) {
        if (sb.length() > 0 && !piece.isEmpty() && needsSeparator(sb, piece.charAt(0), separateTextRuns)) {
            sb.append(' ');
        }
        sb.append(piece);
    }

    private static boolean needsSeparator(CharSequence left, char next, boolean separateTextRuns) {
        if (endsWithControlWord(left)) {
            return LatexLexer.isAsciiLetter(next);
        }
        if (endsWithControlSymbol(left)) {
            return false;
        }
        return separateTextRuns
               && LatexLexer.isTextChar(left.charAt(left.length() - 1))
               && LatexLexer.isTextChar(next);
    }

    private static boolean endsWithControlWord(CharSequence text) {
        int i = text.length();
        while (i > 0 && LatexLexer.isAsciiLetter(text.charAt(i - 1))) {
            i--;
        }
        return i < text.length() && escapedAt(text, i);
    }

    private static boolean endsWithControlSymbol(CharSequence text) {
        int last = text.length() - 1;
        if (last > 0 && Character.isLowSurrogate(text.charAt(last)) && Character.isHighSurrogate(text.charAt(last - 1))) {
            last--;
        }
        return last > 0 && escapedAt(text, last);
    }

    // odd run of backslashes right before index
    private static boolean escapedAt(CharSequence text, int index) {
        int count = 0;
        while (index - count > 0 && text.charAt(index - count - 1) == '\\') {
            count++;
        }
        return count % 2 == 1;
    }

    private static final class Renderer implements Node.Visitor<String> {
        @Override
        public String visitSequence(Node.Sequence node) {
            return join(render(node.children()));
        }

        @Override
        public String visitGroup(Node.Group node) {
            return "{" + join(render(node.children())) + "}";
        }

        @Override
        public String visitFraction(Node.Fraction node) {
            var sb = new StringBuilder("\\frac");
            append(sb, operand(node.numerator()), true);
            append(sb, operand(node.denominator()), true);
            return sb.toString();
        }

        @Override
        public String visitRoot(Node.Root node) {
            var sb = new StringBuilder("\\sqrt");
            node.index().ifPresent(index -> sb.append('[').append(index.accept(this)).append(']'));
            append(sb, operand(node.radicand()), true);
            return sb.toString();
        }

        @Override
        public String visitSupSub(Node.SupSub node) {
            var sb = new StringBuilder(node.base().accept(this));
            script(sb, '^', node.superscript());
            script(sb, '_', node.subscript());
            return sb.toString();
        }

        @Override
        public String visitSymbol(Node.Symbol node) {
            return node.text();
        }

        @Override
        public String visitTextBlock(Node.TextBlock node) {
            return node.command() + "{" + node.rawText() + "}";
        }

        @Override
        public String visitMatrixRow(Node.MatrixRow node) {
            return String.join(" & ", render(node.cells()));
        }

        @Override
        public String visitMatrixEnv(Node.MatrixEnv node) {
            return "\\begin{" + node.environment() + "}\n"
                   + String.join(" \\\\\n", render(node.rows()))
                   + "\n\\end{" + node.environment() + "}";
        }

        private void script(StringBuilder sb, char marker, Optional<Node> script) {
            script.ifPresent(value -> sb.append(marker).append(argument(value)));
        }

        /**
         * Fraction parts and radicands are emitted as they are. Braces are added only for shapes
         * the parser could not read back as a single argument, which arise from zipper edits.
         */
        private String operand(Node node) {
            var rendered = node.accept(this);
            if (node instanceof Node.Sequence || node instanceof Node.SupSub || node instanceof Node.MatrixRow) {
                return "{" + rendered + "}";
            }
            if (node instanceof Node.Symbol symbol && !isSingleToken(symbol.text())) {
                return "{" + rendered + "}";
            }
            return rendered;
        }

        private static boolean isSingleToken(String text) {
            var token = new LatexLexer(text).next();
            return (token.is(TokenKind.TEXT) || token.is(TokenKind.COMMAND))
                   && token.span().end() == text.length();
        }

        /**
         * Smart bracing: groups are already delimited and a single text character needs no braces;
         * everything else is wrapped.
         */
        private String argument(Node node) {
            var rendered = node.accept(this);
            if (node instanceof Node.Group) {
                return rendered;
            }
            if (node instanceof Node.Symbol symbol && isSingleTextChar(symbol.text())) {
                return rendered;
            }
            return "{" + rendered + "}";
        }

        private static boolean isSingleTextChar(String text) {
            return !text.isEmpty()
                   && text.codePointCount(0, text.length()) == 1
                   && LatexLexer.isTextChar(text.charAt(0));
        }

        private List<String> render(List<? extends Node> nodes) {
            return nodes.stream()
                        .map(child -> child.accept(this))
                        .toList();
        }
    }
}
