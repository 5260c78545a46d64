package org.pragmatica.latex;

import org.pragmatica.latex.lexer.LatexLexer;
import org.pragmatica.latex.lexer.Token;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.parser.ParserConfig;
import org.pragmatica.latex.serializer.LatexSerializer;
import org.pragmatica.latex.tree.Node;
import org.pragmatica.latex.zipper.Zipper;

import java.util.List;

/**
 * Entry point for parsing and editing LaTeX math.
 *
 * <p>Example usage:
 * <pre>{@code
 * var ast = LatexMath.parse("\\frac{a}{b}^2");
 * var edited = LatexMath.zipper(ast)
 *                       .downFirst()
 *                       .flatMap(Zipper::downFirst)
 *                       .map(z -> z.replace(LatexMath.parse("c").children().get(0)))
 *                       .map(Zipper::toAst)
 *                       .orElse(ast);
 * var latex = LatexMath.toLatex(edited);
 * }</pre>
 */
public final class LatexMath {
    private LatexMath() {}

    /**
     * Parse with the default configuration.
     *
     * @throws org.pragmatica.latex.error.ParseException if the input is not valid
     */
    public static Node.Sequence parse(String source) {
        return LatexParser.parse(source);
    }

    public static Node.Sequence parse(String source, ParserConfig config) {
        return LatexParser.parse(source, config);
    }

    /**
     * All tokens of the input, including whitespace and comments, ending with EOF.
     */
    public static List<Token> tokenize(String source) {
        return LatexLexer.tokenize(source);
    }

    public static String toLatex(Node node) {
        return LatexSerializer.toLatex(node);
    }

    /**
     * Zipper at the root of the tree.
     */
    public static Zipper zipper(Node root) {
        return Zipper.fromAst(root);
    }
}
