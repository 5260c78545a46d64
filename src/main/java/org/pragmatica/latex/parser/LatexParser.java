package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.ParseError;
import org.pragmatica.latex.error.ParseException;
import org.pragmatica.latex.lexer.LatexLexer;
import org.pragmatica.latex.lexer.Token;
import org.pragmatica.latex.lexer.TokenKind;
import org.pragmatica.latex.tree.Node;
import org.pragmatica.latex.tree.NodeFactory;
import org.pragmatica.latex.tree.Nodes;
import org.pragmatica.latex.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Recursive-descent parser for the LaTeX math subset, one token of lookahead.
 *
 * <pre>
 * document  := sequence(EOF)
 * term      := primary ('^' argument | '_' argument)*
 * primary   := fraction | root | textblock | environment | group | symbol
 * fraction  := '\frac' argument argument
 * root      := '\sqrt' ('[' sequence(']') ']')? argument
 * textblock := TEXT_COMMAND '{' verbatim '}'
 * group     := '{' sequence('}') '}'
 * argument  := group | structural command | COMMAND | TEXT
 * </pre>
 *
 * <p>Whitespace and comments are skipped by {@link #advance()}; the verbatim argument of a text
 * command is captured from the source characters directly. The first unexpected token aborts the
 * parse with a {@link ParseException}, as does nesting deeper than
 * {@link ParserConfig#maxNestingDepth()}.
 */
public final class LatexParser {
    private static final Logger log = LoggerFactory.getLogger(LatexParser.class);

    private static final String FRAC = "\\frac";
    private static final String SQRT = "\\sqrt";
    private static final String BEGIN = "\\begin";
    private static final String END = "\\end";

    private final LatexLexer lexer;
    private final ParserConfig config;
    private final NodeFactory nodes;
    private Token look;
    private int depth;

    private LatexParser(LatexLexer lexer, ParserConfig config, NodeFactory nodes) {
        this.lexer = lexer;
        this.config = config;
        this.nodes = nodes;
        advance();
    }

    public static Node.Sequence parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    public static Node.Sequence parse(String source, ParserConfig config) {
        return parse(source, config, NodeFactory.create());
    }

    /**
     * Parse with an explicit node factory, so callers control identity minting.
     *
     * @throws ParseException           if the input is not in the supported subset
     * @throws IllegalArgumentException if the input exceeds {@link ParserConfig#maxInputSize()}
     */
    public static Node.Sequence parse(String source, ParserConfig config, NodeFactory nodes) {
        if (source.length() > config.maxInputSize()) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + config.maxInputSize() + " characters");
        }
        log.debug("Parsing {} characters", source.length());
        var document = new LatexParser(new LatexLexer(source), config, nodes).parseDocument();
        log.debug("Parsed {} top-level terms", document.children().size());
        return document;
    }

    private Node.Sequence parseDocument() {
        var children = terms(token -> false);
        return nodes.sequence(Nodes.spanOf(children, SourceSpan.at(0)), children);
    }

    private Node.Sequence sequence(Predicate<Token> stop) {
        int start = look.span().start();
        var children = terms(stop);
        return nodes.sequence(Nodes.spanOf(children, SourceSpan.at(start)), children);
    }

    private List<Node> terms(Predicate<Token> stop) {
        var children = new ArrayList<Node>();
        while (!look.is(TokenKind.EOF) && !stop.test(look)) {
            children.add(term());
        }
        return children;
    }

    private Node term() {
        switch (look.kind()) {
            case CARET, UNDERSCORE, AMPERSAND, DOUBLE_BACKSLASH, BACKSLASH -> {
                // stray marker with nothing to attach to
                return symbol(consume());
            }
            default -> {
                return scripts(primary());
            }
        }
    }

    private Node primary() {
        return switch (look.kind()) {
            case COMMAND -> command();
            case LBRACE -> group();
            case TEXT, LBRACKET, RBRACKET -> symbol(consume());
            default -> throw fail("a term");
        };
    }

    private Node command() {
        var structural = structuralCommand();
        if (structural.isPresent()) {
            return structural.get();
        }
        if (look.isCommand(END)) {
            throw semantic(look, "\\end without matching \\begin");
        }
        return symbol(consume());
    }

    private Optional<Node> structuralCommand() {
        if (look.isCommand(FRAC)) {
            return Optional.of(fraction());
        }
        if (look.isCommand(SQRT)) {
            return Optional.of(root());
        }
        if (look.isCommand(BEGIN)) {
            return Optional.of(environment());
        }
        if (look.is(TokenKind.COMMAND) && config.textCommands().contains(look.text())) {
            return Optional.of(textBlock());
        }
        return Optional.empty();
    }

    private Node scripts(Node base) {
        Optional<Node> superscript = Optional.empty();
        Optional<Node> subscript = Optional.empty();
        int end = base.span().end();

        while (look.is(TokenKind.CARET) || look.is(TokenKind.UNDERSCORE)) {
            var marker = consume();
            if (marker.is(TokenKind.CARET)) {
                if (superscript.isPresent()) {
                    throw semantic(marker, "Double superscript");
                }
                superscript = Optional.of(argument());
                end = Math.max(end, superscript.get().span().end());
            } else {
                if (subscript.isPresent()) {
                    throw semantic(marker, "Double subscript");
                }
                subscript = Optional.of(argument());
                end = Math.max(end, subscript.get().span().end());
            }
        }

        if (superscript.isEmpty() && subscript.isEmpty()) {
            return base;
        }
        return nodes.supSub(SourceSpan.of(base.span().start(), end), base, superscript, subscript);
    }

    private Node argument() {
        switch (look.kind()) {
            case LBRACE -> {
                return group();
            }
            case COMMAND -> {
                if (look.isCommand(END)) {
                    throw semantic(look, "\\end cannot be used as an argument");
                }
                return structuralCommand().orElseGet(() -> symbol(consume()));
            }
            case TEXT -> {
                return symbol(consume());
            }
            default -> throw fail("a group '{...}' or a single symbol");
        }
    }

    private Node group() {
        enter(look);
        var open = expect(TokenKind.LBRACE, "'{'");
        var body = terms(token -> token.is(TokenKind.RBRACE));
        var close = expect(TokenKind.RBRACE, "'}' to close group");
        leave();
        return nodes.group(SourceSpan.of(open.span().start(), close.span().end()), body);
    }

    private Node fraction() {
        enter(look);
        var command = consume();
        var numerator = argument();
        var denominator = argument();
        leave();
        return nodes.fraction(SourceSpan.of(command.span().start(), denominator.span().end()), numerator, denominator);
    }

    private Node root() {
        enter(look);
        var command = consume();
        Optional<Node> index = Optional.empty();
        int end = command.span().end();
        if (look.is(TokenKind.LBRACKET)) {
            consume();
            index = Optional.of(sequence(token -> token.is(TokenKind.RBRACKET)));
            end = expect(TokenKind.RBRACKET, "']' to close root index").span().end();
        }
        var radicand = argument();
        end = Math.max(end, radicand.span().end());
        leave();
        return nodes.root(SourceSpan.of(command.span().start(), end), radicand, index);
    }

    private Node textBlock() {
        var command = consume();
        if (!look.is(TokenKind.LBRACE)) {
            throw fail("'{' after " + command.text());
        }
        int contentStart = look.span().end();
        int close = lexer.scanVerbatimGroup(contentStart);
        if (close < 0) {
            var error = new ParseError.UnexpectedEof(lexer.lineIndex().locate(lexer.source().length()),
                                                     "'}' to close " + command.text());
            log.debug("Parse failed: {}", error.message());
            throw new ParseException(error);
        }
        var rawText = lexer.source().substring(contentStart, close);
        lexer.reset(close);
        look = lexer.next();
        var closeBrace = expect(TokenKind.RBRACE, "'}' to close " + command.text());
        return nodes.textBlock(SourceSpan.of(command.span().start(), closeBrace.span().end()), command.text(), rawText);
    }

    private Node environment() {
        enter(look);
        var begin = consume();
        expect(TokenKind.LBRACE, "'{' after \\begin");
        var nameToken = expect(TokenKind.TEXT, "environment name");
        expect(TokenKind.RBRACE, "'}' after environment name");
        var name = nameToken.text();
        if (!config.matrixEnvironments().contains(name)) {
            throw semantic(nameToken, "Unsupported environment '" + name + "'");
        }
        var env = matrixBody(begin, name);
        leave();
        return env;
    }

    private Node matrixBody(Token begin, String name) {
        var rows = new ArrayList<Node.MatrixRow>();
        var cells = new ArrayList<Node>();
        int rowStart = look.span().start();

        while (true) {
            if (look.isCommand(END)) {
                var endCommand = look;
                var close = closeEnvironment(name);
                int rowEnd = cells.isEmpty()
                             ? endCommand.span().start()
                             : cells.get(cells.size() - 1).span().end();
                rows.add(nodes.matrixRow(SourceSpan.of(rowStart, Math.max(rowStart, rowEnd)), cells));
                return nodes.matrixEnv(SourceSpan.of(begin.span().start(), close.span().end()), name, rows);
            }
            if (look.is(TokenKind.EOF)) {
                throw fail("\\end{" + name + "}");
            }

            cells.add(sequence(LatexParser::isCellTerminator));

            if (look.is(TokenKind.AMPERSAND)) {
                consume();
            } else if (look.is(TokenKind.DOUBLE_BACKSLASH)) {
                consume();
                int rowEnd = cells.get(cells.size() - 1).span().end();
                rows.add(nodes.matrixRow(SourceSpan.of(rowStart, Math.max(rowStart, rowEnd)), cells));
                cells = new ArrayList<>();
                rowStart = look.span().start();
            }
        }
    }

    private Token closeEnvironment(String name) {
        consume();
        expect(TokenKind.LBRACE, "'{' after \\end");
        var nameToken = expect(TokenKind.TEXT, "environment name '" + name + "'");
        if (!nameToken.text().equals(name)) {
            throw semantic(nameToken, "Environment '" + name + "' closed by \\end{" + nameToken.text() + "}");
        }
        return expect(TokenKind.RBRACE, "'}' after \\end{" + name);
    }

    private static boolean isCellTerminator(Token token) {
        return token.is(TokenKind.AMPERSAND) || token.is(TokenKind.DOUBLE_BACKSLASH) || token.isCommand(END);
    }

    private Node.Symbol symbol(Token token) {
        return nodes.symbol(token.span(), token.text());
    }

    // === Nesting ===

    private void enter(Token at) {
        if (++depth > config.maxNestingDepth()) {
            throw semantic(at, "Nesting exceeds maximum depth of " + config.maxNestingDepth());
        }
    }

    private void leave() {
        depth--;
    }

    // === Token Handling ===

    private void advance() {
        look = lexer.next();
        while (look.kind().isTrivia()) {
            look = lexer.next();
        }
    }

    private Token consume() {
        var current = look;
        advance();
        return current;
    }

    private Token expect(TokenKind kind, String expected) {
        if (!look.is(kind)) {
            throw fail(expected);
        }
        return consume();
    }

    // === Errors ===

    private ParseException fail(String expected) {
        ParseError error = look.is(TokenKind.EOF)
                           ? new ParseError.UnexpectedEof(look.start(), expected)
                           : new ParseError.UnexpectedInput(look.start(), look.describe(), expected);
        log.debug("Parse failed: {}", error.message());
        return new ParseException(error);
    }

    private ParseException semantic(Token at, String reason) {
        var error = new ParseError.SemanticError(at.start(), reason);
        log.debug("Parse failed: {}", reason);
        return new ParseException(error);
    }
}
