package org.pragmatica.latex.lexer;

import org.pragmatica.latex.tree.LineIndex;
import org.pragmatica.latex.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the LaTeX math subset.
 *
 * <p>Total over its input: every character ends up in some token, and calls past the end keep
 * returning {@link TokenKind#EOF}. Rules, in priority order:
 * <ol>
 *   <li>a whitespace run is one {@code WHITESPACE} token</li>
 *   <li>{@code %} starts a comment running to the next newline</li>
 *   <li>{@code { } [ ] ^ _ &} are single-character tokens</li>
 *   <li>{@code \\} is a row break, {@code \name} a command (maximal letter run), {@code \x} a
 *       one-character command, and a trailing {@code \} a lone backslash</li>
 *   <li>anything else is a text run up to the next special character</li>
 * </ol>
 */
public final class LatexLexer {
    private final String source;
    private final LineIndex lineIndex;
    private int pos;

    public LatexLexer(String source) {
        this.source = source;
        this.lineIndex = LineIndex.of(source);
        this.pos = 0;
    }

    /**
     * All tokens of the input, ending with a single EOF token.
     */
    public static List<Token> tokenize(String source) {
        var lexer = new LatexLexer(source);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (!token.is(TokenKind.EOF));
        return tokens;
    }

    public String source() {
        return source;
    }

    public LineIndex lineIndex() {
        return lineIndex;
    }

    /**
     * Move to an absolute offset. Used after a verbatim capture to continue lexing behind it.
     */
    public void reset(int offset) {
        if (offset < 0 || offset > source.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside [0, " + source.length() + "]");
        }
        this.pos = offset;
    }

    /**
     * Find the brace closing a group whose content starts at {@code contentStart}, at the character level.
     * Nested braces are balanced, a backslash escapes the following character, and {@code %} has no
     * special meaning.
     *
     * @return offset of the closing brace, or -1 if the group is unterminated
     */
    public int scanVerbatimGroup(int contentStart) {
        int depth = 0;
        int i = contentStart;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
            i++;
        }
        return -1;
    }

    public Token next() {
        if (isAtEnd()) {
            return token(TokenKind.EOF, pos, "");
        }
        int start = pos;
        char c = peek();
        if (isWhitespace(c)) {
            return scanWhitespace(start);
        }
        if (c == '%') {
            return scanComment(start);
        }
        var single = singleCharKind(c);
        if (single != null) {
            pos++;
            return token(single, start, String.valueOf(c));
        }
        if (c == '\\') {
            return scanBackslash(start);
        }
        return scanText(start);
    }

    private Token scanWhitespace(int start) {
        while (!isAtEnd() && isWhitespace(peek())) {
            pos++;
        }
        return token(TokenKind.WHITESPACE, start, source.substring(start, pos));
    }

    private Token scanComment(int start) {
        while (!isAtEnd() && peek() != '\n') {
            pos++;
        }
        return token(TokenKind.COMMENT, start, source.substring(start, pos));
    }

    private Token scanBackslash(int start) {
        pos++;
        // skip '\'
        if (isAtEnd()) {
            return token(TokenKind.BACKSLASH, start, "\\");
        }
        char next = peek();
        if (next == '\\') {
            pos++;
            return token(TokenKind.DOUBLE_BACKSLASH, start, "\\\\");
        }
        if (isAsciiLetter(next)) {
            while (!isAtEnd() && isAsciiLetter(peek())) {
                pos++;
            }
            return token(TokenKind.COMMAND, start, source.substring(start, pos));
        }
        // escaped symbol: '\' plus exactly one character
        pos += Character.charCount(source.codePointAt(pos));
        return token(TokenKind.COMMAND, start, source.substring(start, pos));
    }

    private Token scanText(int start) {
        pos++;
        while (!isAtEnd() && isTextChar(peek())) {
            pos++;
        }
        return token(TokenKind.TEXT, start, source.substring(start, pos));
    }

    private Token token(TokenKind kind, int start, String text) {
        var span = SourceSpan.of(start, pos);
        return new Token(kind, text, span, lineIndex.start(span), lineIndex.end(span));
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private static TokenKind singleCharKind(char c) {
        return switch (c) {
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            case '^' -> TokenKind.CARET;
            case '_' -> TokenKind.UNDERSCORE;
            case '&' -> TokenKind.AMPERSAND;
            default -> null;
        };
    }

    /**
     * Whether {@code c} continues a text run.
     */
    public static boolean isTextChar(char c) {
        return !isWhitespace(c) && c != '%' && c != '\\' && singleCharKind(c) == null;
    }

    public static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    public static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
