package org.pragmatica.latex.lexer;

/**
 * Token classes produced by {@link LatexLexer}.
 */
public enum TokenKind {
    LBRACE("'{'"),
    RBRACE("'}'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    // lone '\' at end of input
    BACKSLASH("'\\'"),
    COMMAND("command"),
    CARET("'^'"),
    UNDERSCORE("'_'"),
    AMPERSAND("'&'"),
    DOUBLE_BACKSLASH("'\\\\'"),
    TEXT("text"),
    WHITESPACE("whitespace"),
    COMMENT("comment"),
    EOF("end of input");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Tokens the parser never sees through its normal advance.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
