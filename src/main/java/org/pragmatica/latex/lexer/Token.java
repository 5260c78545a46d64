package org.pragmatica.latex.lexer;

import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;

/**
 * A classified slice of the source.
 *
 * @param kind  token class
 * @param text  token text; for commands the backslash plus the name
 * @param span  offsets covered
 * @param start resolved location of {@code span.start()}
 * @param end   resolved location of {@code span.end()}
 */
public record Token(TokenKind kind, String text, SourceSpan span, SourceLocation start, SourceLocation end) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isCommand(String name) {
        return kind == TokenKind.COMMAND && text.equals(name);
    }

    /**
     * Short description for error messages.
     */
    public String describe() {
        return switch (kind) {
            case EOF -> kind.display();
            case COMMAND, TEXT -> kind.display() + " '" + text + "'";
            default -> kind.display();
        };
    }
}
