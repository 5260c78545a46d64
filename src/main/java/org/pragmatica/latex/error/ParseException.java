package org.pragmatica.latex.error;

import org.pragmatica.latex.tree.SourceLocation;

/**
 * Thrown when the input cannot be parsed. The whole parse is aborted; there is no recovery.
 */
public class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super("Parse error at " + error.location().describe() + ": " + error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public SourceLocation location() {
        return error.location();
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.of(error);
    }
}
