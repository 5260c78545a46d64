package org.pragmatica.latex.error;

import org.pragmatica.latex.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected token.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + ", expected " + expected;
        }
    }

    /**
     * Input ended while a construct was still open.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input, expected " + expected;
        }
    }

    /**
     * Well-formed tokens that violate a structural rule (duplicate script, mismatched environment, ...).
     */
    record SemanticError(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason;
        }
    }
}
