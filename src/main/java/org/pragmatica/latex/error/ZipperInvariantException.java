package org.pragmatica.latex.error;

/**
 * A zipper reached a state that well-formed zippers never reach, such as rebuilding a matrix
 * environment around something that is not a row. Signals a programming error, not a navigation miss.
 */
public class ZipperInvariantException extends IllegalStateException {
    public ZipperInvariantException(String message) {
        super(message);
    }
}
