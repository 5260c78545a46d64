package org.pragmatica.latex.incremental;

import org.pragmatica.latex.tree.Node;

import java.util.Objects;

/**
 * A source buffer together with the tree parsed from it.
 */
public record DocumentState(SourceBuffer source, Node ast) {
    public DocumentState {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(ast, "ast");
    }

    public String text() {
        return source.text();
    }
}
