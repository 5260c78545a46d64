package org.pragmatica.latex.tree;

/**
 * Variant tag of a {@link Node}.
 */
public enum NodeKind {
    SEQUENCE("sequence"),
    GROUP("group"),
    FRACTION("fraction"),
    ROOT("root"),
    SUP_SUB("sup/sub"),
    SYMBOL("symbol"),
    TEXT_BLOCK("text block"),
    MATRIX_ROW("matrix row"),
    MATRIX_ENV("matrix environment");

    private final String display;

    NodeKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Whether the node holds an ordered, freely resizable child list.
     */
    public boolean isListShaped() {
        return this == SEQUENCE || this == GROUP || this == MATRIX_ROW;
    }
}
