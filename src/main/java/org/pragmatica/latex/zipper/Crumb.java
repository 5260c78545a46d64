package org.pragmatica.latex.zipper;

import org.pcollections.PStack;
import org.pragmatica.latex.tree.Node;
import org.pragmatica.latex.tree.NodeKind;
import org.pragmatica.latex.tree.SourceSpan;

import java.util.Objects;

/**
 * One step of a zipper path: everything needed to rebuild the parent around a (possibly new) focus.
 *
 * <p>List-shaped parents keep their sibling lists; fixed-arity parents keep the original parent
 * together with the slot the focus occupies, and the stale slot value is replaced on rebuild.
 */
public sealed interface Crumb {
    String parentId();

    SourceSpan parentSpan();

    /**
     * Named child positions of fixed-arity nodes.
     */
    enum Slot {
        NUMERATOR(true),
        DENOMINATOR(true),
        INDEX(false),
        RADICAND(true),
        BASE(true),
        SUPERSCRIPT(false),
        SUBSCRIPT(false);

        private final boolean required;

        Slot(boolean required) {
            this.required = required;
        }

        /**
         * Whether the parent is malformed without a value in this slot.
         */
        public boolean required() {
            return required;
        }
    }

    /**
     * Focus inside a sequence, group or matrix row.
     *
     * @param left  siblings before the focus, nearest first
     * @param right siblings after the focus, nearest first
     */
    record ListCrumb(NodeKind shape,
                     String parentId,
                     SourceSpan parentSpan,
                     PStack<Node> left,
                     PStack<Node> right) implements Crumb {
        public ListCrumb {
            if (!shape.isListShaped()) {
                throw new IllegalArgumentException("Not a list-shaped parent: " + shape.display());
            }
            Objects.requireNonNull(parentId, "parentId");
            Objects.requireNonNull(parentSpan, "parentSpan");
        }

        public ListCrumb withSiblings(PStack<Node> newLeft, PStack<Node> newRight) {
            return new ListCrumb(shape, parentId, parentSpan, newLeft, newRight);
        }
    }

    /**
     * Focus is a row of a matrix environment.
     */
    record RowsCrumb(String parentId,
                     SourceSpan parentSpan,
                     String environment,
                     PStack<Node.MatrixRow> left,
                     PStack<Node.MatrixRow> right) implements Crumb {
        public RowsCrumb {
            Objects.requireNonNull(parentId, "parentId");
            Objects.requireNonNull(parentSpan, "parentSpan");
            Objects.requireNonNull(environment, "environment");
        }

        public RowsCrumb withSiblings(PStack<Node.MatrixRow> newLeft, PStack<Node.MatrixRow> newRight) {
            return new RowsCrumb(parentId, parentSpan, environment, newLeft, newRight);
        }
    }

    record FractionCrumb(Node.Fraction parent, Slot slot) implements Crumb {
        public FractionCrumb {
            if (slot != Slot.NUMERATOR && slot != Slot.DENOMINATOR) {
                throw new IllegalArgumentException("Fraction has no " + slot + " slot");
            }
        }

        @Override
        public String parentId() {
            return parent.id();
        }

        @Override
        public SourceSpan parentSpan() {
            return parent.span();
        }
    }

    record RootCrumb(Node.Root parent, Slot slot) implements Crumb {
        public RootCrumb {
            if (slot != Slot.INDEX && slot != Slot.RADICAND) {
                throw new IllegalArgumentException("Root has no " + slot + " slot");
            }
        }

        @Override
        public String parentId() {
            return parent.id();
        }

        @Override
        public SourceSpan parentSpan() {
            return parent.span();
        }
    }

    record SupSubCrumb(Node.SupSub parent, Slot slot) implements Crumb {
        public SupSubCrumb {
            if (slot != Slot.BASE && slot != Slot.SUPERSCRIPT && slot != Slot.SUBSCRIPT) {
                throw new IllegalArgumentException("Sup/sub has no " + slot + " slot");
            }
        }

        @Override
        public String parentId() {
            return parent.id();
        }

        @Override
        public SourceSpan parentSpan() {
            return parent.span();
        }
    }
}
