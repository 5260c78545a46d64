package org.pragmatica.latex.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generic traversal and rewriting utilities over {@link Node}.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Logically ordered children of a node:
     * <ul>
     *   <li>Sequence, Group, MatrixRow - their list</li>
     *   <li>Fraction - numerator, denominator</li>
     *   <li>Root - index (if present), radicand</li>
     *   <li>SupSub - base, superscript (if present), subscript (if present)</li>
     *   <li>MatrixEnv - its rows</li>
     *   <li>Symbol, TextBlock - none</li>
     * </ul>
     */
    public static List<Node> childrenOf(Node node) {
        return node.accept(CHILDREN);
    }

    /**
     * Span covering the first through last node of the list, or the fallback when the list is empty.
     */
    public static SourceSpan spanOf(List<? extends Node> children, SourceSpan fallback) {
        if (children.isEmpty()) {
            return fallback;
        }
        return SourceSpan.of(children.get(0).span().start(),
                             Math.max(children.get(0).span().start(),
                                      children.get(children.size() - 1).span().end()));
    }

    /**
     * Copy of the parent with the child identified by {@code oldId} swapped for {@code newChild}.
     * The parent keeps its identity and its span is recomputed from the new child list.
     * If no direct child matches, the parent is returned unchanged.
     *
     * @throws IllegalArgumentException if a matrix row would be replaced with something that is not a row
     */
    public static Node replaceChildById(Node parent, String oldId, Node newChild) {
        if (childrenOf(parent).stream().noneMatch(child -> child.id().equals(oldId))) {
            return parent;
        }
        return parent.accept(new ChildReplacer(oldId, newChild));
    }

    public static Optional<Node> findById(Node root, String id) {
        if (root.id().equals(id)) {
            return Optional.of(root);
        }
        for (var child : childrenOf(root)) {
            var found = findById(child, id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * All nodes of the tree in document (pre-)order, root first.
     */
    public static List<Node> preorder(Node root) {
        var result = new ArrayList<Node>();
        collect(root, result);
        return result;
    }

    /**
     * Structural equivalence: same variants, same leaf text, same shape. Identities and spans are ignored.
     *
     * <p>An argument slot (script, fraction part or radicand) holding a non-group node is equivalent to a
     * group whose only child is that node, since the serializer braces such arguments.
     */
    public static boolean equivalent(Node left, Node right) {
        if (left.kind() != right.kind()) {
            return false;
        }
        return switch (left.kind()) {
            case SEQUENCE, GROUP, MATRIX_ROW, MATRIX_ENV -> sameText(left, right) && equivalentAll(childrenOf(left), childrenOf(right));
            case FRACTION -> {
                var l = (Node.Fraction) left;
                var r = (Node.Fraction) right;
                yield equivalentArgument(l.numerator(), r.numerator()) && equivalentArgument(l.denominator(), r.denominator());
            }
            case ROOT -> {
                var l = (Node.Root) left;
                var r = (Node.Root) right;
                yield equivalentArgument(l.radicand(), r.radicand()) && equivalentOptional(l.index(), r.index(), false);
            }
            case SUP_SUB -> {
                var l = (Node.SupSub) left;
                var r = (Node.SupSub) right;
                yield equivalent(l.base(), r.base())
                      && equivalentOptional(l.superscript(), r.superscript(), true)
                      && equivalentOptional(l.subscript(), r.subscript(), true);
            }
            case SYMBOL, TEXT_BLOCK -> sameText(left, right);
        };
    }

    private static boolean sameText(Node left, Node right) {
        if (left instanceof Node.Symbol l && right instanceof Node.Symbol r) {
            return l.text().equals(r.text());
        }
        if (left instanceof Node.TextBlock l && right instanceof Node.TextBlock r) {
            return l.command().equals(r.command()) && l.rawText().equals(r.rawText());
        }
        if (left instanceof Node.MatrixEnv l && right instanceof Node.MatrixEnv r) {
            return l.environment().equals(r.environment());
        }
        return true;
    }

    private static boolean equivalentAll(List<Node> left, List<Node> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!equivalent(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean equivalentOptional(Optional<Node> left, Optional<Node> right, boolean argumentSlot) {
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty();
        }
        return argumentSlot ? equivalentArgument(left.get(), right.get()) : equivalent(left.get(), right.get());
    }

    private static boolean equivalentArgument(Node left, Node right) {
        return equivalent(left, right)
               || equivalent(unwrapSingleton(left), right)
               || equivalent(left, unwrapSingleton(right));
    }

    private static Node unwrapSingleton(Node node) {
        if (node instanceof Node.Group group && group.children().size() == 1) {
            return group.children().get(0);
        }
        return node;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (var child : childrenOf(node)) {
            collect(child, out);
        }
    }

    private static final Node.Visitor<List<Node>> CHILDREN = new Node.Visitor<>() {
        @Override
        public List<Node> visitSequence(Node.Sequence node) {
            return node.children();
        }

        @Override
        public List<Node> visitGroup(Node.Group node) {
            return node.children();
        }

        @Override
        public List<Node> visitFraction(Node.Fraction node) {
            return List.of(node.numerator(), node.denominator());
        }

        @Override
        public List<Node> visitRoot(Node.Root node) {
            return node.index()
                       .map(index -> List.of(index, node.radicand()))
                       .orElseGet(() -> List.of(node.radicand()));
        }

        @Override
        public List<Node> visitSupSub(Node.SupSub node) {
            var kids = new ArrayList<Node>(3);
            kids.add(node.base());
            node.superscript().ifPresent(kids::add);
            node.subscript().ifPresent(kids::add);
            return List.copyOf(kids);
        }

        @Override
        public List<Node> visitSymbol(Node.Symbol node) {
            return List.of();
        }

        @Override
        public List<Node> visitTextBlock(Node.TextBlock node) {
            return List.of();
        }

        @Override
        public List<Node> visitMatrixRow(Node.MatrixRow node) {
            return node.cells();
        }

        @Override
        public List<Node> visitMatrixEnv(Node.MatrixEnv node) {
            return List.copyOf(node.rows());
        }
    };

    private static final class ChildReplacer implements Node.Visitor<Node> {
        private final String oldId;
        private final Node newChild;

        ChildReplacer(String oldId, Node newChild) {
            this.oldId = oldId;
            this.newChild = newChild;
        }

        @Override
        public Node visitSequence(Node.Sequence node) {
            var children = swap(node.children());
            return new Node.Sequence(node.id(), spanOf(children, node.span()), children);
        }

        @Override
        public Node visitGroup(Node.Group node) {
            var children = swap(node.children());
            return new Node.Group(node.id(), spanOf(children, node.span()), children);
        }

        @Override
        public Node visitFraction(Node.Fraction node) {
            var numerator = matches(node.numerator()) ? newChild : node.numerator();
            var denominator = !matches(node.numerator()) && matches(node.denominator()) ? newChild : node.denominator();
            return new Node.Fraction(node.id(), spanOf(List.of(numerator, denominator), node.span()), numerator, denominator);
        }

        @Override
        public Node visitRoot(Node.Root node) {
            var indexMatches = node.index().filter(this::matches).isPresent();
            var index = indexMatches ? Optional.of(newChild) : node.index();
            var radicand = !indexMatches && matches(node.radicand()) ? newChild : node.radicand();
            var updated = new Node.Root(node.id(), node.span(), radicand, index);
            return new Node.Root(node.id(), spanOf(childrenOf(updated), node.span()), radicand, index);
        }

        @Override
        public Node visitSupSub(Node.SupSub node) {
            var base = node.base();
            var superscript = node.superscript();
            var subscript = node.subscript();
            if (matches(base)) {
                base = newChild;
            } else if (superscript.filter(this::matches).isPresent()) {
                superscript = Optional.of(newChild);
            } else {
                subscript = Optional.of(newChild);
            }
            var updated = new Node.SupSub(node.id(), node.span(), base, superscript, subscript);
            return new Node.SupSub(node.id(), spanOf(childrenOf(updated), node.span()), base, superscript, subscript);
        }

        @Override
        public Node visitSymbol(Node.Symbol node) {
            return node;
        }

        @Override
        public Node visitTextBlock(Node.TextBlock node) {
            return node;
        }

        @Override
        public Node visitMatrixRow(Node.MatrixRow node) {
            var cells = swap(node.cells());
            return new Node.MatrixRow(node.id(), spanOf(cells, node.span()), cells);
        }

        @Override
        public Node visitMatrixEnv(Node.MatrixEnv node) {
            if (!(newChild instanceof Node.MatrixRow row)) {
                throw new IllegalArgumentException("Matrix environment children must be rows, got " + newChild.kind().display());
            }
            var rows = new ArrayList<Node.MatrixRow>(node.rows().size());
            for (var existing : node.rows()) {
                rows.add(matches(existing) ? row : existing);
            }
            return new Node.MatrixEnv(node.id(), spanOf(rows, node.span()), node.environment(), rows);
        }

        private List<Node> swap(List<Node> children) {
            var result = new ArrayList<Node>(children.size());
            for (var child : children) {
                result.add(matches(child) ? newChild : child);
            }
            return result;
        }

        private boolean matches(Node child) {
            return child.id().equals(oldId);
        }
    }
}
