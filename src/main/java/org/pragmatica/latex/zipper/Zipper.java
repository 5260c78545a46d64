package org.pragmatica.latex.zipper;

import org.pcollections.ConsPStack;
import org.pcollections.PStack;
import org.pragmatica.latex.error.ZipperInvariantException;
import org.pragmatica.latex.tree.Node;
import org.pragmatica.latex.tree.NodeFactory;
import org.pragmatica.latex.tree.NodeIds;
import org.pragmatica.latex.tree.NodeKind;
import org.pragmatica.latex.tree.Nodes;
import org.pragmatica.latex.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable cursor over a tree.
 *
 * <p>A zipper is a focused node plus the path of {@link Crumb}s leading back to the root. Every
 * operation returns a new zipper; ancestors are rebuilt lazily when moving up or calling
 * {@link #toAst()}. Moves that are not possible from the current position return
 * {@link Optional#empty()}.
 *
 * <p>When the focus is a {@link Node.Symbol} the zipper may carry a cursor offset inside its text.
 * Moving down or right onto a symbol puts the cursor at 0, moving left puts it at the end, and
 * moving to anything else or up clears it.
 *
 * <p>Rebuilt list parents take the union span of their children, or the span they had when
 * empty; fixed-arity parents keep the span they had. Identities of rebuilt parents follow the
 * zipper's {@link IdentityPolicy}.
 */
public final class Zipper {
    private static final Logger log = LoggerFactory.getLogger(Zipper.class);
    private static final int NO_CURSOR = -1;

    private final Node focus;
    private final PStack<Crumb> path;
    private final int cursorOffset;
    private final NodeIds ids;
    private final IdentityPolicy policy;

    private Zipper(Node focus, PStack<Crumb> path, int cursorOffset, NodeIds ids, IdentityPolicy policy) {
        this.focus = focus;
        this.path = path;
        this.cursorOffset = cursorOffset;
        this.ids = ids;
        this.policy = policy;
    }

    /**
     * Zipper at the root of the tree. New identities continue after the largest one in the tree.
     */
    public static Zipper fromAst(Node root) {
        return fromAst(root, NodeIds.continuing(root));
    }

    public static Zipper fromAst(Node root, NodeIds ids) {
        return fromAst(root, ids, IdentityPolicy.PRESERVE);
    }

    public static Zipper fromAst(Node root, NodeIds ids, IdentityPolicy policy) {
        return new Zipper(root, ConsPStack.empty(), NO_CURSOR, ids, policy);
    }

    /**
     * Zipper focused on the node with the given identity, with the path repeated {@link #down(int)}
     * calls from the root would build.
     */
    public static Optional<Zipper> locate(Node root, String id) {
        return descendTo(fromAst(root), id);
    }

    public static Optional<Zipper> locate(Node root, String id, NodeIds ids, IdentityPolicy policy) {
        return descendTo(fromAst(root, ids, policy), id);
    }

    private static Optional<Zipper> descendTo(Zipper zipper, String id) {
        if (zipper.focus.id().equals(id)) {
            return Optional.of(zipper);
        }
        int count = Nodes.childrenOf(zipper.focus).size();
        for (int i = 0; i < count; i++) {
            var found = zipper.down(i).flatMap(child -> descendTo(child, id));
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    // === Accessors ===

    public Node focus() {
        return focus;
    }

    /**
     * Crumbs from the focus's parent up to the root.
     */
    public List<Crumb> path() {
        return path;
    }

    public int depth() {
        return path.size();
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    public OptionalInt cursorOffset() {
        return cursorOffset == NO_CURSOR ? OptionalInt.empty() : OptionalInt.of(cursorOffset);
    }

    // === Navigation ===

    public Optional<Zipper> up() {
        return peek(path).map(crumb -> move(rebuild(crumb, focus), path.minus(0), NO_CURSOR));
    }

    /**
     * Move to the child at {@code index} in {@link Nodes#childrenOf(Node)} order.
     */
    public Optional<Zipper> down(int index) {
        var children = Nodes.childrenOf(focus);
        if (index < 0 || index >= children.size()) {
            return Optional.empty();
        }
        var child = children.get(index);
        return Optional.of(move(child, path.plus(crumbFor(index, children)), startCursor(child)));
    }

    public Optional<Zipper> downFirst() {
        return down(0);
    }

    public Optional<Zipper> downLast() {
        return down(Nodes.childrenOf(focus).size() - 1);
    }

    /**
     * Move to the previous sibling. Only sequences, groups, matrix rows and matrix environments
     * have siblings; under a fraction, root or script parent this is empty.
     */
    public Optional<Zipper> left() {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        var crumb = path.get(0);
        if (crumb instanceof Crumb.ListCrumb list) {
            return peek(list.left())
                       .map(sibling -> move(sibling,
                                            path.minus(0).plus(list.withSiblings(list.left().minus(0), list.right().plus(focus))),
                                            endCursor(sibling)));
        }
        if (crumb instanceof Crumb.RowsCrumb rows) {
            return peek(rows.left())
                       .map(sibling -> move(sibling,
                                            path.minus(0).plus(rows.withSiblings(rows.left().minus(0), rows.right().plus(asRow(focus)))),
                                            NO_CURSOR));
        }
        return Optional.empty();
    }

    public Optional<Zipper> right() {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        var crumb = path.get(0);
        if (crumb instanceof Crumb.ListCrumb list) {
            return peek(list.right())
                       .map(sibling -> move(sibling,
                                            path.minus(0).plus(list.withSiblings(list.left().plus(focus), list.right().minus(0))),
                                            startCursor(sibling)));
        }
        if (crumb instanceof Crumb.RowsCrumb rows) {
            return peek(rows.right())
                       .map(sibling -> move(sibling,
                                            path.minus(0).plus(rows.withSiblings(rows.left().plus(asRow(focus)), rows.right().minus(0))),
                                            NO_CURSOR));
        }
        return Optional.empty();
    }

    public Zipper top() {
        var current = this;
        while (!current.path.isEmpty()) {
            var crumb = current.path.get(0);
            current = current.move(current.rebuild(crumb, current.focus), current.path.minus(0), NO_CURSOR);
        }
        return current;
    }

    /**
     * The whole tree with all edits applied.
     */
    public Node toAst() {
        return top().focus;
    }

    // === Editing ===

    /**
     * Swap the focus for another node. No shape checks are done here; an ill-typed replacement
     * is reported when the parent is rebuilt.
     */
    public Zipper replace(Node node) {
        return move(node, path, startCursor(node));
    }

    /**
     * Insert a sibling before the focus. Only list parents accept siblings, and matrix
     * environments only accept rows.
     */
    public Optional<Zipper> insertLeft(Node node) {
        return insert(node, true);
    }

    public Optional<Zipper> insertRight(Node node) {
        return insert(node, false);
    }

    private Optional<Zipper> insert(Node node, boolean before) {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        var crumb = path.get(0);
        if (crumb instanceof Crumb.ListCrumb list) {
            var updated = before
                          ? list.withSiblings(list.left().plus(node), list.right())
                          : list.withSiblings(list.left(), list.right().plus(node));
            return Optional.of(move(focus, path.minus(0).plus(updated), cursorOffset));
        }
        if (crumb instanceof Crumb.RowsCrumb rows && node instanceof Node.MatrixRow row) {
            var updated = before
                          ? rows.withSiblings(rows.left().plus(row), rows.right())
                          : rows.withSiblings(rows.left(), rows.right().plus(row));
            return Optional.of(move(focus, path.minus(0).plus(updated), cursorOffset));
        }
        return Optional.empty();
    }

    /**
     * Remove the focus.
     * <ul>
     *   <li>in a list parent the focus moves to the right sibling, else the left one, else the emptied parent</li>
     *   <li>a required slot (fraction part, radicand, base) is refilled with an empty group and an
     *       optional one (root index, scripts) is dropped; the focus moves to the parent</li>
     *   <li>at the root the result is an empty sequence</li>
     * </ul>
     */
    public Zipper deleteNode() {
        if (path.isEmpty()) {
            var empty = new Node.Sequence(ids.next(), SourceSpan.at(focus.span().start()), List.of());
            return move(empty, path, NO_CURSOR);
        }
        var crumb = path.get(0);
        var rest = path.minus(0);
        if (crumb instanceof Crumb.ListCrumb list) {
            if (!list.right().isEmpty()) {
                var next = list.right().get(0);
                return move(next, rest.plus(list.withSiblings(list.left(), list.right().minus(0))), startCursor(next));
            }
            if (!list.left().isEmpty()) {
                var previous = list.left().get(0);
                return move(previous, rest.plus(list.withSiblings(list.left().minus(0), list.right())), endCursor(previous));
            }
            return move(listNode(list.shape(), parentIdentity(list), list.parentSpan(), List.of()), rest, NO_CURSOR);
        }
        if (crumb instanceof Crumb.RowsCrumb rows) {
            if (!rows.right().isEmpty()) {
                return move(rows.right().get(0), rest.plus(rows.withSiblings(rows.left(), rows.right().minus(0))), NO_CURSOR);
            }
            if (!rows.left().isEmpty()) {
                return move(rows.left().get(0), rest.plus(rows.withSiblings(rows.left().minus(0), rows.right())), NO_CURSOR);
            }
            var emptied = new Node.MatrixEnv(parentIdentity(rows), rows.parentSpan(), rows.environment(), List.of());
            return move(emptied, rest, NO_CURSOR);
        }
        var slot = slotOf(crumb);
        var parent = slot.required()
                     ? rebuild(crumb, NodeFactory.using(ids).placeholder(focus.span().start()))
                     : rebuildWithout(crumb);
        return move(parent, rest, NO_CURSOR);
    }

    /**
     * Change the text of a focused symbol, keeping its identity. The span is resized to the new text.
     * The cursor goes to the end of the text unless the zipper already had one, which is clamped.
     */
    public Optional<Zipper> modifySymbolText(String text) {
        return modifySymbol(text, OptionalInt.empty());
    }

    public Optional<Zipper> modifySymbolText(String text, int offset) {
        return modifySymbol(text, OptionalInt.of(offset));
    }

    private Optional<Zipper> modifySymbol(String text, OptionalInt offset) {
        if (!(focus instanceof Node.Symbol symbol)) {
            return Optional.empty();
        }
        int start = symbol.span().start();
        var updated = new Node.Symbol(symbol.id(), SourceSpan.of(start, start + text.length()), text);
        int cursor;
        if (offset.isPresent()) {
            cursor = clamp(offset.getAsInt(), text.length());
        } else if (cursorOffset == NO_CURSOR) {
            cursor = text.length();
        } else {
            cursor = Math.min(cursorOffset, text.length());
        }
        return Optional.of(move(updated, path, cursor));
    }

    /**
     * Place the cursor inside the focused symbol. Empty when the focus is not a symbol.
     */
    public Optional<Zipper> withCursorOffset(int offset) {
        if (!(focus instanceof Node.Symbol symbol)) {
            return Optional.empty();
        }
        return Optional.of(move(focus, path, clamp(offset, symbol.text().length())));
    }

    // === Reconstruction ===

    private Crumb crumbFor(int index, List<Node> children) {
        if (focus.kind().isListShaped()) {
            return new Crumb.ListCrumb(focus.kind(),
                                       focus.id(),
                                       focus.span(),
                                       ConsPStack.<Node>empty().plusAll(children.subList(0, index)),
                                       ConsPStack.from(children.subList(index + 1, children.size())));
        }
        if (focus instanceof Node.MatrixEnv env) {
            var rows = env.rows();
            return new Crumb.RowsCrumb(env.id(),
                                       env.span(),
                                       env.environment(),
                                       ConsPStack.<Node.MatrixRow>empty().plusAll(rows.subList(0, index)),
                                       ConsPStack.from(rows.subList(index + 1, rows.size())));
        }
        var slot = slotsOf(focus).get(index);
        if (focus instanceof Node.Fraction fraction) {
            return new Crumb.FractionCrumb(fraction, slot);
        }
        if (focus instanceof Node.Root root) {
            return new Crumb.RootCrumb(root, slot);
        }
        if (focus instanceof Node.SupSub supSub) {
            return new Crumb.SupSubCrumb(supSub, slot);
        }
        throw invariant("A " + focus.kind().display() + " has no children");
    }

    private Node rebuild(Crumb crumb, Node child) {
        var id = parentIdentity(crumb);
        if (crumb instanceof Crumb.ListCrumb list) {
            var children = reversed(list.left());
            children.add(child);
            children.addAll(list.right());
            return listNode(list.shape(), id, Nodes.spanOf(children, list.parentSpan()), children);
        }
        if (crumb instanceof Crumb.RowsCrumb rows) {
            var rowList = reversed(rows.left());
            rowList.add(asRow(child));
            rowList.addAll(rows.right());
            return new Node.MatrixEnv(id, Nodes.spanOf(rowList, rows.parentSpan()), rows.environment(), rowList);
        }
        if (crumb instanceof Crumb.FractionCrumb fraction) {
            var parent = fraction.parent();
            return fraction.slot() == Crumb.Slot.NUMERATOR
                   ? new Node.Fraction(id, parent.span(), child, parent.denominator())
                   : new Node.Fraction(id, parent.span(), parent.numerator(), child);
        }
        if (crumb instanceof Crumb.RootCrumb root) {
            var parent = root.parent();
            return root.slot() == Crumb.Slot.INDEX
                   ? new Node.Root(id, parent.span(), parent.radicand(), Optional.of(child))
                   : new Node.Root(id, parent.span(), child, parent.index());
        }
        if (crumb instanceof Crumb.SupSubCrumb supSub) {
            var parent = supSub.parent();
            return switch (supSub.slot()) {
                case BASE -> new Node.SupSub(id, parent.span(), child, parent.superscript(), parent.subscript());
                case SUPERSCRIPT -> new Node.SupSub(id, parent.span(), parent.base(), Optional.of(child), parent.subscript());
                case SUBSCRIPT -> new Node.SupSub(id, parent.span(), parent.base(), parent.superscript(), Optional.of(child));
                default -> throw invariant("Sup/sub has no " + supSub.slot() + " slot");
            };
        }
        throw invariant("Unknown crumb " + crumb);
    }

    // parent with an optional slot left empty
    private Node rebuildWithout(Crumb crumb) {
        var id = parentIdentity(crumb);
        if (crumb instanceof Crumb.RootCrumb root && root.slot() == Crumb.Slot.INDEX) {
            var parent = root.parent();
            return new Node.Root(id, parent.span(), parent.radicand(), Optional.empty());
        }
        if (crumb instanceof Crumb.SupSubCrumb supSub && supSub.slot() == Crumb.Slot.SUPERSCRIPT) {
            var parent = supSub.parent();
            return new Node.SupSub(id, parent.span(), parent.base(), Optional.empty(), parent.subscript());
        }
        if (crumb instanceof Crumb.SupSubCrumb supSub && supSub.slot() == Crumb.Slot.SUBSCRIPT) {
            var parent = supSub.parent();
            return new Node.SupSub(id, parent.span(), parent.base(), parent.superscript(), Optional.empty());
        }
        throw invariant("Slot cannot be left empty: " + crumb);
    }

    private String parentIdentity(Crumb crumb) {
        return policy == IdentityPolicy.PRESERVE ? crumb.parentId() : ids.next();
    }

    private Node listNode(NodeKind shape, String id, SourceSpan span, List<Node> children) {
        return switch (shape) {
            case SEQUENCE -> new Node.Sequence(id, span, children);
            case GROUP -> new Node.Group(id, span, children);
            case MATRIX_ROW -> new Node.MatrixRow(id, span, children);
            default -> throw invariant("Not a list-shaped parent: " + shape.display());
        };
    }

    private Node.MatrixRow asRow(Node node) {
        if (node instanceof Node.MatrixRow row) {
            return row;
        }
        throw invariant("Matrix environment rows must be matrix rows, got " + node.kind().display());
    }

    private Crumb.Slot slotOf(Crumb crumb) {
        if (crumb instanceof Crumb.FractionCrumb fraction) {
            return fraction.slot();
        }
        if (crumb instanceof Crumb.RootCrumb root) {
            return root.slot();
        }
        if (crumb instanceof Crumb.SupSubCrumb supSub) {
            return supSub.slot();
        }
        throw invariant("Not a fixed-slot crumb: " + crumb);
    }

    private static List<Crumb.Slot> slotsOf(Node node) {
        if (node instanceof Node.Fraction) {
            return List.of(Crumb.Slot.NUMERATOR, Crumb.Slot.DENOMINATOR);
        }
        if (node instanceof Node.Root root) {
            return root.index().isPresent()
                   ? List.of(Crumb.Slot.INDEX, Crumb.Slot.RADICAND)
                   : List.of(Crumb.Slot.RADICAND);
        }
        if (node instanceof Node.SupSub supSub) {
            var slots = new ArrayList<Crumb.Slot>(3);
            slots.add(Crumb.Slot.BASE);
            supSub.superscript().ifPresent(script -> slots.add(Crumb.Slot.SUPERSCRIPT));
            supSub.subscript().ifPresent(script -> slots.add(Crumb.Slot.SUBSCRIPT));
            return slots;
        }
        return List.of();
    }

    private ZipperInvariantException invariant(String message) {
        log.debug("Zipper invariant violated: {}", message);
        return new ZipperInvariantException(message);
    }

    private Zipper move(Node newFocus, PStack<Crumb> newPath, int newCursor) {
        return new Zipper(newFocus, newPath, newCursor, ids, policy);
    }

    private static <T> Optional<T> peek(PStack<T> stack) {
        return stack.isEmpty() ? Optional.empty() : Optional.of(stack.get(0));
    }

    // stored nearest first
    private static <T> List<T> reversed(PStack<T> stack) {
        var list = new ArrayList<T>(stack);
        Collections.reverse(list);
        return list;
    }

    private static int startCursor(Node node) {
        return node instanceof Node.Symbol ? 0 : NO_CURSOR;
    }

    private static int endCursor(Node node) {
        return node instanceof Node.Symbol symbol ? symbol.text().length() : NO_CURSOR;
    }

    private static int clamp(int offset, int length) {
        return Math.max(0, Math.min(offset, length));
    }

    @Override
    public String toString() {
        return "Zipper[" + focus.kind().display() + " " + focus.id() + ", depth " + depth() + "]";
    }
}
