package org.pragmatica.latex.tree;

/**
 * Mints node identities of the form {@code node-N}.
 *
 * <p>One generator per parse or edit session; identities are unique only among nodes minted by the
 * same generator. Not thread-safe.
 */
public final class NodeIds {
    public static final String PREFIX = "node-";

    private long next;

    private NodeIds(long next) {
        this.next = next;
    }

    public static NodeIds create() {
        return new NodeIds(0);
    }

    public static NodeIds startingAt(long first) {
        if (first < 0) {
            throw new IllegalArgumentException("First identity must be non-negative, got " + first);
        }
        return new NodeIds(first);
    }

    /**
     * Generator that resumes after the largest {@code node-N} identity present in the tree.
     * Identities not minted by this class are ignored.
     */
    public static NodeIds continuing(Node root) {
        long max = -1;
        for (var node : Nodes.preorder(root)) {
            max = Math.max(max, sequenceNumber(node.id()));
        }
        return new NodeIds(max + 1);
    }

    public String next() {
        return PREFIX + next++;
    }

    /**
     * The number the next identity will carry.
     */
    public long peek() {
        return next;
    }

    private static long sequenceNumber(String id) {
        if (!id.startsWith(PREFIX)) {
            return -1;
        }
        try {
            return Long.parseLong(id.substring(PREFIX.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
