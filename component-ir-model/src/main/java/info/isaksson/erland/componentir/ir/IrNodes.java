package info.isaksson.erland.componentir.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Subtree queries over the IR.
 *
 * <p>All traversals are pre-order and follow child order, so results are deterministic.</p>
 */
public final class IrNodes {

    private IrNodes() {}

    /**
     * All descendants of {@code root} that are instances of {@code type}, in document order.
     * The root itself is never part of the result.
     */
    public static <T extends IrNode> List<T> findDescendantNodes(IrNode root, Class<T> type) {
        if (root == null) return List.of();
        if (type == null) throw new IllegalArgumentException("type is null");
        List<T> out = new ArrayList<>();
        for (IrNode child : root.children) {
            collect(child, type, out);
        }
        return out;
    }

    private static <T extends IrNode> void collect(IrNode node, Class<T> type, List<T> out) {
        if (node == null) return;
        if (type.isInstance(node)) out.add(type.cast(node));
        for (IrNode child : node.children) {
            collect(child, type, out);
        }
    }

    /** Every diagnostic in the tree, root first, then in document order. */
    public static List<IrDiagnostic> collectDiagnostics(IrNode root) {
        if (root == null) return List.of();
        List<IrDiagnostic> out = new ArrayList<>(root.diagnostics);
        for (IrNode n : findDescendantNodes(root, IrNode.class)) {
            out.addAll(n.diagnostics);
        }
        return out;
    }

    /** Concatenated content of every token below {@code node} (or the node itself if it is a token). */
    public static String tokenText(IrNode node) {
        if (node == null) return "";
        if (node instanceof IrToken t) return t.content;
        StringBuilder sb = new StringBuilder();
        for (IrToken t : findDescendantNodes(node, IrToken.class)) {
            sb.append(t.content);
        }
        return sb.toString();
    }
}
