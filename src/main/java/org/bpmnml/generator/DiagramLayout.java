package org.bpmnml.generator;

import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.NodeReference;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-per-process placement of nodes.
 * <p>
 * Each process group gets one row; its nodes are placed left to right in tree order.
 * Pools get a participant box around their nodes. The placement is fixed, it does
 * not try to avoid crossing edges.
 */
public class DiagramLayout {
    public static final int START_X = 100;
    public static final int NODE_SPACING_X = 180;
    public static final int START_Y = 80;
    public static final int ROW_SPACING_Y = 220;
    public static final int POOL_PADDING = 40;

    private final Map<Node, Bounds> nodeBounds = new IdentityHashMap<>();

    /**
     * Places the nodes of a group on the row of the given index.
     *
     * @return the participant box for the group, or null for the global group or a pool without nodes
     */
    public Bounds layoutGroup(ProcessGroup group, int groupIndex) {
        int y = START_Y + groupIndex * ROW_SPACING_Y;
        List<Node> nodes = group.nodes();
        Bounds union = null;

        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            Bounds bounds = footprint(node, START_X + i * NODE_SPACING_X, y);
            nodeBounds.put(node, bounds);
            union = union == null ? bounds : union.union(bounds);
        }

        if (group.isGlobal() || union == null) {
            return null;
        }
        return union.expand(POOL_PADDING);
    }

    public Bounds boundsOf(Node node) {
        return nodeBounds.get(node);
    }

    /**
     * @return the center of the referenced node, or the origin when the reference is
     * unresolved or the node was never laid out
     */
    public Waypoint anchorOf(NodeReference reference) {
        if (reference == null || !reference.isResolved()) {
            return Waypoint.ORIGIN;
        }
        Bounds bounds = nodeBounds.get(reference.getRef());
        return bounds != null ? bounds.center() : Waypoint.ORIGIN;
    }

    static Bounds footprint(Node node, int x, int y) {
        return switch (node.kind()) {
            case EVENT -> new Bounds(x, y, 36, 36);
            case GATEWAY -> new Bounds(x, y, 50, 50);
            default -> new Bounds(x, y, 100, 80);
        };
    }
}
