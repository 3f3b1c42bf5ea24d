package org.bpmnml.language.model;

/**
 * A by-name reference from a connection endpoint to a node.
 * The reference starts unresolved and is bound once by the linker.
 */
public final class NodeReference {
    private final String text;
    private Node ref;

    public NodeReference(String text) {
        this.text = text;
    }

    /**
     * Creates a reference that is already bound to the given node.
     */
    public static NodeReference to(Node node) {
        NodeReference reference = new NodeReference(node.getName());
        reference.ref = node;
        return reference;
    }

    public String getText() {
        return text;
    }

    public Node getRef() {
        return ref;
    }

    public boolean isResolved() {
        return ref != null;
    }

    public void resolve(Node node) {
        if (ref != null && ref != node) {
            throw new IllegalStateException("Reference '" + text + "' is already bound to " + ref);
        }
        this.ref = node;
    }

    @Override
    public String toString() {
        return text;
    }
}
