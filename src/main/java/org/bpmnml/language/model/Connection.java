package org.bpmnml.language.model;

/**
 * A connection between two nodes. It does not own its endpoints.
 */
public final class Connection extends AbstractElement implements RootElement, PoolElement {
    private final NodeReference source;
    private final Connector connector;
    private final NodeReference target;
    private final String label;

    public Connection(NodeReference source, Connector connector, NodeReference target, String label) {
        this.source = source;
        this.connector = connector;
        this.target = target;
        this.label = label;
    }

    /**
     * Unresolved connection between the named nodes, as produced by the parser.
     */
    public static Connection between(String source, Connector connector, String target) {
        return new Connection(new NodeReference(source), connector, new NodeReference(target), null);
    }

    /**
     * Connection already bound to both endpoints.
     */
    public static Connection linking(Node source, Connector connector, Node target) {
        return new Connection(NodeReference.to(source), connector, NodeReference.to(target), null);
    }

    public NodeReference getSource() {
        return source;
    }

    public Connector getConnector() {
        return connector;
    }

    public NodeReference getTarget() {
        return target;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    @Override
    public ElementKind kind() {
        return ElementKind.CONNECTION;
    }

    @Override
    public String toString() {
        return "Connection '" + source + " " + connector.getToken() + " " + target + "'";
    }
}
