package org.bpmnml.language.model;

/**
 * A flow node: event, task or gateway.
 */
public abstract class Node extends AbstractElement implements RootElement, PoolElement {
    private final String name;

    protected Node(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return kind().name().charAt(0) + kind().name().substring(1).toLowerCase() + " '" + name + "'";
    }
}
