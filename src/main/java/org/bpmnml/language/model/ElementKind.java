package org.bpmnml.language.model;

/**
 * Discriminator for the element variants of a BPMNml tree.
 * Consumers switch over it instead of using instanceof chains.
 */
public enum ElementKind {
    MODEL,
    EVENT,
    TASK,
    GATEWAY,
    CONNECTION,
    POOL,
    LANE;

    public boolean isNode() {
        return this == EVENT || this == TASK || this == GATEWAY;
    }
}
