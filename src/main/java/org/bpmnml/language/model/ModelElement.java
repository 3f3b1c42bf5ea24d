package org.bpmnml.language.model;

/**
 * Any element of a parsed BPMNml tree.
 */
public interface ModelElement {

    ElementKind kind();

    /**
     * The element this one is declared in, or null for the model root.
     * This is a back-pointer; the container owns the child, never the reverse.
     */
    ModelElement getContainer();
}
