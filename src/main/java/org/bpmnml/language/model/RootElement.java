package org.bpmnml.language.model;

/**
 * Element allowed at the top level of a model: Node, Connection or Pool.
 */
public interface RootElement extends ModelElement {
}
