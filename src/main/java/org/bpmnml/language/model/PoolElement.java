package org.bpmnml.language.model;

/**
 * Element allowed inside a Pool or a Lane: Node, Connection or Lane.
 */
public interface PoolElement extends ModelElement {
}
