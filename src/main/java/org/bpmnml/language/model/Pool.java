package org.bpmnml.language.model;

import java.util.List;

/**
 * Top-level named container; each pool becomes a participant with its own process.
 */
public final class Pool extends AbstractElement implements RootElement, Container {
    private final String name;
    private final List<PoolElement> elements;

    public Pool(String name, List<? extends PoolElement> elements) {
        this.name = name;
        this.elements = adopt(this, elements);
    }

    public static Pool of(String name, PoolElement... elements) {
        return new Pool(name, List.of(elements));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<PoolElement> getElements() {
        return elements;
    }

    @Override
    public ElementKind kind() {
        return ElementKind.POOL;
    }

    @Override
    public String toString() {
        return "Pool '" + name + "'";
    }
}
