package org.bpmnml.language.model;

import java.util.List;

/**
 * Named sub-container of a pool. Lanes may nest; they never appear at the top level.
 */
public final class Lane extends AbstractElement implements PoolElement, Container {
    private final String name;
    private final List<PoolElement> elements;

    public Lane(String name, List<? extends PoolElement> elements) {
        this.name = name;
        this.elements = adopt(this, elements);
    }

    public static Lane of(String name, PoolElement... elements) {
        return new Lane(name, List.of(elements));
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
        return ElementKind.LANE;
    }

    @Override
    public String toString() {
        return "Lane '" + name + "'";
    }
}
