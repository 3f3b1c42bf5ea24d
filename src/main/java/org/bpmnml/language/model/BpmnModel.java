package org.bpmnml.language.model;

import java.util.List;

/**
 * Root of a parsed BPMNml document. Elements declared here form the global scope.
 */
public final class BpmnModel extends AbstractElement {
    private final List<RootElement> elements;

    public BpmnModel(List<? extends RootElement> elements) {
        this.elements = adopt(this, elements);
    }

    public static BpmnModel of(RootElement... elements) {
        return new BpmnModel(List.of(elements));
    }

    public List<RootElement> getElements() {
        return elements;
    }

    @Override
    public ElementKind kind() {
        return ElementKind.MODEL;
    }

    @Override
    public String toString() {
        return "BpmnModel";
    }
}
