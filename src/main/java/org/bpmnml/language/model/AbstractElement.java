package org.bpmnml.language.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

abstract class AbstractElement implements ModelElement {
    private ModelElement container;

    @Override
    public ModelElement getContainer() {
        return container;
    }

    void attachTo(ModelElement container) {
        if (this.container != null) {
            throw new IllegalStateException(
                    "Element " + this + " is already contained in " + this.container);
        }
        this.container = container;
    }

    static <T extends ModelElement> List<T> adopt(ModelElement owner, List<? extends T> children) {
        List<T> adopted = new ArrayList<>(children.size());
        for (T child : children) {
            ((AbstractElement) child).attachTo(owner);
            adopted.add(child);
        }
        return Collections.unmodifiableList(adopted);
    }
}
