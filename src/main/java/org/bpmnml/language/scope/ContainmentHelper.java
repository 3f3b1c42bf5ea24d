package org.bpmnml.language.scope;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Container;
import org.bpmnml.language.model.ElementKind;
import org.bpmnml.language.model.ModelElement;
import org.bpmnml.language.model.Pool;

/**
 * Lookups over the container back-pointers of a model tree.
 * Every lookup starts at the element's container, never at the element itself.
 */
public final class ContainmentHelper {

    private ContainmentHelper() {
    }

    /**
     * Finds the nearest Pool or Lane around an element.
     *
     * @param element the element to start from
     * @return the nearest container, or null when the element sits in the global scope
     */
    public static Container findContainer(ModelElement element) {
        ModelElement current = element.getContainer();
        while (current != null) {
            if (current instanceof Container container) {
                return container;
            }
            current = current.getContainer();
        }
        return null;
    }

    /**
     * Finds the pool an element belongs to, looking through any lanes in between.
     *
     * @param element the element to start from
     * @return the enclosing pool, or null for global elements
     */
    public static Pool findPool(ModelElement element) {
        ModelElement current = element.getContainer();
        while (current != null) {
            if (current.kind() == ElementKind.POOL) {
                return (Pool) current;
            }
            current = current.getContainer();
        }
        return null;
    }

    public static BpmnModel findModel(ModelElement element) {
        ModelElement current = element.getContainer();
        while (current != null) {
            if (current instanceof BpmnModel model) {
                return model;
            }
            current = current.getContainer();
        }
        return null;
    }
}
