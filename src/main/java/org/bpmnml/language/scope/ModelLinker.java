package org.bpmnml.language.scope;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Container;
import org.bpmnml.language.model.ModelElement;
import org.bpmnml.language.model.NodeReference;

import java.util.List;

/**
 * Binds the endpoint references of every connection through a {@link BpmnScopeProvider}.
 * References that cannot be bound stay unresolved and are reported by the validator.
 */
public class ModelLinker {
    private final BpmnScopeProvider scopeProvider;

    public ModelLinker(BpmnScopeProvider scopeProvider) {
        this.scopeProvider = scopeProvider;
    }

    /**
     * Links all connections of the model.
     *
     * @return the number of references that are still unresolved afterwards
     */
    public int link(BpmnModel model) {
        return linkElements(model.getElements());
    }

    private int linkElements(List<? extends ModelElement> elements) {
        int unresolved = 0;
        for (ModelElement element : elements) {
            switch (element.kind()) {
                case CONNECTION -> {
                    Connection connection = (Connection) element;
                    unresolved += linkReference(connection, connection.getSource(), ReferenceProperty.SOURCE);
                    unresolved += linkReference(connection, connection.getTarget(), ReferenceProperty.TARGET);
                }
                case POOL, LANE -> unresolved += linkElements(((Container) element).getElements());
                default -> {
                    // nodes hold no references
                }
            }
        }
        return unresolved;
    }

    private int linkReference(Connection connection, NodeReference reference, ReferenceProperty property) {
        if (reference == null) {
            return 1;
        }
        if (reference.isResolved()) {
            return 0;
        }
        scopeProvider.getScope(connection, property)
                .lookup(reference.getText())
                .ifPresent(reference::resolve);
        return reference.isResolved() ? 0 : 1;
    }
}
