package org.bpmnml.generator;

import org.bpmnml.language.model.Connector;

/**
 * BPMN flow element a connection compiles to.
 */
public enum FlowKind {
    SEQUENCE_FLOW("sequenceFlow", "Flow"),
    ASSOCIATION("association", "Association"),
    MESSAGE_FLOW("messageFlow", "MessageFlow");

    private final String elementName;
    private final String idBase;

    FlowKind(String elementName, String idBase) {
        this.elementName = elementName;
        this.idBase = idBase;
    }

    public String getElementName() {
        return elementName;
    }

    public String getIdBase() {
        return idBase;
    }

    public static FlowKind of(Connector connector) {
        return switch (connector) {
            case SEQUENCE -> SEQUENCE_FLOW;
            case DIRECTED_ASSOCIATION, UNDIRECTED_ASSOCIATION -> ASSOCIATION;
            case MESSAGE -> MESSAGE_FLOW;
        };
    }
}
