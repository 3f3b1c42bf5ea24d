package org.bpmnml.generator;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.bpmnml.generator.BpmnNamespaces.BPMNDI_NS;
import static org.bpmnml.generator.BpmnNamespaces.BPMN_NS;
import static org.bpmnml.generator.BpmnNamespaces.DC_NS;
import static org.bpmnml.generator.BpmnNamespaces.DI_NS;

/**
 * State of a single generator run: the document under construction, the id
 * registry and the layout. Never shared between runs.
 */
class GenerationContext {
    private final Document document;
    private final IdRegistry ids = new IdRegistry();
    private final DiagramLayout layout = new DiagramLayout();

    GenerationContext(Document document) {
        this.document = document;
    }

    Document document() {
        return document;
    }

    IdRegistry ids() {
        return ids;
    }

    DiagramLayout layout() {
        return layout;
    }

    Element bpmn(String localName) {
        return document.createElementNS(BPMN_NS, localName);
    }

    Element bpmndi(String localName) {
        return document.createElementNS(BPMNDI_NS, "bpmndi:" + localName);
    }

    Element dc(String localName) {
        return document.createElementNS(DC_NS, "dc:" + localName);
    }

    Element di(String localName) {
        return document.createElementNS(DI_NS, "di:" + localName);
    }

    Element textElement(String localName, String text) {
        Element element = bpmn(localName);
        element.setTextContent(text);
        return element;
    }
}
