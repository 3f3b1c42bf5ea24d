package org.bpmnml.generator;

/**
 * Namespaces and fixed values of generated BPMN 2.0 documents.
 */
public final class BpmnNamespaces {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

    public static final String TARGET_NAMESPACE = "http://bpmn.io/schema/bpmn";

    private BpmnNamespaces() {
    }
}
