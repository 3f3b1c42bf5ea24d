package org.bpmnml.language.validation;

public enum DiagnosticSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String label;

    DiagnosticSeverity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
