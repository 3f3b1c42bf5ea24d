package org.bpmnml.language.validation;

import org.bpmnml.language.model.ModelElement;

/**
 * Sink for validation findings. Checks report through it and keep going.
 */
@FunctionalInterface
public interface ValidationAcceptor {

    void accept(DiagnosticSeverity severity, String message, ModelElement element, String property);

    default void accept(DiagnosticSeverity severity, String message, ModelElement element) {
        accept(severity, message, element, null);
    }
}
