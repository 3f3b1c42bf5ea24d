package org.bpmnml.language.validation;

import lombok.Builder;
import org.bpmnml.language.model.ModelElement;

/**
 * A validation finding attached to a model element.
 *
 * @param severity error or warning
 * @param message  human-readable description
 * @param element  the offending element
 * @param property the offending field of the element (e.g. "source", "name"), or null
 */
@Builder
public record Diagnostic(
        DiagnosticSeverity severity,
        String message,
        ModelElement element,
        String property
) {

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }

    @Override
    public String toString() {
        String location = element != null ? " [" + element + (property != null ? "." + property : "") + "]" : "";
        return severity.getLabel() + ": " + message + location;
    }
}
