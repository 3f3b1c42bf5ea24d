package org.bpmnml;

import org.bpmnml.language.validation.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * @param diagnostics every validation finding, in tree order
 * @param xml         the generated document, absent when a blocking diagnostic stopped compilation
 */
public record CompilationResult(
        List<Diagnostic> diagnostics,
        Optional<String> xml
) {

    public boolean isSuccess() {
        return xml.isPresent();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }
}
