package org.bpmnml;

import org.bpmnml.config.CompilerConfig;
import org.bpmnml.generator.BpmnOutputValidator;
import org.bpmnml.generator.BpmnXmlGenerator;
import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.scope.BpmnScopeProvider;
import org.bpmnml.language.scope.ModelLinker;
import org.bpmnml.language.validation.BpmnValidator;
import org.bpmnml.language.validation.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Runs a parsed model through linking, validation and generation.
 * Generation only happens when validation reports no blocking diagnostic.
 */
public class BpmnmlCompiler {
    private final CompilerConfig config;
    private final ModelLinker linker;
    private final BpmnValidator validator = new BpmnValidator();
    private final BpmnXmlGenerator generator;

    public BpmnmlCompiler() {
        this(new CompilerConfig());
    }

    public BpmnmlCompiler(CompilerConfig config) {
        this.config = config;
        this.linker = new ModelLinker(new BpmnScopeProvider(config.scopeMode));
        this.generator = new BpmnXmlGenerator(config.toGeneratorOptions());
    }

    public CompilationResult compile(BpmnModel model) {
        linker.link(model);
        List<Diagnostic> diagnostics = validator.validate(model);

        if (isBlocked(diagnostics)) {
            return new CompilationResult(diagnostics, Optional.empty());
        }

        String xml = generator.generateXml(model);
        if (config.validateOutput) {
            BpmnOutputValidator.validate(xml);
        }
        return new CompilationResult(diagnostics, Optional.of(xml));
    }

    private boolean isBlocked(List<Diagnostic> diagnostics) {
        return config.failOnWarnings ? !diagnostics.isEmpty() : BpmnValidator.hasErrors(diagnostics);
    }
}
