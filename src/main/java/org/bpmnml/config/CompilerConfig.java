package org.bpmnml.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.bpmnml.generator.GeneratorOptions;
import org.bpmnml.language.scope.ScopeMode;

/**
 * Compiler settings, usually read from a JSON file.
 * <p>
 * Example:
 * {
 * "scopeMode": "pool-wide",
 * "prettify": true,
 * "indent": 2,
 * "validateOutput": false,
 * "failOnWarnings": false
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerConfig {

    /**
     * Visibility rules for connection endpoints.
     * Example: "pool-wide" (default) or the deprecated "lane-local"
     */
    public ScopeMode scopeMode = ScopeMode.POOL_WIDE;

    /**
     * Indent the generated XML, one element per line.
     */
    public boolean prettify = true;

    /**
     * Indent width used when prettifying.
     */
    public int indent = 2;

    /**
     * Re-read the generated document with the Camunda model API and validate it against the BPMN schema.
     */
    public boolean validateOutput;

    /**
     * Treat warnings like errors and stop before generation.
     */
    public boolean failOnWarnings;

    public GeneratorOptions toGeneratorOptions() {
        return new GeneratorOptions(prettify, indent);
    }
}
