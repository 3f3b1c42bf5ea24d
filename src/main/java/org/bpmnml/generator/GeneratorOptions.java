package org.bpmnml.generator;

/**
 * @param prettify indent the document, one element per line
 * @param indent   indent width used when prettifying
 */
public record GeneratorOptions(boolean prettify, int indent) {

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(true, 2);
    }
}
