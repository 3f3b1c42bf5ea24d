package org.bpmnml.language.scope;

/**
 * The endpoint of a connection that a reference belongs to.
 */
public enum ReferenceProperty {
    SOURCE("source"),
    TARGET("target");

    private final String propertyName;

    ReferenceProperty(String propertyName) {
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
