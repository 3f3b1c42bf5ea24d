package org.bpmnml.language.model;

/**
 * Connector token of a connection; it decides the kind of flow the connection compiles to.
 */
public enum Connector {
    SEQUENCE("-->"),
    DIRECTED_ASSOCIATION("..>"),
    UNDIRECTED_ASSOCIATION("..."),
    MESSAGE("~~>");

    private final String token;

    Connector(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public boolean isMessageFlow() {
        return this == MESSAGE;
    }

    public boolean isAssociation() {
        return this == DIRECTED_ASSOCIATION || this == UNDIRECTED_ASSOCIATION;
    }

    public static Connector fromToken(String token) {
        for (Connector connector : values()) {
            if (connector.token.equals(token)) {
                return connector;
            }
        }
        throw new IllegalArgumentException("Unknown connector token: " + token);
    }
}
