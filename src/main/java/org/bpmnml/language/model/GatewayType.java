package org.bpmnml.language.model;

public enum GatewayType {
    EXCLUSIVE("exclusive"),
    PARALLEL("parallel"),
    INCLUSIVE("inclusive"),
    EVENT_BASED("event-based"),
    COMPLEX("complex");

    private final String keyword;

    GatewayType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static GatewayType fromKeyword(String keyword) {
        for (GatewayType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown gateway type: " + keyword);
    }
}
