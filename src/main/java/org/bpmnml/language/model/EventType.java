package org.bpmnml.language.model;

public enum EventType {
    START("start"),
    END("end"),
    INTERMEDIATE("intermediate"),
    CATCH("catch"),
    THROW("throw");

    private final String keyword;

    EventType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static EventType fromKeyword(String keyword) {
        for (EventType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + keyword);
    }
}
