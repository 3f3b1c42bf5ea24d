package org.bpmnml.language.model;

public enum TaskType {
    TASK("task"),
    USER("user"),
    SERVICE("service"),
    MANUAL("manual"),
    SCRIPT("script"),
    SEND("send"),
    RECEIVE("receive"),
    BUSINESS_RULE("business-rule");

    private final String keyword;

    TaskType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static TaskType fromKeyword(String keyword) {
        for (TaskType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + keyword);
    }
}
