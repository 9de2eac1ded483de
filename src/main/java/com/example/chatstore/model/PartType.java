package com.example.chatstore.model;

public enum PartType {
    TEXT("text"),
    TOOL_CALL("tool-call"),
    TOOL_RESULT("tool-result");

    private final String value;

    PartType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PartType fromValue(String value) {
        for (PartType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message part type: " + value);
    }
}
