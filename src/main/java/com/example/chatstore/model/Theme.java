package com.example.chatstore.model;

public enum Theme {
    LIGHT("light"),
    DARK("dark"),
    SYSTEM("system");

    private final String value;

    Theme(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Theme fromValue(String value) {
        for (Theme theme : values()) {
            if (theme.value.equalsIgnoreCase(value)) {
                return theme;
            }
        }
        throw new IllegalArgumentException("Unknown theme: " + value);
    }
}
