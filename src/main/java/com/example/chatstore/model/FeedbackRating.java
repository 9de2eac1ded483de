package com.example.chatstore.model;

public enum FeedbackRating {
    UP("up"),
    DOWN("down");

    private final String value;

    FeedbackRating(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FeedbackRating fromValue(String value) {
        for (FeedbackRating rating : values()) {
            if (rating.value.equalsIgnoreCase(value)) {
                return rating;
            }
        }
        throw new IllegalArgumentException("Unknown feedback rating: " + value);
    }
}
