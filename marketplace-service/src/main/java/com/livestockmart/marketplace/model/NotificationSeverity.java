package com.livestockmart.marketplace.model;

/**
 * Severity tag of an inbox notification, with the color the client renders it in.
 */
public enum NotificationSeverity {
    INFO("blue"),
    SUCCESS("green"),
    WARNING("amber"),
    DANGER("red");

    private final String color;

    NotificationSeverity(String color) {
        this.color = color;
    }

    public String getColor() {
        return color;
    }
}
