package com.example.syncroom.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN("admin"),
    MODERATOR("moderator"),
    USER("user");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() { return wireName; }

    /** @return the matching role, or null for an unknown name */
    public static Role fromWire(String name) {
        if (name == null) return null;
        for (Role r : values()) {
            if (r.wireName.equalsIgnoreCase(name.trim())) return r;
        }
        return null;
    }
}
