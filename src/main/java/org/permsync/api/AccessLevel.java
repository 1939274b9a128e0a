package org.permsync.api;

import java.util.Locale;

public enum AccessLevel {
    NO_ACCESS(0),
    MINIMAL_ACCESS(5),
    GUEST(10),
    REPORTER(20),
    DEVELOPER(30),
    MAINTAINER(40),
    OWNER(50);

    private final int value;

    AccessLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public boolean isBelow(AccessLevel other) {
        return value < other.value;
    }

    // Levels we don't know about map to the nearest level beneath them.
    public static AccessLevel fromValue(int value) {
        AccessLevel result = NO_ACCESS;

        for (AccessLevel level : values()) {
            if (level.value <= value) {
                result = level;
            }
        }

        return result;
    }

    public static AccessLevel fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');

        if (normalized.matches("[0-9]+")) {
            return fromValue(Integer.parseInt(normalized));
        }

        try {
            return AccessLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown access level: " + name, e);
        }
    }
}
