package com.diplomacy.model;

import java.util.Arrays;

/**
 * How the centers are split among survivors when a draw is declared.
 */
public enum DrawType {
    DSS("DSS"),     // Equal split among surviving players
    SOS("SoS");     // Split proportional to each survivor's center count

    private final String key;

    DrawType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static DrawType fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown draw type: " + key));
    }
}
