package com.diplomacy.model;

import java.util.Arrays;

/**
 * Which controlled supply centers a player may build on.
 */
public enum BuildRule {
    INIT_CENTERS("initCenters"),    // Only the player's original home centers
    ALL_CENTERS("allCenters");      // Any controlled center

    private final String key;

    BuildRule(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static BuildRule fromKey(String key) {
        return Arrays.stream(values())
                .filter(rule -> rule.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown build rule: " + key));
    }
}
