package com.diplomacy.model;

import java.util.Arrays;

/**
 * Which players must vote for a draw to be declared.
 */
public enum DrawEligibility {
    ACTIVE("active"),   // Eliminated players are skipped
    ALL("all");         // Every registered player must agree

    private final String key;

    DrawEligibility(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static DrawEligibility fromKey(String key) {
        return Arrays.stream(values())
                .filter(eligibility -> eligibility.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown draw eligibility: " + key));
    }
}
