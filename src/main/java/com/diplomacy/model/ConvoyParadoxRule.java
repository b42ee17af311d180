package com.diplomacy.model;

import java.util.Arrays;

/**
 * Policy applied when a dependency cycle involving convoys has no single consistent outcome.
 */
public enum ConvoyParadoxRule {
    SZYKMAN("szykman"),     // Convoyed moves in the cycle fail and have no effect
    ALL_HOLD("allHold");    // Every move in the cycle fails

    private final String key;

    ConvoyParadoxRule(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ConvoyParadoxRule fromKey(String key) {
        return Arrays.stream(values())
                .filter(rule -> rule.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown convoy paradox rule: " + key));
    }
}
