package com.diplomacy.model;

/**
 * Kind of a game phase.
 */
public enum PhaseKind {
    MOVE("move"),
    RETREAT("retreat"),
    BUILD("build");

    private final String label;

    PhaseKind(String label) {
        this.label = label;
    }

    /** Lower-case label used in banners and log keys, e.g. "move". */
    public String getLabel() {
        return label;
    }
}
