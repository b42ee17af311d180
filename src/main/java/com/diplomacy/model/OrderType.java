package com.diplomacy.model;

/**
 * Tag of every {@link Order} variant.
 */
public enum OrderType {
    HOLD(PhaseKind.MOVE),
    MOVE(PhaseKind.MOVE),
    SUPPORT_HOLD(PhaseKind.MOVE),
    SUPPORT_MOVE(PhaseKind.MOVE),
    CONVOY(PhaseKind.MOVE),
    RETREAT(PhaseKind.RETREAT),
    BUILD(PhaseKind.BUILD),
    DISBAND(PhaseKind.BUILD);

    private final PhaseKind phase;

    OrderType(PhaseKind phase) {
        this.phase = phase;
    }

    /**
     * Phase this order kind may be submitted in. Disband is also accepted in retreat phases.
     */
    public boolean allowedIn(PhaseKind kind) {
        return phase == kind || (this == DISBAND && kind == PhaseKind.RETREAT);
    }
}
