package com.diplomacy.model;

/**
 * Validated game rules.
 *
 * @param winCondition     number of centers a player needs to win
 * @param buildRule        which centers are eligible for builds
 * @param buildTime        every how many phases a build phase happens
 * @param voteShown        whether individual draw votes are visible
 * @param drawType         how centers are split on a draw
 * @param convoyParadox    policy for paradoxical convoy cycles
 * @param drawEligibility  which players must vote for a draw
 */
public record Rules(
        int winCondition,
        BuildRule buildRule,
        int buildTime,
        boolean voteShown,
        DrawType drawType,
        ConvoyParadoxRule convoyParadox,
        DrawEligibility drawEligibility
) {

    /**
     * Kind of the phase with the given (non-retreat) phase number.
     */
    public PhaseKind kindOfPhase(int phaseCount) {
        return buildTime > 0 && phaseCount % buildTime == 0 ? PhaseKind.BUILD : PhaseKind.MOVE;
    }
}
