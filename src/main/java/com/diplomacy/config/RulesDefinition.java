package com.diplomacy.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Rules description as read from the rules JSON file, before conversion to
 * {@link com.diplomacy.model.Rules}. Uses wrappers so absent fields stay null.
 *
 * @param winCondition    centers needed to win
 * @param buildRule       "initCenters" or "allCenters"
 * @param buildTime       every how many phases a build phase happens
 * @param voteShown       0 or 1
 * @param drawType        "DSS" or "SoS"
 * @param convoyParadox   optional, "szykman" (default) or "allHold"
 * @param drawEligibility optional, "active" (default) or "all"
 */
public record RulesDefinition(
        @NotNull @Positive Integer winCondition,
        @NotBlank String buildRule,
        @NotNull @Positive Integer buildTime,
        @NotNull @Min(0) @Max(1) Integer voteShown,
        @NotBlank String drawType,
        String convoyParadox,
        String drawEligibility
) {}
