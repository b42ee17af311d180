package com.diplomacy.dto;

import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.PhaseKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything announced at the end of a phase.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhaseReport {

    /** Label of the resolved phase, e.g. "Phase 2 move". */
    private String phaseLabel;
    private PhaseKind kind;

    /** Snapshot after resolution, already advanced to the next phase. */
    private GameState state;

    @Builder.Default
    private List<RejectedOrder> rejected = new ArrayList<>();

    @Builder.Default
    private List<OrderResult> results = new ArrayList<>();

    @Builder.Default
    private List<Dislodgement> dislodged = new ArrayList<>();

    @Builder.Default
    private Set<String> standoffs = new LinkedHashSet<>();

    /** Part ids of units removed this phase. */
    @Builder.Default
    private List<String> disbanded = new ArrayList<>();

    /** Draw shares by player once a draw is declared, otherwise empty. */
    @Builder.Default
    private Map<String, Double> drawShares = new LinkedHashMap<>();
}
