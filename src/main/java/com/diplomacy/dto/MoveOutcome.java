package com.diplomacy.dto;

import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of a move phase adjudication.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveOutcome {

    /** Occupancy after the moves; dislodged units are off the board and listed in the snapshot. */
    private GameState nextState;

    @Builder.Default
    private List<Dislodgement> dislodged = new ArrayList<>();

    /** Territory ids left empty by a standoff. */
    @Builder.Default
    private Set<String> standoffs = new LinkedHashSet<>();

    @Builder.Default
    private List<OrderResult> results = new ArrayList<>();
}
