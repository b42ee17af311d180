package com.diplomacy.dto;

import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a retreat phase.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetreatOutcome {

    private GameState nextState;

    @Builder.Default
    private List<Order.Retreat> retreated = new ArrayList<>();

    /** Dislodged units removed from the game: ordered, bounced or defaulted disbands. */
    @Builder.Default
    private List<Dislodgement> disbanded = new ArrayList<>();
}
