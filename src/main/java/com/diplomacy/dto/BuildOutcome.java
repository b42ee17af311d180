package com.diplomacy.dto;

import com.diplomacy.model.GameState;
import com.diplomacy.model.Order;
import com.diplomacy.model.Part;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a build phase.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildOutcome {

    private GameState nextState;

    @Builder.Default
    private List<Order.Build> built = new ArrayList<>();

    /** Units removed, ordered or chosen by civil-disorder priority. */
    @Builder.Default
    private List<Part> disbanded = new ArrayList<>();

    /** Orders dropped because they exceeded the player's adjustment. */
    @Builder.Default
    private List<RejectedOrder> truncated = new ArrayList<>();
}
