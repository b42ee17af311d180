package com.diplomacy.service;

import com.diplomacy.dto.RetreatOutcome;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.MapGraph;
import com.diplomacy.model.Order;
import com.diplomacy.model.Part;
import com.diplomacy.model.Territory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves retreat phases: dislodged units either retreat to a free neighbor or are disbanded.
 */
@Service
@Slf4j
public class RetreatResolver {

    /**
     * Parts a dislodged unit may retreat to: neighbors of its part whose territory is
     * empty after the move phase and not forbidden.
     */
    public List<Part> retreatOptions(GameState state, Dislodgement dislodgement) {
        MapGraph map = state.getMap();
        List<Part> options = new ArrayList<>();
        for (Part neighbor : map.neighbors(dislodgement.part())) {
            Territory territory = map.territoryOf(neighbor);
            if (!dislodgement.forbids(territory) && !state.isOccupied(territory)) {
                options.add(neighbor);
            }
        }
        return options;
    }

    public Optional<Dislodgement> findDislodgement(GameState state, Part part) {
        return state.getDislodged().stream().filter(d -> d.part().equals(part)).findFirst();
    }

    /**
     * Apply validated retreat and disband orders. Units retreating into the same
     * territory are all disbanded; units without a valid retreat are disbanded.
     */
    public RetreatOutcome resolve(GameState state, List<Order> orders) {
        Map<Part, Order.Retreat> retreats = new HashMap<>();
        for (Order order : orders) {
            if (order instanceof Order.Retreat retreat) {
                retreats.put(retreat.part(), retreat);
            } else if (!(order instanceof Order.Disband)) {
                throw new IllegalStateException("Not a retreat-phase order: " + order.toNotation());
            }
        }

        Map<Integer, Integer> arrivals = new HashMap<>();
        for (Dislodgement dislodgement : state.getDislodged()) {
            Order.Retreat retreat = retreats.get(dislodgement.part());
            if (retreat != null && retreatOptions(state, dislodgement).contains(retreat.destination())) {
                arrivals.merge(retreat.destination().territoryIndex(), 1, Integer::sum);
            }
        }

        GameState.Editor editor = state.edit();
        List<Order.Retreat> retreated = new ArrayList<>();
        List<Dislodgement> disbanded = new ArrayList<>();
        for (Dislodgement dislodgement : state.getDislodged()) {
            Order.Retreat retreat = retreats.get(dislodgement.part());
            if (retreat == null || !retreatOptions(state, dislodgement).contains(retreat.destination())) {
                disbanded.add(dislodgement);
                continue;
            }
            if (arrivals.get(retreat.destination().territoryIndex()) > 1) {
                log.debug("Retreat {} bounced, unit disbanded", retreat.toNotation());
                disbanded.add(dislodgement);
                continue;
            }
            editor.placeUnit(retreat.destination(), dislodgement.player());
            retreated.add(retreat);
        }
        editor.dislodged(List.of());

        log.info("Resolved {}: {} retreated, {} disbanded", state.getPhaseLabel(), retreated.size(), disbanded.size());
        return RetreatOutcome.builder()
                .nextState(editor.build())
                .retreated(retreated)
                .disbanded(disbanded)
                .build();
    }
}
