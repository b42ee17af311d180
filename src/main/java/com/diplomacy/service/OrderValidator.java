package com.diplomacy.service;

import com.diplomacy.dto.ValidationResult;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.MapGraph;
import com.diplomacy.model.Order;
import com.diplomacy.model.Part;
import com.diplomacy.model.PartKind;
import com.diplomacy.model.PhaseKind;
import com.diplomacy.model.Rules;
import com.diplomacy.model.Territory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Filters submitted orders before resolution. Every order is checked on its own; a
 * rejected order never blocks the others, its unit simply takes the phase default.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderValidator {

    private final RetreatResolver retreatResolver;
    private final BuildResolver buildResolver;

    /**
     * Validate the orders of one phase against the snapshot they were issued for.
     */
    public ValidationResult validate(GameState state, Rules rules, List<Order> orders) {
        ValidationResult result = ValidationResult.builder().build();
        Set<Part> ordered = new HashSet<>();
        List<Order.Convoy> convoys = legalConvoys(state, orders);

        for (Order order : orders) {
            String reason = check(state, rules, order, convoys);
            if (reason == null && !ordered.add(order.part())) {
                reason = "duplicate order for " + order.part().id();
            }
            if (reason == null) {
                result.accept(order);
            } else {
                log.warn("Rejected {} {}: {}", order.player(), order.toNotation(), reason);
                result.reject(order, reason);
            }
        }
        return result;
    }

    private String check(GameState state, Rules rules, Order order, List<Order.Convoy> convoys) {
        PhaseKind phase = state.getPhaseKind();
        if (!state.hasPlayer(order.player())) {
            return "unknown player";
        }
        if (!order.type().allowedIn(phase)) {
            return order.type().name().toLowerCase().replace('_', ' ') + " not allowed in a " + phase.getLabel() + " phase";
        }
        return switch (phase) {
            case MOVE -> checkMovePhase(state, order, convoys);
            case RETREAT -> checkRetreatPhase(state, order);
            case BUILD -> checkBuildPhase(state, rules, order);
        };
    }

    // ── move phase ──────────────────────────────────────────────────────

    private String checkMovePhase(GameState state, Order order, List<Order.Convoy> convoys) {
        String ownership = checkOwnUnit(state, order);
        if (ownership != null) {
            return ownership;
        }
        MapGraph map = state.getMap();
        Part part = order.part();

        if (order instanceof Order.Move move) {
            return checkMove(map, move, convoys);
        }
        if (order instanceof Order.SupportHold support) {
            Territory target = map.territoryOf(support.target());
            if (target.index() == part.territoryIndex()) {
                return "a unit cannot support itself";
            }
            if (!state.isOccupied(target)) {
                return "no unit to support in " + target.id();
            }
            if (!map.touches(part, target)) {
                return part.id() + " cannot reach " + target.id();
            }
            return null;
        }
        if (order instanceof Order.SupportMove support) {
            Territory destination = map.territoryOf(support.destination());
            Territory from = map.territoryOf(support.from());
            if (from.index() == destination.index()) {
                return "supported move goes nowhere";
            }
            if (destination.index() == part.territoryIndex() || from.index() == part.territoryIndex()) {
                return "a unit cannot support a move into or out of its own territory";
            }
            if (!state.isOccupied(from)) {
                return "no unit to support in " + from.id();
            }
            if (!map.touches(part, destination)) {
                return part.id() + " cannot reach " + destination.id();
            }
            return null;
        }
        if (order instanceof Order.Convoy convoy) {
            return convoys.contains(convoy) ? null : convoyProblem(state, convoy);
        }
        return null;
    }

    private String checkMove(MapGraph map, Order.Move move, List<Order.Convoy> convoys) {
        Part part = move.part();
        Part destination = move.destination();
        if (destination.territoryIndex() == part.territoryIndex()) {
            return "cannot move to its own territory";
        }
        if (destination.kind() != part.kind()) {
            return (part.kind() == PartKind.LAND ? "an army" : "a fleet") + " cannot move to " + destination.id();
        }
        boolean adjacent = map.isAdjacent(part, destination);
        if (adjacent && !move.viaConvoy()) {
            return null;
        }
        if (part.kind() != PartKind.LAND) {
            return part.id() + " is not adjacent to " + destination.id();
        }
        if (!convoyChainExists(map, part, destination, convoys)) {
            return "no convoy chain from " + part.id() + " to " + destination.id();
        }
        return null;
    }

    /**
     * Whether the submitted convoys form a chain of fleets from the source territory
     * to the destination territory.
     */
    private boolean convoyChainExists(MapGraph map, Part source, Part destination, List<Order.Convoy> convoys) {
        Territory from = map.territoryOf(source);
        Territory to = map.territoryOf(destination);
        List<Part> fleets = convoys.stream()
                .filter(c -> c.from().territoryIndex() == from.index()
                        && c.destination().territoryIndex() == to.index())
                .map(Order::part)
                .toList();

        Set<Part> visited = new HashSet<>();
        Deque<Part> queue = new ArrayDeque<>();
        for (Part fleet : fleets) {
            if (map.touches(fleet, from)) {
                visited.add(fleet);
                queue.add(fleet);
            }
        }
        while (!queue.isEmpty()) {
            Part fleet = queue.poll();
            if (map.touches(fleet, to)) {
                return true;
            }
            for (Part next : fleets) {
                if (!visited.contains(next) && map.isAdjacent(fleet, next)) {
                    visited.add(next);
                    queue.add(next);
                }
            }
        }
        return false;
    }

    private List<Order.Convoy> legalConvoys(GameState state, List<Order> orders) {
        if (state.getPhaseKind() != PhaseKind.MOVE) {
            return List.of();
        }
        List<Order.Convoy> convoys = new ArrayList<>();
        for (Order order : orders) {
            if (order instanceof Order.Convoy convoy && state.hasPlayer(convoy.player())
                    && checkOwnUnit(state, convoy) == null && convoyProblem(state, convoy) == null) {
                convoys.add(convoy);
            }
        }
        return convoys;
    }

    private String convoyProblem(GameState state, Order.Convoy convoy) {
        MapGraph map = state.getMap();
        Territory fleetTerritory = map.territoryOf(convoy.part());
        if (!map.isSea(fleetTerritory)) {
            return "only fleets at sea can convoy";
        }
        Territory from = map.territoryOf(convoy.from());
        Optional<Part> army = state.occupiedPart(from);
        if (army.isEmpty() || army.get().kind() != PartKind.LAND) {
            return "no army to convoy in " + from.id();
        }
        Territory to = map.territoryOf(convoy.destination());
        if (to.index() == from.index() || map.isSea(to)) {
            return "cannot convoy to " + to.id();
        }
        return null;
    }

    // ── retreat phase ───────────────────────────────────────────────────

    private String checkRetreatPhase(GameState state, Order order) {
        Optional<Dislodgement> dislodgement = retreatResolver.findDislodgement(state, order.part());
        if (dislodgement.isEmpty()) {
            return "no dislodged unit on " + order.part().id();
        }
        if (!dislodgement.get().player().equals(order.player())) {
            return "dislodged unit on " + order.part().id() + " belongs to " + dislodgement.get().player();
        }
        if (order instanceof Order.Retreat retreat
                && !retreatResolver.retreatOptions(state, dislodgement.get()).contains(retreat.destination())) {
            return "cannot retreat to " + retreat.destination().id();
        }
        return null;
    }

    // ── build phase ─────────────────────────────────────────────────────

    private String checkBuildPhase(GameState state, Rules rules, Order order) {
        int adjustment = buildResolver.adjustment(state, order.player());
        if (order instanceof Order.Build) {
            if (adjustment <= 0) {
                return "no builds available";
            }
            if (!buildResolver.eligibleBuildParts(state, rules, order.player()).contains(order.part())) {
                return order.part().id() + " is not an eligible build location";
            }
            return null;
        }
        if (adjustment >= 0) {
            return "no disbands required";
        }
        return checkOwnUnit(state, order);
    }

    /** Null when the issuing player owns the unit on the order's part. */
    private String checkOwnUnit(GameState state, Order order) {
        Optional<String> owner = state.unitOwner(order.part());
        if (owner.isEmpty()) {
            return "no unit on " + order.part().id();
        }
        if (!owner.get().equals(order.player())) {
            return "unit on " + order.part().id() + " belongs to " + owner.get();
        }
        return null;
    }
}
