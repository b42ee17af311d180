package com.diplomacy.service;

import com.diplomacy.dto.BuildOutcome;
import com.diplomacy.dto.RejectedOrder;
import com.diplomacy.model.BuildRule;
import com.diplomacy.model.GameState;
import com.diplomacy.model.MapGraph;
import com.diplomacy.model.Order;
import com.diplomacy.model.Part;
import com.diplomacy.model.PlayerState;
import com.diplomacy.model.Rules;
import com.diplomacy.model.Territory;
import com.diplomacy.model.UnitType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves build phases: players with more centers than units build, players with
 * fewer disband.
 */
@Service
@Slf4j
public class BuildResolver {

    /**
     * Centers minus units: positive means builds allowed, negative means disbands owed.
     */
    public int adjustment(GameState state, String player) {
        return state.centerCount(player) - state.unitCount(player);
    }

    /**
     * Adjustments of every player with something to do this build phase, in player order.
     */
    public Map<String, Integer> adjustments(GameState state) {
        Map<String, Integer> adjustments = new LinkedHashMap<>();
        for (PlayerState player : state.getPlayers()) {
            int adjustment = adjustment(state, player.name());
            if (adjustment != 0) {
                adjustments.put(player.name(), adjustment);
            }
        }
        return adjustments;
    }

    /**
     * Parts a player may build on: every part of an unoccupied center the player controls,
     * restricted to home centers under {@link BuildRule#INIT_CENTERS}.
     */
    public List<Part> eligibleBuildParts(GameState state, Rules rules, String player) {
        PlayerState playerState = state.findPlayer(player)
                .orElseThrow(() -> new IllegalArgumentException("Unknown player: " + player));
        List<Part> parts = new ArrayList<>();
        for (Territory center : state.centers(player)) {
            if (rules.buildRule() == BuildRule.INIT_CENTERS && !playerState.isHomeCenter(center)) {
                continue;
            }
            if (state.isOccupied(center)) {
                continue;
            }
            parts.addAll(state.getMap().partsOf(center));
        }
        return parts;
    }

    /**
     * Apply validated build and disband orders. Orders beyond a player's adjustment are
     * truncated in submission order; owed disbands nobody ordered are chosen by
     * {@link #civilDisorder(GameState, String, int, Set)}.
     */
    public BuildOutcome resolve(GameState state, Rules rules, List<Order> orders) {
        GameState.Editor editor = state.edit();
        List<Order.Build> built = new ArrayList<>();
        List<Part> disbanded = new ArrayList<>();
        List<RejectedOrder> truncated = new ArrayList<>();

        for (PlayerState player : state.getPlayers()) {
            String name = player.name();
            int adjustment = adjustment(state, name);
            List<Order> own = orders.stream().filter(o -> o.player().equals(name)).toList();

            if (adjustment > 0) {
                List<Part> eligible = eligibleBuildParts(state, rules, name);
                Set<Integer> usedTerritories = new HashSet<>();
                for (Order order : own) {
                    if (!(order instanceof Order.Build build) || !eligible.contains(build.part())) {
                        truncated.add(new RejectedOrder(order, "not a legal build"));
                    } else if (built.stream().filter(b -> b.player().equals(name)).count() >= adjustment) {
                        truncated.add(new RejectedOrder(order, "exceeds build allowance of " + adjustment));
                    } else if (!usedTerritories.add(build.part().territoryIndex())) {
                        truncated.add(new RejectedOrder(order, "center already used for a build"));
                    } else {
                        editor.placeUnit(build.part(), name);
                        built.add(build);
                    }
                }
            } else if (adjustment < 0) {
                int owed = -adjustment;
                Set<Part> chosen = new HashSet<>();
                for (Order order : own) {
                    if (!(order instanceof Order.Disband disband) || !name.equals(state.unitOwner(disband.part()).orElse(null))) {
                        truncated.add(new RejectedOrder(order, "not a legal disband"));
                    } else if (chosen.size() >= owed) {
                        truncated.add(new RejectedOrder(order, "exceeds required disbands of " + owed));
                    } else if (chosen.add(disband.part())) {
                        disbanded.add(disband.part());
                    }
                }
                if (chosen.size() < owed) {
                    List<Part> forced = civilDisorder(state, name, owed - chosen.size(), chosen);
                    log.info("{} owed {} disbands, civil disorder removes {}", name, owed, forced);
                    disbanded.addAll(forced);
                }
            } else {
                own.forEach(order -> truncated.add(new RejectedOrder(order, "no adjustment this phase")));
            }
        }
        disbanded.forEach(editor::removeUnit);

        log.info("Resolved {}: {} built, {} disbanded, {} truncated",
                state.getPhaseLabel(), built.size(), disbanded.size(), truncated.size());
        return BuildOutcome.builder()
                .nextState(editor.build())
                .built(built)
                .disbanded(disbanded)
                .truncated(truncated)
                .build();
    }

    /**
     * Units a player in civil disorder loses: farthest from the nearest home center
     * first, fleets before armies at equal distance, then by part id.
     */
    public List<Part> civilDisorder(GameState state, String player, int count, Set<Part> excluded) {
        MapGraph map = state.getMap();
        PlayerState playerState = state.findPlayer(player)
                .orElseThrow(() -> new IllegalArgumentException("Unknown player: " + player));
        List<Territory> homes = playerState.homeCenters().stream().map(map::territory).toList();
        int[] distance = map.distancesFrom(homes);

        Comparator<Part> priority = Comparator
                .comparingInt((Part p) -> distance[p.territoryIndex()]).reversed()
                .thenComparing(p -> UnitType.on(p) == UnitType.FLEET ? 0 : 1)
                .thenComparing(Part::id);
        return state.units(player).stream()
                .filter(part -> !excluded.contains(part))
                .sorted(priority)
                .limit(count)
                .toList();
    }
}
