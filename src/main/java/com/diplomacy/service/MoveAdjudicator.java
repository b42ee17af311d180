package com.diplomacy.service;

import com.diplomacy.dto.MoveOutcome;
import com.diplomacy.dto.OrderResult;
import com.diplomacy.model.ConvoyParadoxRule;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.MapGraph;
import com.diplomacy.model.Order;
import com.diplomacy.model.OrderType;
import com.diplomacy.model.Part;
import com.diplomacy.model.PhaseKind;
import com.diplomacy.model.Territory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves all simultaneous move-phase orders into the next occupancy.
 * <p>
 * Every unit's order is a yes/no decision (move succeeds, support is given, convoying
 * fleet stays in place). Decisions depend on each other through hold, attack, defend
 * and prevent strengths. A decision is resolved recursively; when the recursion
 * reaches a decision that is already being evaluated, that decision is guessed
 * (first as failing, then as succeeding) and the guess is checked against the result.
 * <ul>
 *   <li>one consistent guess: that is the outcome;</li>
 *   <li>both or neither consistent, no convoying fleet in the cycle: circular movement, every
 *       move in the cycle succeeds (this includes swaps where a leg goes by convoy);</li>
 *   <li>both or neither consistent, a convoying fleet in the cycle: convoy paradox, settled by
 *       the configured {@link ConvoyParadoxRule}.</li>
 * </ul>
 * The adjudicator is stateless: all working data lives in a per-call {@link Adjudication}.
 */
@Service
@Slf4j
public class MoveAdjudicator {

    /**
     * Adjudicate a move phase.
     *
     * @param state       snapshot before the phase, in a move phase
     * @param orders      validated move-phase orders; units without one hold
     * @param paradoxRule policy for paradoxical convoy cycles
     * @return next occupancy, dislodged units, standoff territories and per-order results
     * @throws IllegalStateException if an order is not a move-phase order or names a part without a unit
     */
    public MoveOutcome adjudicate(GameState state, List<Order> orders, ConvoyParadoxRule paradoxRule) {
        Adjudication adjudication = new Adjudication(state, orders, paradoxRule);
        MoveOutcome outcome = adjudication.run();
        log.info("Adjudicated {}: {} orders, {} dislodged, standoffs {}", state.getPhaseLabel(),
                outcome.getResults().size(), outcome.getDislodged().size(), outcome.getStandoffs());
        return outcome;
    }

    private enum DecisionState {
        UNRESOLVED,
        GUESSING,
        RESOLVED
    }

    /**
     * Working data of one adjudication. Everything is indexed by territory: a territory
     * holds at most one unit, so a territory index identifies a unit and its order.
     */
    private static final class Adjudication {

        private final MapGraph map;
        private final GameState state;
        private final ConvoyParadoxRule paradoxRule;

        private final Order[] orders;
        private final Part[] unitPart;
        private final String[] owner;
        private final List<List<Integer>> attackersOf = new ArrayList<>();
        private final List<List<Integer>> supportersOf = new ArrayList<>();

        private final DecisionState[] status;
        private final boolean[] result;
        private final boolean[] pathBlocked;
        private final List<Integer> dependencies = new ArrayList<>();

        Adjudication(GameState state, List<Order> submitted, ConvoyParadoxRule paradoxRule) {
            this.map = state.getMap();
            this.state = state;
            this.paradoxRule = paradoxRule;

            int size = map.getTerritories().size();
            orders = new Order[size];
            unitPart = new Part[size];
            owner = new String[size];
            status = new DecisionState[size];
            result = new boolean[size];
            pathBlocked = new boolean[size];
            for (int i = 0; i < size; i++) {
                attackersOf.add(new ArrayList<>());
                supportersOf.add(new ArrayList<>());
                status[i] = DecisionState.UNRESOLVED;
            }

            for (Part part : state.unitParts()) {
                int t = part.territoryIndex();
                unitPart[t] = part;
                owner[t] = state.unitOwner(part).orElseThrow();
            }
            for (Order order : submitted) {
                int t = order.part().territoryIndex();
                if (unitPart[t] == null || !unitPart[t].equals(order.part())) {
                    throw new IllegalStateException("No unit on " + order.part().id() + " for " + order.toNotation());
                }
                if (!order.type().allowedIn(PhaseKind.MOVE)) {
                    throw new IllegalStateException(order.type() + " order in a move phase: " + order.toNotation());
                }
                orders[t] = order;
            }
            for (int t = 0; t < size; t++) {
                if (unitPart[t] != null && orders[t] == null) {
                    orders[t] = new Order.Hold(owner[t], unitPart[t]);
                }
            }

            for (int t = 0; t < size; t++) {
                Order order = orders[t];
                if (order instanceof Order.Move) {
                    attackersOf.get(destination(t)).add(t);
                } else if (order instanceof Order.SupportMove support) {
                    supportersOf.get(support.from().territoryIndex()).add(t);
                } else if (order instanceof Order.SupportHold support) {
                    supportersOf.get(support.target().territoryIndex()).add(t);
                }
            }
        }

        MoveOutcome run() {
            for (int t = 0; t < orders.length; t++) {
                if (orders[t] != null) {
                    resolve(t);
                }
            }

            boolean[] moved = new boolean[orders.length];
            int[] dislodgedBy = new int[orders.length];
            boolean[] occupiedAfter = new boolean[orders.length];
            for (int t = 0; t < orders.length; t++) {
                dislodgedBy[t] = -1;
                moved[t] = isMove(t) && resolve(t);
                if (moved[t]) {
                    occupiedAfter[destination(t)] = true;
                }
            }
            for (int t = 0; t < orders.length; t++) {
                if (orders[t] == null || moved[t]) {
                    continue;
                }
                for (int attacker : attackersOf.get(t)) {
                    if (resolve(attacker)) {
                        dislodgedBy[t] = attacker;
                    }
                }
                if (dislodgedBy[t] < 0) {
                    occupiedAfter[t] = true;
                }
            }

            Set<Integer> standoffs = new LinkedHashSet<>();
            for (int t = 0; t < orders.length; t++) {
                if (occupiedAfter[t]) {
                    continue;
                }
                for (int attacker : attackersOf.get(t)) {
                    // a unit beaten head-to-head does not contest the winner's origin
                    if (hasPath(attacker) && !resolve(attacker) && dislodgedBy[attacker] != t) {
                        standoffs.add(t);
                    }
                }
            }

            GameState.Editor editor = state.edit();
            List<Dislodgement> dislodged = new ArrayList<>();
            for (int t = 0; t < orders.length; t++) {
                if (moved[t]) {
                    editor.removeUnit(unitPart[t]);
                } else if (dislodgedBy[t] >= 0) {
                    editor.removeUnit(unitPart[t]);
                    Set<Integer> forbidden = new HashSet<>(standoffs);
                    forbidden.add(dislodgedBy[t]);
                    dislodged.add(new Dislodgement(unitPart[t], owner[t], dislodgedBy[t], forbidden));
                }
            }
            for (int t = 0; t < orders.length; t++) {
                if (moved[t]) {
                    editor.placeUnit(((Order.Move) orders[t]).destination(), owner[t]);
                }
            }
            editor.dislodged(dislodged);

            List<OrderResult> results = new ArrayList<>();
            for (int t = 0; t < orders.length; t++) {
                if (orders[t] != null) {
                    results.add(describe(t, dislodgedBy[t] >= 0));
                }
            }

            Set<String> standoffIds = new LinkedHashSet<>();
            standoffs.forEach(t -> standoffIds.add(map.territory(t).id()));
            return MoveOutcome.builder()
                    .nextState(editor.build())
                    .dislodged(dislodged)
                    .standoffs(standoffIds)
                    .results(results)
                    .build();
        }

        private OrderResult describe(int t, boolean dislodged) {
            Order order = orders[t];
            boolean succeeded = resolve(t);
            String detail = switch (order.type()) {
                case MOVE -> !hasPath(t) ? "no convoy path" : succeeded ? "moved" : "bounced";
                case SUPPORT_HOLD, SUPPORT_MOVE -> !matchesSupported(t) ? "void" : succeeded ? "given" : "cut";
                case CONVOY -> succeeded ? "convoyed" : "disrupted";
                case HOLD -> "held";
                case RETREAT, BUILD, DISBAND -> throw new IllegalStateException("Not a move-phase order: " + order);
            };
            if (order.type() == OrderType.SUPPORT_HOLD || order.type() == OrderType.SUPPORT_MOVE) {
                succeeded = succeeded && matchesSupported(t);
            }
            if (dislodged) {
                return new OrderResult(order, false, "dislodged");
            }
            return new OrderResult(order, succeeded, detail);
        }

        // ── decision resolution ─────────────────────────────────────────

        private boolean resolve(int t) {
            if (status[t] == DecisionState.RESOLVED) {
                return result[t];
            }
            if (status[t] == DecisionState.GUESSING) {
                // recorded on every hit so that callers see they depend on a guess
                dependencies.add(t);
                return result[t];
            }

            int oldCount = dependencies.size();
            result[t] = false;
            status[t] = DecisionState.GUESSING;
            boolean first = adjudicate(t);

            if (dependencies.size() == oldCount) {
                if (status[t] != DecisionState.RESOLVED) {
                    result[t] = first;
                    status[t] = DecisionState.RESOLVED;
                }
                return first;
            }

            if (dependencies.get(oldCount) != t) {
                // depends on a guess further up the stack, but is not part of its cycle
                dependencies.add(t);
                result[t] = first;
                return first;
            }

            // t is part of a cycle: check the opposite guess
            resetFrom(oldCount);
            result[t] = true;
            status[t] = DecisionState.GUESSING;
            boolean second = adjudicate(t);

            if (first == second) {
                resetFrom(oldCount);
                result[t] = first;
                status[t] = DecisionState.RESOLVED;
                return first;
            }

            applyBackupRule(oldCount);
            return resolve(t);
        }

        private void resetFrom(int oldCount) {
            for (int i = oldCount; i < dependencies.size(); i++) {
                status[dependencies.get(i)] = DecisionState.UNRESOLVED;
            }
            dependencies.subList(oldCount, dependencies.size()).clear();
        }

        private void applyBackupRule(int oldCount) {
            Set<Integer> cycle = new LinkedHashSet<>(dependencies.subList(oldCount, dependencies.size()));
            dependencies.subList(oldCount, dependencies.size()).clear();
            for (int t : cycle) {
                status[t] = DecisionState.UNRESOLVED;
            }

            // a paradox needs a convoying fleet whose own decision is in the cycle;
            // a convoyed unit swapping places is plain circular movement
            Set<Integer> convoyedMoves = new LinkedHashSet<>();
            for (int t : cycle) {
                if (orders[t] instanceof Order.Convoy) {
                    convoyedMoves.addAll(movesConvoyedBy(t));
                }
            }

            if (convoyedMoves.isEmpty()) {
                log.debug("Circular movement through territories {}", cycle);
                for (int t : cycle) {
                    if (isMove(t)) {
                        settle(t, true);
                    }
                }
                return;
            }

            log.info("Convoy paradox through territories {}, applying {} rule", cycle, paradoxRule);
            Set<Integer> failing = new LinkedHashSet<>(convoyedMoves);
            if (paradoxRule == ConvoyParadoxRule.ALL_HOLD) {
                cycle.stream().filter(this::isMove).forEach(failing::add);
            }
            for (int t : failing) {
                if (convoyed(t)) {
                    pathBlocked[t] = true;
                }
                settle(t, false);
            }
        }

        private void settle(int t, boolean outcome) {
            result[t] = outcome;
            status[t] = DecisionState.RESOLVED;
        }

        private boolean adjudicate(int t) {
            Order order = orders[t];
            return switch (order.type()) {
                case MOVE -> adjudicateMove(t);
                case SUPPORT_HOLD, SUPPORT_MOVE -> adjudicateSupport(t);
                case CONVOY -> !attackedSuccessfully(t);
                case HOLD -> true;
                case RETREAT, BUILD, DISBAND -> throw new IllegalStateException("Not a move-phase order: " + order);
            };
        }

        private boolean adjudicateMove(int t) {
            if (!hasPath(t)) {
                return false;
            }
            int attack = attackStrength(t);
            int target = destination(t);
            if (headToHead(t)) {
                if (attack <= defendStrength(target)) {
                    return false;
                }
            } else if (attack <= holdStrength(target)) {
                return false;
            }
            for (int other : attackersOf.get(target)) {
                if (other != t && attack <= preventStrength(other)) {
                    return false;
                }
            }
            return true;
        }

        /**
         * A support is cut when its unit is attacked by a unit not owned by the supported unit's
         * owner, unless the attack comes from the territory the support is directed against.
         * An attack by the supporter's own power cuts too. It is also cut when its unit is dislodged.
         */
        private boolean adjudicateSupport(int t) {
            int against = orders[t] instanceof Order.SupportMove support
                    ? support.destination().territoryIndex()
                    : -1;
            String beneficiary = owner[supportedTerritory(t)];
            for (int attacker : attackersOf.get(t)) {
                if (owner[attacker].equals(beneficiary)) {
                    continue;
                }
                if (attacker == against) {
                    continue;
                }
                if (hasPath(attacker)) {
                    return false;
                }
            }
            return !attackedSuccessfully(t);
        }

        private boolean attackedSuccessfully(int t) {
            for (int attacker : attackersOf.get(t)) {
                if (resolve(attacker)) {
                    return true;
                }
            }
            return false;
        }

        // ── strengths ───────────────────────────────────────────────────

        private int holdStrength(int t) {
            if (orders[t] == null) {
                return 0;
            }
            if (isMove(t)) {
                return resolve(t) ? 0 : 1;
            }
            return 1 + supportCount(t, null);
        }

        private int attackStrength(int t) {
            if (!hasPath(t)) {
                return 0;
            }
            int target = destination(t);
            boolean vacated = orders[target] == null
                    || (isMove(target) && !headToHead(t) && resolve(target));
            if (vacated) {
                return 1 + supportCount(t, null);
            }
            if (owner[target].equals(owner[t])) {
                return 0;
            }
            return 1 + supportCount(t, owner[target]);
        }

        private int defendStrength(int t) {
            return 1 + supportCount(t, null);
        }

        private int preventStrength(int t) {
            if (!hasPath(t)) {
                return 0;
            }
            if (headToHead(t) && resolve(destination(t))) {
                return 0;
            }
            return 1 + supportCount(t, null);
        }

        /**
         * Supports given to the order of the unit on {@code t}: support-move for a move,
         * support-hold otherwise. Supports by {@code excludedOwner} are not counted.
         */
        private int supportCount(int t, String excludedOwner) {
            int count = 0;
            for (int supporter : supportersOf.get(t)) {
                if (!matchesSupported(supporter)) {
                    continue;
                }
                if (excludedOwner != null && excludedOwner.equals(owner[supporter])) {
                    continue;
                }
                if (resolve(supporter)) {
                    count++;
                }
            }
            return count;
        }

        private int supportedTerritory(int supporter) {
            Order order = orders[supporter];
            if (order instanceof Order.SupportMove support) {
                return support.from().territoryIndex();
            }
            return ((Order.SupportHold) order).target().territoryIndex();
        }

        /**
         * Whether the supported unit was actually ordered to do what the support assumes.
         */
        private boolean matchesSupported(int supporter) {
            int supported = supportedTerritory(supporter);
            if (orders[supported] == null) {
                return false;
            }
            if (orders[supporter] instanceof Order.SupportMove support) {
                return isMove(supported) && destination(supported) == support.destination().territoryIndex();
            }
            return !isMove(supported);
        }

        // ── paths and convoys ───────────────────────────────────────────

        private boolean hasPath(int t) {
            if (!convoyed(t)) {
                return true;
            }
            if (pathBlocked[t]) {
                return false;
            }
            return convoyPathExists(t);
        }

        private boolean convoyPathExists(int t) {
            Territory source = map.territory(t);
            Territory target = map.territory(destination(t));
            List<Integer> fleets = convoysFor(t);

            Set<Integer> visited = new HashSet<>();
            Deque<Integer> queue = new ArrayDeque<>();
            for (int fleet : fleets) {
                if (map.touches(unitPart[fleet], source) && resolve(fleet)) {
                    visited.add(fleet);
                    queue.add(fleet);
                }
            }
            while (!queue.isEmpty()) {
                int fleet = queue.poll();
                if (map.touches(unitPart[fleet], target)) {
                    return true;
                }
                for (int next : fleets) {
                    if (!visited.contains(next) && map.isAdjacent(unitPart[fleet], unitPart[next]) && resolve(next)) {
                        visited.add(next);
                        queue.add(next);
                    }
                }
            }
            return false;
        }

        private List<Integer> convoysFor(int t) {
            List<Integer> fleets = new ArrayList<>();
            int target = destination(t);
            for (int c = 0; c < orders.length; c++) {
                if (orders[c] instanceof Order.Convoy convoy
                        && convoy.from().territoryIndex() == t
                        && convoy.destination().territoryIndex() == target) {
                    fleets.add(c);
                }
            }
            return fleets;
        }

        private List<Integer> movesConvoyedBy(int c) {
            Order.Convoy convoy = (Order.Convoy) orders[c];
            int from = convoy.from().territoryIndex();
            if (isMove(from) && convoyed(from) && destination(from) == convoy.destination().territoryIndex()) {
                return List.of(from);
            }
            return List.of();
        }

        // ── order helpers ───────────────────────────────────────────────

        private boolean isMove(int t) {
            return orders[t] instanceof Order.Move;
        }

        private int destination(int t) {
            return ((Order.Move) orders[t]).destination().territoryIndex();
        }

        private boolean convoyed(int t) {
            Order.Move move = (Order.Move) orders[t];
            return move.viaConvoy() || !map.isAdjacent(move.part(), move.destination());
        }

        /**
         * Two units ordered into each other's territories, neither by convoy.
         */
        private boolean headToHead(int t) {
            int target = destination(t);
            return isMove(target) && destination(target) == t && !convoyed(t) && !convoyed(target);
        }
    }
}
