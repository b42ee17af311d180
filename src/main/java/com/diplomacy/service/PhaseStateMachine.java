package com.diplomacy.service;

import com.diplomacy.config.MapLoader;
import com.diplomacy.config.RulesLoader;
import com.diplomacy.dto.BuildOutcome;
import com.diplomacy.dto.MoveOutcome;
import com.diplomacy.dto.PhaseReport;
import com.diplomacy.dto.RetreatOutcome;
import com.diplomacy.dto.ValidationResult;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.GameStatus;
import com.diplomacy.model.Order;
import com.diplomacy.model.Part;
import com.diplomacy.model.PhaseKind;
import com.diplomacy.model.PlayerState;
import com.diplomacy.model.Rules;
import com.diplomacy.model.Territory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the authoritative {@link GameState} and advances it one phase at a time:
 * move, then retreat when units were dislodged, with a build phase every
 * {@code buildTime} phases. The snapshot is replaced as a whole after each phase.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhaseStateMachine {

    private final MapLoader mapLoader;
    private final RulesLoader rulesLoader;
    private final OrderValidator orderValidator;
    private final MoveAdjudicator moveAdjudicator;
    private final RetreatResolver retreatResolver;
    private final BuildResolver buildResolver;
    private final DrawVoteTracker drawVoteTracker;
    private final PhaseLogService phaseLogService;

    private volatile GameState state;

    /**
     * Set up the starting position from the map and open phase 1.
     */
    public synchronized GameState start() {
        Rules rules = rulesLoader.getRules();
        GameState initial = GameState.initial(mapLoader.getMapGraph());
        state = initial.edit().phase(1, rules.kindOfPhase(1)).build();
        drawVoteTracker.reset();
        log.info("Game started with players {}", state.getPlayers().stream().map(PlayerState::name).toList());
        return state;
    }

    /**
     * @throws IllegalStateException before {@link #start()}
     */
    public GameState getState() {
        GameState current = state;
        if (current == null) {
            throw new IllegalStateException("Game not started");
        }
        return current;
    }

    public Rules getRules() {
        return rulesLoader.getRules();
    }

    public boolean isOver() {
        return state != null && getState().getStatus() != GameStatus.IN_PROGRESS;
    }

    /**
     * Players the ready barrier waits for in the current phase.
     */
    public Set<String> expectedPlayers() {
        GameState current = getState();
        Set<String> expected = new LinkedHashSet<>();
        if (current.getStatus() != GameStatus.IN_PROGRESS) {
            return expected;
        }
        switch (current.getPhaseKind()) {
            case MOVE -> expected.addAll(current.activePlayers());
            case RETREAT -> current.getDislodged().forEach(d -> expected.add(d.player()));
            case BUILD -> expected.addAll(buildResolver.adjustments(current).keySet());
        }
        return expected;
    }

    /**
     * Resolve the current phase with the buffered orders and move to the next one.
     *
     * @throws IllegalStateException if the game is not running
     */
    public synchronized PhaseReport resolve(List<Order> orders) {
        GameState current = getState();
        if (current.getStatus() != GameStatus.IN_PROGRESS) {
            throw new IllegalStateException("Game is over");
        }
        Rules rules = getRules();
        String label = current.getPhaseLabel();
        Set<String> expected = expectedPlayers();

        ValidationResult validation = orderValidator.validate(current, rules, orders);
        PhaseReport report = PhaseReport.builder()
                .phaseLabel(label)
                .kind(current.getPhaseKind())
                .rejected(validation.getRejected())
                .build();

        GameState next;
        switch (current.getPhaseKind()) {
            case MOVE -> {
                MoveOutcome outcome = moveAdjudicator.adjudicate(current, validation.getAccepted(), rules.convoyParadox());
                report.setResults(outcome.getResults());
                report.setDislodged(outcome.getDislodged());
                report.setStandoffs(outcome.getStandoffs());
                if (outcome.getDislodged().isEmpty()) {
                    next = completeMoveCycle(outcome.getNextState(), rules);
                } else {
                    next = outcome.getNextState().edit().phase(current.getPhaseCount(), PhaseKind.RETREAT).build();
                }
            }
            case RETREAT -> {
                RetreatOutcome outcome = retreatResolver.resolve(current, validation.getAccepted());
                outcome.getDisbanded().forEach(d -> report.getDisbanded().add(d.part().id()));
                next = completeMoveCycle(outcome.getNextState(), rules);
            }
            case BUILD -> {
                BuildOutcome outcome = buildResolver.resolve(current, rules, validation.getAccepted());
                report.getRejected().addAll(outcome.getTruncated());
                outcome.getDisbanded().forEach(p -> report.getDisbanded().add(p.id()));
                next = advance(checkWinner(outcome.getNextState(), rules), rules);
            }
            default -> throw new IllegalStateException("Unknown phase kind " + current.getPhaseKind());
        }

        if (next.getStatus() == GameStatus.IN_PROGRESS && drawVoteTracker.checkVotes(next, rules)) {
            Map<String, Double> shares = drawVoteTracker.shares(next, rules.drawType());
            report.setDrawShares(shares);
            next = next.edit().status(GameStatus.DRAWN, null).build();
            log.info("Draw declared after {}: {}", label, shares);
        }

        phaseLogService.record(label, expected, validation.getAccepted());
        state = next;
        report.setState(next);
        phaseLogService.export();

        if (next.getStatus() == GameStatus.FINISHED) {
            log.info("Game won by {} after {}", next.getWinner(), label);
        } else {
            log.info("Resolved {}, next is {}", label, next.getPhaseLabel());
        }
        return report;
    }

    /**
     * End of a move cycle: occupied centers change hands, then the win check runs and
     * the phase counter advances.
     */
    private GameState completeMoveCycle(GameState afterMoves, Rules rules) {
        GameState.Editor editor = afterMoves.edit();
        for (Territory territory : afterMoves.getMap().getTerritories()) {
            if (!territory.supplyCenter()) {
                continue;
            }
            Optional<Part> occupied = afterMoves.occupiedPart(territory);
            occupied.flatMap(afterMoves::unitOwner).ifPresent(owner -> editor.setCenterOwner(territory, owner));
        }
        return advance(checkWinner(editor.build(), rules), rules);
    }

    private GameState checkWinner(GameState candidate, Rules rules) {
        List<String> active = candidate.activePlayers();

        // Last player standing
        if (active.size() == 1) {
            return candidate.edit().status(GameStatus.FINISHED, active.get(0)).build();
        }

        Optional<String> leader = active.stream()
                .filter(p -> candidate.centerCount(p) >= rules.winCondition())
                .max(Comparator.comparingInt(candidate::centerCount));
        if (leader.isPresent()) {
            return candidate.edit().status(GameStatus.FINISHED, leader.get()).build();
        }
        return candidate;
    }

    private GameState advance(GameState candidate, Rules rules) {
        int count = candidate.getPhaseCount() + 1;
        return candidate.edit()
                .phase(count, rules.kindOfPhase(count))
                .dislodged(List.<Dislodgement>of())
                .build();
    }
}
