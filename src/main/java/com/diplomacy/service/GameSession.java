package com.diplomacy.service;

import com.diplomacy.dto.PhaseReport;
import com.diplomacy.model.GameState;
import com.diplomacy.model.Order;
import com.diplomacy.model.PressMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for everything players do: orders, readiness, draw votes and press.
 * The game itself runs on an async phase driver that opens a phase, waits on the
 * {@link PhaseBarrier} and hands the buffered orders to the {@link PhaseStateMachine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSession {

    private final PhaseStateMachine stateMachine;
    private final PhaseBarrier barrier;
    private final DrawVoteTracker drawVoteTracker;
    private final PressService pressService;
    private final List<PhaseListener> listeners;

    @Value("${diplomacy.phase.deadline:PT10M}")
    private Duration deadline;

    /**
     * Run a whole game, phase after phase, until someone wins or a draw is declared.
     */
    @Async
    public CompletableFuture<GameState> play() {
        stateMachine.start();
        try {
            while (!stateMachine.isOver()) {
                runPhase();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Phase driver interrupted in {}", stateMachine.getState().getPhaseLabel());
        } catch (RuntimeException e) {
            log.error("Phase driver stopped in {}", stateMachine.getState().getPhaseLabel(), e);
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.completedFuture(stateMachine.getState());
    }

    /**
     * Open the current phase, wait for the barrier and resolve it.
     */
    public PhaseReport runPhase() throws InterruptedException {
        GameState state = stateMachine.getState();
        barrier.open(stateMachine.expectedPlayers());
        listeners.forEach(listener -> listener.phaseOpened(state));

        List<Order> orders = barrier.awaitOrders(deadline);
        PhaseReport report = stateMachine.resolve(orders);
        listeners.forEach(listener -> listener.phaseResolved(report));
        return report;
    }

    public GameState getState() {
        return stateMachine.getState();
    }

    /**
     * @throws IllegalArgumentException for unknown players
     * @throws IllegalStateException when the game is over or no phase is open
     */
    public void submit(Order order) {
        requirePlayer(order.player());
        requireRunning();
        barrier.submit(order);
        log.debug("Buffered {} {}", order.player(), order.toNotation());
    }

    public void ready(String player, boolean isReady) {
        requirePlayer(player);
        requireRunning();
        barrier.setReady(player, isReady);
    }

    public void vote(String player, boolean draw) {
        requirePlayer(player);
        requireRunning();
        drawVoteTracker.vote(player, draw);
    }

    public String describeVotes() {
        return drawVoteTracker.describe(getState(), stateMachine.getRules());
    }

    public PressMessage sendPress(String sender, String recipient, String body) {
        return pressService.send(getState(), sender, recipient, body);
    }

    public List<PressMessage> inbox(String recipient) {
        return pressService.inbox(getState(), recipient);
    }

    private void requirePlayer(String player) {
        if (!getState().hasPlayer(player)) {
            throw new IllegalArgumentException("Unknown player: " + player);
        }
    }

    private void requireRunning() {
        if (stateMachine.isOver()) {
            throw new IllegalStateException("Game is over");
        }
    }
}
