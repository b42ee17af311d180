package com.diplomacy.service;

import com.diplomacy.model.DrawEligibility;
import com.diplomacy.model.DrawType;
import com.diplomacy.model.GameState;
import com.diplomacy.model.PlayerState;
import com.diplomacy.model.Rules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Draw votes per player. Votes stay in place across phases until withdrawn; the phase
 * state machine checks them at every phase boundary.
 */
@Component
@Slf4j
public class DrawVoteTracker {

    private final Map<String, Boolean> votes = new LinkedHashMap<>();

    public synchronized void vote(String player, boolean draw) {
        votes.put(player, draw);
        log.info("{} {} a draw", player, draw ? "votes for" : "withdraws from");
    }

    public synchronized boolean hasVoted(String player) {
        return votes.getOrDefault(player, false);
    }

    public synchronized void reset() {
        votes.clear();
    }

    /**
     * True when every eligible player currently votes for a draw. With
     * {@link DrawEligibility#ACTIVE} eliminated players are not asked.
     */
    public synchronized boolean checkVotes(GameState state, Rules rules) {
        List<String> eligible = rules.drawEligibility() == DrawEligibility.ACTIVE
                ? state.activePlayers()
                : state.getPlayers().stream().map(PlayerState::name).toList();
        return !eligible.isEmpty() && eligible.stream().allMatch(this::hasVoted);
    }

    /**
     * Share of the game each surviving player receives when a draw is declared.
     * Shares sum to 1.
     */
    public Map<String, Double> shares(GameState state, DrawType drawType) {
        List<String> survivors = state.activePlayers();
        int totalCenters = survivors.stream().mapToInt(state::centerCount).sum();
        Map<String, Double> shares = new LinkedHashMap<>();
        for (String player : survivors) {
            if (drawType == DrawType.SOS && totalCenters > 0) {
                shares.put(player, (double) state.centerCount(player) / totalCenters);
            } else {
                shares.put(player, 1.0 / survivors.size());
            }
        }
        return shares;
    }

    /**
     * Vote summary for the console: every player's vote when votes are shown,
     * otherwise only how many players vote for a draw.
     */
    public synchronized String describe(GameState state, Rules rules) {
        if (rules.voteShown()) {
            return state.getPlayers().stream()
                    .map(p -> p.name() + "=" + (hasVoted(p.name()) ? 1 : 0))
                    .collect(Collectors.joining(" "));
        }
        long count = state.getPlayers().stream().filter(p -> hasVoted(p.name())).count();
        return "Draw votes: " + count + "/" + state.getPlayers().size();
    }
}
