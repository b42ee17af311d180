package com.diplomacy.console;

import com.diplomacy.dto.OrderResult;
import com.diplomacy.dto.PhaseReport;
import com.diplomacy.dto.RejectedOrder;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.GameStatus;
import com.diplomacy.model.Part;
import com.diplomacy.model.PlayerState;
import com.diplomacy.model.Territory;
import com.diplomacy.service.BuildResolver;
import com.diplomacy.service.PhaseListener;
import com.diplomacy.service.RetreatResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prints phase banners and phase results to the console.
 */
@Component
@RequiredArgsConstructor
public class PhaseAnnouncer implements PhaseListener {

    private final RetreatResolver retreatResolver;
    private final BuildResolver buildResolver;

    private PrintStream out = System.out;

    @Override
    public void phaseOpened(GameState state) {
        describePhase(state).forEach(out::println);
    }

    @Override
    public void phaseResolved(PhaseReport report) {
        describeResult(report).forEach(out::println);
    }

    /**
     * Banner of the current phase, followed by retreat options or build counts.
     */
    public List<String> describePhase(GameState state) {
        List<String> lines = new ArrayList<>();
        lines.add(state.getPhaseLabel());
        switch (state.getPhaseKind()) {
            case RETREAT -> {
                for (Dislodgement dislodgement : state.getDislodged()) {
                    String options = retreatResolver.retreatOptions(state, dislodgement).stream()
                            .map(Part::id)
                            .collect(Collectors.joining(", "));
                    lines.add(dislodgement.player() + " retreat " + dislodgement.part().id() + " (" + options + ")");
                }
            }
            case BUILD -> buildResolver.adjustments(state).forEach((player, adjustment) ->
                    lines.add(player + (adjustment > 0 ? " build " : " disband ") + Math.abs(adjustment)));
            case MOVE -> {
                // banner only
            }
        }
        return lines;
    }

    public List<String> describeResult(PhaseReport report) {
        List<String> lines = new ArrayList<>();
        report.getRejected().stream().map(RejectedOrder::format).forEach(lines::add);
        report.getResults().stream()
                .filter(result -> !result.succeeded())
                .map(OrderResult::format)
                .forEach(lines::add);
        report.getStandoffs().forEach(territory -> lines.add("Standoff in " + territory));
        report.getDislodged().forEach(d -> lines.add(d.player() + " dislodged from " + d.part().id()));
        report.getDisbanded().forEach(part -> lines.add("Disbanded " + part));

        GameState state = report.getState();
        if (state.getStatus() == GameStatus.FINISHED) {
            lines.add("Winner " + state.getWinner());
        } else if (state.getStatus() == GameStatus.DRAWN) {
            lines.add("Draw " + report.getDrawShares().entrySet().stream()
                    .map(e -> e.getKey() + "=" + String.format(Locale.ROOT, "%.3f", e.getValue()))
                    .collect(Collectors.joining(" ")));
        }
        return lines;
    }

    /**
     * Units and center owners, one line per player.
     */
    public List<String> describeState(GameState state) {
        List<String> lines = new ArrayList<>();
        for (String player : state.getPlayers().stream().map(PlayerState::name).toList()) {
            String units = state.units(player).stream().map(Part::id).collect(Collectors.joining(" "));
            String centers = state.centers(player).stream().map(Territory::id).collect(Collectors.joining(" "));
            lines.add(player + " units [" + units + "] centers [" + centers + "]"
                    + (state.isEliminated(player) ? " eliminated" : ""));
        }
        return lines;
    }
}
