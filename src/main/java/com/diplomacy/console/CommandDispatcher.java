package com.diplomacy.console;

import com.diplomacy.config.MapLoader;
import com.diplomacy.config.RulesLoader;
import com.diplomacy.model.Order;
import com.diplomacy.model.PressMessage;
import com.diplomacy.service.GameSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns one console line into a game action and returns the lines to print.
 * Malformed input is reported as {@code Error: ...}, refused actions as
 * {@code Rejected: ...}; neither stops the console.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandDispatcher {

    private final GameSession gameSession;
    private final OrderParser orderParser;
    private final PhaseAnnouncer phaseAnnouncer;
    private final MapLoader mapLoader;
    private final RulesLoader rulesLoader;

    public List<String> dispatch(String line) {
        List<String> tokens = new ArrayList<>(Arrays.asList(line.trim().split("\\s+")));
        if (!tokens.isEmpty() && tokens.get(0).equals("diplomacy")) {
            tokens.remove(0);
        }
        if (tokens.isEmpty() || tokens.get(0).isEmpty()) {
            return List.of();
        }
        try {
            return execute(tokens);
        } catch (IllegalArgumentException e) {
            log.debug("Bad command '{}': {}", line, e.getMessage());
            return List.of("Error: " + e.getMessage());
        } catch (IllegalStateException e) {
            log.debug("Refused command '{}': {}", line, e.getMessage());
            return List.of("Rejected: " + e.getMessage());
        }
    }

    private List<String> execute(List<String> tokens) {
        String command = tokens.get(0);
        List<String> args = tokens.subList(1, tokens.size());
        switch (command) {
            case "--order": {
                requireArgs(args, 3, "--order <player> <order>");
                Order order = orderParser.parse(mapLoader.getMapGraph(), args.get(0), args.subList(1, args.size()));
                gameSession.submit(order);
                return List.of("Buffered " + order.player() + " " + order.toNotation());
            }
            case "--ready": {
                requireArgs(args, 1, "--ready <player> [1|0]");
                boolean ready = args.size() < 2 || flag(args.get(1));
                gameSession.ready(args.get(0), ready);
                return List.of(args.get(0) + (ready ? " ready" : " not ready"));
            }
            case "--draw": {
                requireArgs(args, 2, "--draw <player> 1|0");
                boolean draw = flag(args.get(1));
                gameSession.vote(args.get(0), draw);
                return List.of(args.get(0) + (draw ? " votes for a draw" : " withdraws the draw vote"));
            }
            case "--votes":
                return List.of(gameSession.describeVotes());
            case "--press":
                return press(args);
            case "--map":
                return List.of(mapLoader.getRawJson());
            case "--rules":
                return List.of(rulesLoader.getRawJson());
            case "--phase":
                return phaseAnnouncer.describePhase(gameSession.getState());
            case "--state":
                return phaseAnnouncer.describeState(gameSession.getState());
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private List<String> press(List<String> args) {
        requireArgs(args, 1, "--press <from> <to|public> <message> or --press <player|public>");
        if (args.size() == 1) {
            return gameSession.inbox(args.get(0)).stream().map(PressMessage::format).toList();
        }
        requireArgs(args, 3, "--press <from> <to|public> <message>");
        PressMessage message = gameSession.sendPress(args.get(0), args.get(1),
                String.join(" ", args.subList(2, args.size())));
        return List.of("Sent to " + message.getRecipient());
    }

    private boolean flag(String value) {
        if (value.equals("1")) {
            return true;
        }
        if (value.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException("Expected 1 or 0 but got " + value);
    }

    private void requireArgs(List<String> args, int min, String usage) {
        if (args.size() < min) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }
}
