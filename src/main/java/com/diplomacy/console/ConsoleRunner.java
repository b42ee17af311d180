package com.diplomacy.console;

import com.diplomacy.service.GameSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Starts the game and feeds standard input to the {@link CommandDispatcher} line by line.
 */
@Component
@ConditionalOnProperty(name = "diplomacy.console.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsoleRunner implements CommandLineRunner {

    private final GameSession gameSession;
    private final CommandDispatcher commandDispatcher;

    @Override
    public void run(String... args) throws Exception {
        gameSession.play().whenComplete((state, error) -> {
            if (error != null) {
                log.error("Game stopped", error);
            } else {
                log.info("Game over: {}", state);
            }
        });

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                commandDispatcher.dispatch(line).forEach(System.out::println);
            }
        }
        log.info("Console input closed");
    }
}
