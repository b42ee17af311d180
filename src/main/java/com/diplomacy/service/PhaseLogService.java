package com.diplomacy.service;

import com.diplomacy.model.Order;
import com.diplomacy.model.PhaseLogEntry;
import com.diplomacy.repository.PhaseLogRepository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the orders of every resolved phase and exports them as the phase log document:
 * {@code {"Phase 1 move": {"ENG": ["LON_C M NTH_C", ...], ...}, ...}}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class PhaseLogService {

    private final PhaseLogRepository phaseLogRepository;
    private final ObjectMapper objectMapper;

    @Value("${diplomacy.log-path:log.json}")
    private String logPath;

    /**
     * Store the orders of a resolved phase. Every listed player gets an entry, with or
     * without orders.
     */
    public void record(String phaseKey, Collection<String> players, List<Order> orders) {
        long sequence = phaseLogRepository.findMaxSequence();
        List<PhaseLogEntry> entries = new ArrayList<>();
        for (String player : players) {
            List<Order> own = orders.stream().filter(o -> o.player().equals(player)).toList();
            if (own.isEmpty()) {
                entries.add(entry(phaseKey, player, null, ++sequence));
            }
            for (Order order : own) {
                entries.add(entry(phaseKey, player, order.toNotation(), ++sequence));
            }
        }
        phaseLogRepository.saveAll(entries);
        log.debug("Logged {} entries for {}", entries.size(), phaseKey);
    }

    private PhaseLogEntry entry(String phaseKey, String player, String orderText, long sequence) {
        return PhaseLogEntry.builder()
                .phaseKey(phaseKey)
                .playerName(player)
                .orderText(orderText)
                .sequence(sequence)
                .build();
    }

    /**
     * The whole log, phases and orders in the order they were recorded.
     */
    @Transactional(readOnly = true)
    public Map<String, Map<String, List<String>>> document() {
        Map<String, Map<String, List<String>>> document = new LinkedHashMap<>();
        for (PhaseLogEntry entry : phaseLogRepository.findAllByOrderBySequenceAsc()) {
            List<String> orders = document
                    .computeIfAbsent(entry.getPhaseKey(), key -> new LinkedHashMap<>())
                    .computeIfAbsent(entry.getPlayerName(), name -> new ArrayList<>());
            if (entry.getOrderText() != null) {
                orders.add(entry.getOrderText());
            }
        }
        return document;
    }

    /**
     * Write the log document to the configured path. A blank path disables the export.
     * A failed write is logged and the game goes on; the stored log stays authoritative.
     *
     * @return whether the document was written
     */
    @Transactional(readOnly = true)
    public boolean export() {
        if (logPath == null || logPath.isBlank()) {
            return false;
        }
        try {
            String json = objectMapper.writer().withDefaultPrettyPrinter().writeValueAsString(document());
            Files.writeString(Path.of(logPath), json, StandardCharsets.UTF_8);
            log.debug("Exported phase log to {}", logPath);
            return true;
        } catch (JacksonException | IOException e) {
            log.error("Failed to export phase log to {}", logPath, e);
            return false;
        }
    }
}
