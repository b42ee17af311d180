package com.diplomacy.service;

import com.diplomacy.model.GameState;
import com.diplomacy.model.PressMessage;
import com.diplomacy.repository.PressMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Diplomatic press between players. Press has no effect on adjudication.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class PressService {

    private final PressMessageRepository pressMessageRepository;

    /**
     * @param recipient a player name or {@link PressMessage#PUBLIC}
     * @throws IllegalArgumentException for unknown players or an empty message
     */
    public PressMessage send(GameState state, String sender, String recipient, String body) {
        if (!state.hasPlayer(sender)) {
            throw new IllegalArgumentException("Unknown player: " + sender);
        }
        if (!PressMessage.PUBLIC.equals(recipient) && !state.hasPlayer(recipient)) {
            throw new IllegalArgumentException("Unknown recipient: " + recipient);
        }
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Message is empty");
        }

        PressMessage message = PressMessage.builder()
                .sender(sender)
                .recipient(recipient)
                .body(body.trim())
                .phaseCount(state.getPhaseCount())
                .build();
        PressMessage saved = pressMessageRepository.save(message);
        log.info("Press from {} to {} in {}", sender, recipient, state.getPhaseLabel());
        return saved;
    }

    /**
     * Messages addressed to a player, or all public messages for {@link PressMessage#PUBLIC}.
     */
    @Transactional(readOnly = true)
    public List<PressMessage> inbox(GameState state, String recipient) {
        if (!PressMessage.PUBLIC.equals(recipient) && !state.hasPlayer(recipient)) {
            throw new IllegalArgumentException("Unknown recipient: " + recipient);
        }
        return pressMessageRepository.findByRecipientOrderBySentAtAsc(recipient);
    }
}
