package com.diplomacy.service;

import com.diplomacy.model.GameState;
import com.diplomacy.model.PressMessage;
import com.diplomacy.repository.PressMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.diplomacy.TestGames.initialState;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PressServiceTest {

    @Mock
    private PressMessageRepository pressMessageRepository;

    private PressService pressService;
    private GameState state;

    @BeforeEach
    void setUp() {
        pressService = new PressService(pressMessageRepository);
        state = initialState();
    }

    @Test
    @DisplayName("A message is stored with the current phase")
    void shouldSendMessage() {
        when(pressMessageRepository.save(any(PressMessage.class))).thenAnswer(inv -> inv.getArgument(0));

        PressMessage message = pressService.send(state, "ENG", "FRA", "  Stay out of the Channel ");

        assertEquals("Stay out of the Channel", message.getBody());
        assertEquals(state.getPhaseCount(), message.getPhaseCount());
        assertEquals("ENG: Stay out of the Channel", message.format());
    }

    @Test
    @DisplayName("Public messages are tagged in their rendering")
    void shouldSendPublicMessage() {
        when(pressMessageRepository.save(any(PressMessage.class))).thenAnswer(inv -> inv.getArgument(0));

        PressMessage message = pressService.send(state, "GER", PressMessage.PUBLIC, "Peace in our time");

        assertTrue(message.isPublic());
        assertEquals("GER/public: Peace in our time", message.format());
    }

    @Test
    @DisplayName("Unknown senders, unknown recipients and empty messages are refused")
    void shouldRefuseInvalidMessages() {
        IllegalArgumentException sender = assertThrows(IllegalArgumentException.class,
                () -> pressService.send(state, "ITA", "FRA", "hello"));
        IllegalArgumentException recipient = assertThrows(IllegalArgumentException.class,
                () -> pressService.send(state, "ENG", "ITA", "hello"));
        IllegalArgumentException empty = assertThrows(IllegalArgumentException.class,
                () -> pressService.send(state, "ENG", "FRA", "   "));

        assertEquals("Unknown player: ITA", sender.getMessage());
        assertEquals("Unknown recipient: ITA", recipient.getMessage());
        assertEquals("Message is empty", empty.getMessage());
        verifyNoInteractions(pressMessageRepository);
    }

    @Test
    @DisplayName("The inbox reads the recipient's messages")
    void shouldReadInbox() {
        PressMessage message = PressMessage.builder().sender("ENG").recipient("FRA").body("hi").build();
        when(pressMessageRepository.findByRecipientOrderBySentAtAsc("FRA")).thenReturn(List.of(message));

        assertEquals(List.of(message), pressService.inbox(state, "FRA"));
    }
}
