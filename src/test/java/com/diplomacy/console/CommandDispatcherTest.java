package com.diplomacy.console;

import static com.diplomacy.TestGames.initialState;
import static com.diplomacy.TestGames.move;
import static com.diplomacy.TestGames.sampleMap;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.diplomacy.config.MapLoader;
import com.diplomacy.config.RulesLoader;
import com.diplomacy.model.Order;
import com.diplomacy.model.PressMessage;
import com.diplomacy.service.GameSession;

/**
 * Unit tests for the console command dispatcher.
 */
@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    @Mock private GameSession gameSession;
    @Mock private PhaseAnnouncer phaseAnnouncer;
    @Mock private MapLoader mapLoader;
    @Mock private RulesLoader rulesLoader;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CommandDispatcher(gameSession, new OrderParser(), phaseAnnouncer, mapLoader, rulesLoader);
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @BeforeEach
        void setUp() {
            when(mapLoader.getMapGraph()).thenReturn(sampleMap());
        }

        @Test
        @DisplayName("An order is parsed and buffered")
        void shouldBufferOrder() {
            List<String> output = dispatcher.dispatch("diplomacy --order FRA PAR_L M to BUR_L");

            assertEquals(List.of("Buffered FRA PAR_L M BUR_L"), output);
            verify(gameSession).submit(move("FRA", "PAR_L", "BUR_L"));
        }

        @Test
        @DisplayName("A malformed order prints an error and does nothing")
        void shouldReportMalformedOrder() {
            List<String> output = dispatcher.dispatch("--order FRA PAR_L X BUR_L");

            assertEquals(List.of("Error: Unknown order type: X"), output);
            verifyNoInteractions(gameSession);
        }

        @Test
        @DisplayName("A refused order prints the reason")
        void shouldReportRefusedOrder() {
            doThrow(new IllegalStateException("Phase is closed")).when(gameSession).submit(any(Order.class));

            assertEquals(List.of("Rejected: Phase is closed"), dispatcher.dispatch("--order FRA PAR_L H"));
        }
    }

    @Test
    @DisplayName("Ready defaults to true and accepts 0 to withdraw")
    void shouldSetReadiness() {
        assertEquals(List.of("ENG ready"), dispatcher.dispatch("--ready ENG"));
        assertEquals(List.of("ENG not ready"), dispatcher.dispatch("--ready ENG 0"));

        verify(gameSession).ready("ENG", true);
        verify(gameSession).ready("ENG", false);
    }

    @Test
    @DisplayName("Draw votes need an explicit flag")
    void shouldVoteForDraw() {
        assertEquals(List.of("GER votes for a draw"), dispatcher.dispatch("--draw GER 1"));
        assertEquals(List.of("Error: Expected 1 or 0 but got yes"), dispatcher.dispatch("--draw GER yes"));

        verify(gameSession).vote("GER", true);
    }

    @Test
    @DisplayName("Press is sent with the rest of the line as message")
    void shouldSendPress() {
        PressMessage sent = PressMessage.builder().sender("ENG").recipient("public").body("hello all").build();
        when(gameSession.sendPress("ENG", "public", "hello all")).thenReturn(sent);

        assertEquals(List.of("Sent to public"), dispatcher.dispatch("--press ENG public hello all"));
    }

    @Test
    @DisplayName("Press with one argument lists the inbox")
    void shouldListInbox() {
        PressMessage message = PressMessage.builder().sender("ENG").recipient("FRA").body("truce?").build();
        when(gameSession.inbox("FRA")).thenReturn(List.of(message));

        assertEquals(List.of("ENG: truce?"), dispatcher.dispatch("--press FRA"));
    }

    @Test
    @DisplayName("Map and rules are printed as read")
    void shouldDumpConfiguration() {
        when(mapLoader.getRawJson()).thenReturn("{\"LON\":{}}");
        when(rulesLoader.getRawJson()).thenReturn("{\"winCondition\":8}");

        assertEquals(List.of("{\"LON\":{}}"), dispatcher.dispatch("--map"));
        assertEquals(List.of("{\"winCondition\":8}"), dispatcher.dispatch("--rules"));
    }

    @Test
    @DisplayName("Phase banner comes from the announcer")
    void shouldDescribePhase() {
        when(gameSession.getState()).thenReturn(initialState());
        when(phaseAnnouncer.describePhase(any())).thenReturn(List.of("Phase 1 move"));

        assertEquals(List.of("Phase 1 move"), dispatcher.dispatch("--phase"));
    }

    @Test
    @DisplayName("Unknown commands and usage errors print an error")
    void shouldReportBadCommands() {
        assertEquals(List.of("Error: Unknown command: --attack"), dispatcher.dispatch("--attack ENG"));
        assertTrue(dispatcher.dispatch("--order ENG").get(0).startsWith("Error: Usage:"));
        assertTrue(dispatcher.dispatch("   ").isEmpty());
    }
}
