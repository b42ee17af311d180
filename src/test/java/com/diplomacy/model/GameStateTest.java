package com.diplomacy.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.diplomacy.TestGames.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the GameState snapshot and its editor.
 */
class GameStateTest {

    @Test
    @DisplayName("initial state follows the map's start positions")
    void shouldBuildInitialState() {
        GameState state = initialState();

        assertEquals(List.of("ENG", "FRA", "GER"), state.getPlayers().stream().map(PlayerState::name).toList());
        assertEquals(List.of(part("BRE_C"), part("PAR_L")), state.units("FRA"));
        assertEquals(3, state.centerCount("GER"));
        assertEquals(Optional.empty(), state.centerOwner(sampleMap().findTerritory("SPA").orElseThrow()));
        assertEquals(GameStatus.IN_PROGRESS, state.getStatus());
    }

    @Test
    @DisplayName("home centers are the centers a player starts with")
    void shouldRecordHomeCenters() {
        PlayerState france = initialState().findPlayer("FRA").orElseThrow();

        assertTrue(france.isHomeCenter(sampleMap().findTerritory("PAR").orElseThrow()));
        assertFalse(france.isHomeCenter(sampleMap().findTerritory("SPA").orElseThrow()));
    }

    @Test
    @DisplayName("editing returns a new snapshot and leaves the original untouched")
    void shouldNotMutateOriginal() {
        GameState original = initialState();

        GameState edited = original.edit().removeUnit(part("LON_C")).placeUnit(part("NTH_C"), "ENG").build();

        assertTrue(original.hasUnit(part("LON_C")));
        assertFalse(original.hasUnit(part("NTH_C")));
        assertEquals(Optional.of("ENG"), edited.unitOwner(part("NTH_C")));
        assertFalse(edited.hasUnit(part("LON_C")));
    }

    @Test
    @DisplayName("a territory holds at most one unit across its parts")
    void shouldRefuseSecondUnitInTerritory() {
        GameState.Editor editor = board("FRA SPA_NC").edit();

        assertThrows(IllegalStateException.class, () -> editor.placeUnit(part("SPA_L"), "FRA"));
        assertEquals(Optional.of(part("SPA_NC")),
                board("FRA SPA_NC").occupiedPart(sampleMap().findTerritory("SPA").orElseThrow()));
    }

    @Test
    @DisplayName("unknown players cannot own units")
    void shouldRefuseUnknownPlayer() {
        assertThrows(IllegalArgumentException.class, () -> initialState().edit().placeUnit(part("YOR_L"), "ITA"));
    }

    @Test
    @DisplayName("a player without units and centers is eliminated")
    void shouldEliminatePlayerWithoutAnything() {
        GameState state = board("ENG LON_C", "GER KIE_C").edit()
                .setCenterOwner(sampleMap().findTerritory("BRE").orElseThrow(), "ENG")
                .setCenterOwner(sampleMap().findTerritory("PAR").orElseThrow(), null)
                .build();

        assertTrue(state.isEliminated("FRA"));
        assertFalse(state.isEliminated("GER"));
        assertEquals(List.of("ENG", "GER"), state.activePlayers());
    }

    @Test
    @DisplayName("phase label combines number and kind")
    void shouldLabelPhase() {
        GameState state = initialState().edit().phase(4, PhaseKind.RETREAT).build();

        assertEquals("Phase 4 retreat", state.getPhaseLabel());
    }
}
