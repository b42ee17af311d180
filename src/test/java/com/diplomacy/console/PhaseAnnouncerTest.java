package com.diplomacy.console;

import com.diplomacy.dto.OrderResult;
import com.diplomacy.dto.PhaseReport;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.GameStatus;
import com.diplomacy.model.PhaseKind;
import com.diplomacy.service.BuildResolver;
import com.diplomacy.service.RetreatResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.diplomacy.TestGames.*;
import static org.junit.jupiter.api.Assertions.*;

class PhaseAnnouncerTest {

    private PhaseAnnouncer announcer;

    @BeforeEach
    void setUp() {
        announcer = new PhaseAnnouncer(new RetreatResolver(), new BuildResolver());
    }

    @Test
    @DisplayName("A move phase only shows its banner")
    void shouldAnnounceMovePhase() {
        assertEquals(List.of("Phase 1 move"), announcer.describePhase(initialState().edit().phase(1, PhaseKind.MOVE).build()));
    }

    @Test
    @DisplayName("A retreat phase lists the options of every dislodged unit")
    void shouldAnnounceRetreatOptions() {
        Dislodgement dislodged = new Dislodgement(part("BUR_L"), "FRA",
                part("RUH_L").territoryIndex(), Set.of(part("RUH_L").territoryIndex()));
        GameState state = board("GER BUR_L", "GER MUN_L").edit()
                .phase(2, PhaseKind.RETREAT)
                .dislodged(List.of(dislodged))
                .build();

        assertEquals(List.of("Phase 2 retreat", "FRA retreat BUR_L (PAR_L, PIC_L, BEL_L, GAS_L)"),
                announcer.describePhase(state));
    }

    @Test
    @DisplayName("A build phase lists builds and disbands per player")
    void shouldAnnounceAdjustments() {
        GameState state = board("ENG LON_C", "ENG EDI_C", "ENG LVP_L", "FRA PAR_L").edit()
                .setCenterOwner(sampleMap().findTerritory("LVP").orElseThrow(), null)
                .phase(3, PhaseKind.BUILD)
                .build();

        assertEquals(List.of("Phase 3 build", "ENG disband 1", "FRA build 1", "GER build 3"),
                announcer.describePhase(state));
    }

    @Test
    @DisplayName("Results list failures, standoffs, dislodgements and the winner")
    void shouldDescribeResult() {
        GameState finished = initialState().edit().status(GameStatus.FINISHED, "GER").build();
        PhaseReport report = PhaseReport.builder()
                .state(finished)
                .results(List.of(
                        new OrderResult(move("FRA", "PAR_L", "BUR_L"), false, "bounced"),
                        new OrderResult(move("GER", "KIE_C", "DEN_C"), true, "moved")))
                .standoffs(Set.of("BUR"))
                .build();

        assertEquals(List.of("FRA PAR_L M BUR_L (bounced)", "Standoff in BUR", "Winner GER"),
                announcer.describeResult(report));
    }

    @Test
    @DisplayName("A draw prints every share")
    void shouldDescribeDraw() {
        Map<String, Double> shares = new LinkedHashMap<>();
        shares.put("ENG", 0.5);
        shares.put("GER", 0.5);
        PhaseReport report = PhaseReport.builder()
                .state(initialState().edit().status(GameStatus.DRAWN, null).build())
                .drawShares(shares)
                .build();

        assertEquals(List.of("Draw ENG=0.500 GER=0.500"), announcer.describeResult(report));
    }

    @Test
    @DisplayName("The state lists units and centers per player")
    void shouldDescribeState() {
        List<String> lines = announcer.describeState(initialState());

        assertEquals("ENG units [LON_C EDI_C LVP_L] centers [LON EDI LVP]", lines.get(0));
        assertEquals(3, lines.size());
    }
}
