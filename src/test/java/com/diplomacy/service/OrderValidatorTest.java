package com.diplomacy.service;

import com.diplomacy.dto.RejectedOrder;
import com.diplomacy.dto.ValidationResult;
import com.diplomacy.model.Dislodgement;
import com.diplomacy.model.GameState;
import com.diplomacy.model.Order;
import com.diplomacy.model.PhaseKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.diplomacy.TestGames.*;
import static org.junit.jupiter.api.Assertions.*;

class OrderValidatorTest {

    private OrderValidator orderValidator;

    @BeforeEach
    void setUp() {
        orderValidator = new OrderValidator(new RetreatResolver(), new BuildResolver());
    }

    private ValidationResult validate(GameState state, Order... orders) {
        return orderValidator.validate(state, standardRules(), List.of(orders));
    }

    private String singleRejection(GameState state, Order order) {
        ValidationResult result = validate(state, order);
        assertTrue(result.getAccepted().isEmpty(), "order should be rejected: " + order.toNotation());
        assertEquals(1, result.getRejected().size());
        return result.getRejected().get(0).reason();
    }

    @Nested
    @DisplayName("Move phase")
    class MovePhase {

        @Test
        @DisplayName("Accepts a move to an adjacent part")
        void shouldAcceptAdjacentMove() {
            ValidationResult result = validate(initialState(), move("ENG", "LON_C", "NTH_C"));

            assertEquals(1, result.getAccepted().size());
            assertTrue(result.getRejected().isEmpty());
        }

        @Test
        @DisplayName("Rejects orders for another player's unit")
        void shouldRejectForeignUnit() {
            assertEquals("unit on LON_C belongs to ENG",
                    singleRejection(initialState(), move("FRA", "LON_C", "NTH_C")));
        }

        @Test
        @DisplayName("Rejects orders for an empty part")
        void shouldRejectEmptyPart() {
            assertEquals("no unit on YOR_L", singleRejection(initialState(), move("ENG", "YOR_L", "LON_L")));
        }

        @Test
        @DisplayName("Rejects orders from unknown players")
        void shouldRejectUnknownPlayer() {
            assertEquals("unknown player", singleRejection(initialState(), hold("ITA", "LON_C")));
        }

        @Test
        @DisplayName("Rejects fleet moves to parts that are not adjacent")
        void shouldRejectDistantFleetMove() {
            assertEquals("LON_C is not adjacent to BEL_C",
                    singleRejection(initialState(), move("ENG", "LON_C", "BEL_C")));
        }

        @Test
        @DisplayName("Rejects an army moving onto a coast")
        void shouldRejectArmyToCoast() {
            assertEquals("an army cannot move to PIC_C",
                    singleRejection(initialState(), move("FRA", "PAR_L", "PIC_C")));
        }

        @Test
        @DisplayName("Rejects build orders in a move phase")
        void shouldRejectWrongPhase() {
            assertEquals("build not allowed in a move phase",
                    singleRejection(initialState(), build("FRA", "PAR_L")));
        }

        @Test
        @DisplayName("A second order for the same unit is rejected")
        void shouldRejectDuplicateOrder() {
            ValidationResult result = validate(initialState(),
                    move("ENG", "LON_C", "NTH_C"),
                    hold("ENG", "LON_C"));

            assertEquals(1, result.getAccepted().size());
            assertEquals("duplicate order for LON_C", result.getRejected().get(0).reason());
        }

        @Test
        @DisplayName("A rejected order does not affect the other orders")
        void shouldKeepValidOrdersBesideRejectedOnes() {
            ValidationResult result = validate(initialState(),
                    move("ENG", "LON_C", "BEL_C"),
                    move("ENG", "EDI_C", "NWG_C"),
                    move("FRA", "PAR_L", "BUR_L"));

            assertEquals(2, result.getAccepted().size());
            RejectedOrder rejected = result.getRejected().get(0);
            assertEquals("Rejected ENG LON_C M BEL_C: LON_C is not adjacent to BEL_C", rejected.format());
        }
    }

    @Nested
    @DisplayName("Supports and convoys")
    class SupportsAndConvoys {

        @Test
        @DisplayName("Accepts a support for a move into a reachable territory")
        void shouldAcceptSupportMove() {
            GameState state = board("FRA PAR_L", "FRA PIC_L");

            ValidationResult result = validate(state,
                    move("FRA", "PAR_L", "BUR_L"),
                    supportMove("FRA", "PIC_L", "BUR_L", "PAR_L"));

            assertEquals(2, result.getAccepted().size());
        }

        @Test
        @DisplayName("Rejects a support into a territory the supporter cannot reach")
        void shouldRejectUnreachableSupport() {
            GameState state = board("FRA PAR_L", "ENG LON_C");

            assertEquals("PAR_L cannot reach LON", singleRejection(state, supportHold("FRA", "PAR_L", "LON_C")));
        }

        @Test
        @DisplayName("Rejects a support for an empty territory")
        void shouldRejectSupportForNobody() {
            GameState state = board("ENG LON_C");

            assertEquals("no unit to support in YOR", singleRejection(state, supportHold("ENG", "LON_C", "YOR_C")));
        }

        @Test
        @DisplayName("Accepts a convoyed move when the convoy chain is ordered")
        void shouldAcceptConvoyedMove() {
            GameState state = board("ENG LON_L", "ENG NTH_C");

            ValidationResult result = validate(state,
                    move("ENG", "LON_L", "BEL_L"),
                    convoy("ENG", "NTH_C", "BEL_L", "LON_L"));

            assertEquals(2, result.getAccepted().size());
        }

        @Test
        @DisplayName("Rejects a convoyed move without a convoy chain")
        void shouldRejectMoveWithoutConvoy() {
            GameState state = board("ENG LON_L", "ENG NTH_C");

            assertEquals("no convoy chain from LON_L to BEL_L",
                    singleRejection(state, move("ENG", "LON_L", "BEL_L")));
        }

        @Test
        @DisplayName("Another player's fleet may convoy the army")
        void shouldAcceptForeignConvoy() {
            GameState state = board("ENG LON_L", "FRA NTH_C");

            ValidationResult result = validate(state,
                    moveViaConvoy("ENG", "LON_L", "BEL_L"),
                    convoy("FRA", "NTH_C", "BEL_L", "LON_L"));

            assertEquals(2, result.getAccepted().size());
        }

        @Test
        @DisplayName("Only fleets at sea can convoy")
        void shouldRejectCoastalConvoy() {
            GameState state = board("ENG LON_L", "ENG YOR_C");

            assertEquals("only fleets at sea can convoy",
                    singleRejection(state, convoy("ENG", "YOR_C", "EDI_L", "LON_L")));
        }
    }

    @Nested
    @DisplayName("Retreat phase")
    class RetreatPhase {

        private GameState state;

        @BeforeEach
        void setUp() {
            Dislodgement dislodged = new Dislodgement(part("BUR_L"), "GER",
                    part("PAR_L").territoryIndex(), Set.of(part("PAR_L").territoryIndex()));
            state = board("FRA BUR_L").edit()
                    .phase(2, PhaseKind.RETREAT)
                    .dislodged(List.of(dislodged))
                    .build();
        }

        @Test
        @DisplayName("Accepts a retreat to a free neighbor")
        void shouldAcceptRetreat() {
            assertEquals(1, validate(state, retreat("GER", "BUR_L", "MUN_L")).getAccepted().size());
        }

        @Test
        @DisplayName("Accepts a disband of a dislodged unit")
        void shouldAcceptDisband() {
            assertEquals(1, validate(state, disband("GER", "BUR_L")).getAccepted().size());
        }

        @Test
        @DisplayName("Rejects a retreat toward the attacker's origin")
        void shouldRejectForbiddenRetreat() {
            assertEquals("cannot retreat to PAR_L", singleRejection(state, retreat("GER", "BUR_L", "PAR_L")));
        }

        @Test
        @DisplayName("Rejects retreat orders from other players")
        void shouldRejectForeignRetreat() {
            assertEquals("dislodged unit on BUR_L belongs to GER",
                    singleRejection(state, retreat("FRA", "BUR_L", "MUN_L")));
        }

        @Test
        @DisplayName("Rejects retreats of units that were not dislodged")
        void shouldRejectRetreatOfUndislodgedUnit() {
            assertEquals("no dislodged unit on PAR_L", singleRejection(state, retreat("FRA", "PAR_L", "GAS_L")));
        }
    }

    @Nested
    @DisplayName("Build phase")
    class BuildPhase {

        private GameState state;

        @BeforeEach
        void setUp() {
            // France: 2 centers, no units; Germany: 1 center, 2 units
            state = board("GER BER_L", "GER KIE_C").edit()
                    .setCenterOwner(sampleMap().findTerritory("KIE").orElseThrow(), null)
                    .setCenterOwner(sampleMap().findTerritory("BER").orElseThrow(), null)
                    .phase(3, PhaseKind.BUILD)
                    .build();
        }

        @Test
        @DisplayName("Accepts a build on an empty home center")
        void shouldAcceptBuild() {
            assertEquals(1, validate(state, build("FRA", "BRE_C")).getAccepted().size());
        }

        @Test
        @DisplayName("Rejects a build outside the home centers")
        void shouldRejectBuildOnForeignCenter() {
            assertEquals("SPA_L is not an eligible build location", singleRejection(state, build("FRA", "SPA_L")));
        }

        @Test
        @DisplayName("Rejects builds from a player who owes disbands")
        void shouldRejectBuildWhenShort() {
            assertEquals("no builds available", singleRejection(state, build("GER", "MUN_L")));
        }

        @Test
        @DisplayName("Accepts a disband from a player who owes one")
        void shouldAcceptDisband() {
            assertEquals(1, validate(state, disband("GER", "BER_L")).getAccepted().size());
        }

        @Test
        @DisplayName("Rejects disbands from a player who owes none")
        void shouldRejectUnneededDisband() {
            GameState withFrench = state.edit().placeUnit(part("PAR_L"), "FRA").build();

            assertEquals("no disbands required", singleRejection(withFrench, disband("FRA", "PAR_L")));
        }
    }
}
