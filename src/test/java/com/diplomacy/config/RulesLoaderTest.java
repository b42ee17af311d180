package com.diplomacy.config;

import com.diplomacy.exception.GameConfigurationException;
import com.diplomacy.model.BuildRule;
import com.diplomacy.model.ConvoyParadoxRule;
import com.diplomacy.model.DrawEligibility;
import com.diplomacy.model.DrawType;
import com.diplomacy.model.PhaseKind;
import com.diplomacy.model.Rules;
import jakarta.validation.Validation;
import tools.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RulesLoader.
 */
class RulesLoaderTest {

    private RulesLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RulesLoader(new ObjectMapper(), new DefaultResourceLoader(),
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    @DisplayName("loadRules() should read the shipped standard rules with defaults")
    void shouldLoadStandardRules() {
        ReflectionTestUtils.setField(loader, "rulesLocation", "classpath:rules/standard.json");
        loader.loadRules();

        Rules rules = loader.getRules();
        assertEquals(8, rules.winCondition());
        assertEquals(BuildRule.INIT_CENTERS, rules.buildRule());
        assertEquals(3, rules.buildTime());
        assertTrue(rules.voteShown());
        assertEquals(DrawType.DSS, rules.drawType());
        assertEquals(ConvoyParadoxRule.SZYKMAN, rules.convoyParadox());
        assertEquals(DrawEligibility.ACTIVE, rules.drawEligibility());
    }

    @Test
    @DisplayName("optional policies are read when present")
    void shouldReadOptionalPolicies() {
        Rules rules = loader.parse("""
                { "winCondition": 10, "buildRule": "allCenters", "buildTime": 2, "voteShown": 0,
                  "drawType": "SoS", "convoyParadox": "allHold", "drawEligibility": "all" }
                """);

        assertEquals(BuildRule.ALL_CENTERS, rules.buildRule());
        assertFalse(rules.voteShown());
        assertEquals(DrawType.SOS, rules.drawType());
        assertEquals(ConvoyParadoxRule.ALL_HOLD, rules.convoyParadox());
        assertEquals(DrawEligibility.ALL, rules.drawEligibility());
    }

    @Test
    @DisplayName("every buildTime-th phase is a build phase")
    void shouldScheduleBuildPhases() {
        Rules rules = loader.parse("""
                { "winCondition": 8, "buildRule": "initCenters", "buildTime": 3, "voteShown": 1, "drawType": "DSS" }
                """);

        assertEquals(PhaseKind.MOVE, rules.kindOfPhase(1));
        assertEquals(PhaseKind.MOVE, rules.kindOfPhase(2));
        assertEquals(PhaseKind.BUILD, rules.kindOfPhase(3));
        assertEquals(PhaseKind.BUILD, rules.kindOfPhase(6));
    }

    @Test
    @DisplayName("missing and out-of-range values are reported together")
    void shouldRejectInvalidValues() {
        GameConfigurationException ex = assertThrows(GameConfigurationException.class, () -> loader.parse("""
                { "winCondition": 0, "buildRule": "initCenters", "voteShown": 2, "drawType": "DSS" }
                """));

        assertTrue(ex.getMessage().startsWith("Invalid rules: "));
        assertTrue(ex.getMessage().contains("buildTime"));
        assertTrue(ex.getMessage().contains("voteShown"));
        assertTrue(ex.getMessage().contains("winCondition"));
    }

    @Test
    @DisplayName("unknown enumeration keys are fatal")
    void shouldRejectUnknownKeys() {
        GameConfigurationException ex = assertThrows(GameConfigurationException.class, () -> loader.parse("""
                { "winCondition": 8, "buildRule": "anywhere", "buildTime": 3, "voteShown": 1, "drawType": "DSS" }
                """));

        assertEquals("Unknown build rule: anywhere", ex.getMessage());
    }

    @Test
    @DisplayName("a missing rules file is fatal")
    void shouldFailOnMissingFile() {
        ReflectionTestUtils.setField(loader, "rulesLocation", "classpath:rules/absent.json");

        assertThrows(GameConfigurationException.class, () -> loader.loadRules());
    }
}
