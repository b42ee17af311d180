package com.diplomacy.config;

import com.diplomacy.exception.GameConfigurationException;
import com.diplomacy.model.BuildRule;
import com.diplomacy.model.ConvoyParadoxRule;
import com.diplomacy.model.DrawEligibility;
import com.diplomacy.model.DrawType;
import com.diplomacy.model.Rules;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads and validates the rules description at startup. Unknown enumerations and
 * out-of-range values are fatal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RulesLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final Validator validator;

    @Value("${diplomacy.rules-location:file:rules.json}")
    private String rulesLocation;

    @Getter
    private Rules rules;

    /** The rules file exactly as read, for {@code --rules} dumps. */
    @Getter
    private String rawJson;

    @PostConstruct
    public void loadRules() {
        Resource resource = resourceLoader.getResource(rulesLocation);
        if (!resource.exists()) {
            throw new GameConfigurationException("Rules file not found: " + rulesLocation);
        }
        try (InputStream is = resource.getInputStream()) {
            rawJson = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GameConfigurationException("Failed to read rules file: " + rulesLocation, e);
        }

        rules = parse(rawJson);
        log.info("Loaded rules from {}: {}", rulesLocation, rules);
    }

    /**
     * Parse and validate a rules description.
     *
     * @throws GameConfigurationException if the JSON is malformed or a value is invalid
     */
    public Rules parse(String json) {
        RulesDefinition definition;
        try {
            definition = objectMapper.readValue(json, RulesDefinition.class);
        } catch (JacksonException e) {
            throw new GameConfigurationException("Unparseable rules description: " + e.getMessage(), e);
        }
        if (definition == null) {
            throw new GameConfigurationException("Rules description is empty");
        }

        Set<ConstraintViolation<RulesDefinition>> violations = validator.validate(definition);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new GameConfigurationException("Invalid rules: " + details);
        }

        try {
            return new Rules(
                    definition.winCondition(),
                    BuildRule.fromKey(definition.buildRule()),
                    definition.buildTime(),
                    definition.voteShown() == 1,
                    DrawType.fromKey(definition.drawType()),
                    definition.convoyParadox() == null
                            ? ConvoyParadoxRule.SZYKMAN
                            : ConvoyParadoxRule.fromKey(definition.convoyParadox()),
                    definition.drawEligibility() == null
                            ? DrawEligibility.ACTIVE
                            : DrawEligibility.fromKey(definition.drawEligibility()));
        } catch (IllegalArgumentException e) {
            throw new GameConfigurationException(e.getMessage(), e);
        }
    }
}
