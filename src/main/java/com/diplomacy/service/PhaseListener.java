package com.diplomacy.service;

import com.diplomacy.dto.PhaseReport;
import com.diplomacy.model.GameState;

/**
 * Notified by the {@link GameSession} as phases open and resolve.
 */
public interface PhaseListener {

    void phaseOpened(GameState state);

    void phaseResolved(PhaseReport report);
}
