package com.diplomacy.model;

/**
 * Represents the current status of a game.
 */
public enum GameStatus {
    IN_PROGRESS,
    FINISHED,       // A player reached the win condition
    DRAWN           // All eligible players voted for a draw
}
