package com.diplomacy.model;

import java.util.List;

/**
 * A registered player. Units and centers are not stored here: they are read off
 * the {@link GameState} arrays, so counts always match occupancy.
 *
 * @param index       stable index into {@link GameState#getPlayers()}
 * @param name        player name, e.g. "ENG"
 * @param homeCenters indexes of the supply centers the player started with
 */
public record PlayerState(int index, String name, List<Integer> homeCenters) {

    public PlayerState {
        homeCenters = List.copyOf(homeCenters);
    }

    public boolean isHomeCenter(Territory territory) {
        return homeCenters.contains(territory.index());
    }
}
