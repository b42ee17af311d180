package com.diplomacy.model;

import java.util.List;

/**
 * A territory (province) on the map.
 *
 * @param index        stable index into {@link MapGraph#getTerritories()}
 * @param id           territory identifier, e.g. "LON"
 * @param supplyCenter whether the territory is a supply center
 * @param partIndexes  indexes of the parts this territory owns
 * @param initPlayer   player controlling the territory at game start, or null
 * @param initPart     part holding that player's starting unit, or null
 */
public record Territory(
        int index,
        String id,
        boolean supplyCenter,
        List<Integer> partIndexes,
        String initPlayer,
        String initPart
) {

    public Territory {
        partIndexes = List.copyOf(partIndexes);
    }

    @Override
    public String toString() {
        return id;
    }
}
