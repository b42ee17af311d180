package com.diplomacy.model;

import java.util.Set;

/**
 * A unit forced out of its part during a move phase, waiting for the retreat phase.
 *
 * @param part                  the part the unit was dislodged from
 * @param player                owner of the unit
 * @param attackerOrigin        territory index the successful attack came from
 * @param forbiddenTerritories  territory indexes the unit may not retreat to
 */
public record Dislodgement(Part part, String player, int attackerOrigin, Set<Integer> forbiddenTerritories) {

    public Dislodgement {
        forbiddenTerritories = Set.copyOf(forbiddenTerritories);
    }

    public boolean forbids(Territory territory) {
        return forbiddenTerritories.contains(territory.index());
    }

    public UnitType unitType() {
        return UnitType.on(part);
    }
}
