package com.diplomacy.config;

import java.util.List;

/**
 * Root definition of a playable map, parsed from the map JSON file.
 *
 * @param territories territory entries in file order
 */
public record MapDefinition(List<TerritoryDefinition> territories) {

    public MapDefinition {
        territories = List.copyOf(territories);
    }
}
