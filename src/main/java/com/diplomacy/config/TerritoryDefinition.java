package com.diplomacy.config;

import java.util.List;
import java.util.Map;

/**
 * A single territory entry of the map description.
 *
 * @param id         territory identifier, e.g. "LON"
 * @param parts      part identifier to listed neighbor identifiers, e.g. "LON_C" to ["YOR", "NTH"]
 * @param center     whether the territory is a supply center
 * @param initPlayer player owning the territory at game start, or null
 * @param initPart   part holding the starting unit, or null
 */
public record TerritoryDefinition(
        String id,
        Map<String, List<String>> parts,
        boolean center,
        String initPlayer,
        String initPart
) {}
