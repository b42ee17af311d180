package com.diplomacy.model;

/**
 * A sub-part of a territory (its land area or one of its coasts).
 *
 * @param index          stable index into {@link MapGraph#getParts()}
 * @param id             part identifier, e.g. "LON_C"
 * @param kind           land or coast
 * @param territoryIndex index of the owning territory in {@link MapGraph#getTerritories()}
 */
public record Part(int index, String id, PartKind kind, int territoryIndex) {

    public boolean isCoast() {
        return kind == PartKind.COAST;
    }

    @Override
    public String toString() {
        return id;
    }
}
