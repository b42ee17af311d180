package com.diplomacy.model;

/**
 * Unit types. The type follows from the kind of part the unit stands on.
 */
public enum UnitType {
    ARMY,
    FLEET;

    public static UnitType on(Part part) {
        return part.kind() == PartKind.LAND ? ARMY : FLEET;
    }
}
