package com.diplomacy.model;

/**
 * Kind of a territory sub-part. Land parts hold armies, coast parts hold fleets.
 */
public enum PartKind {
    LAND,
    COAST;

    /**
     * Derive the kind from a part identifier suffix: {@code _L} is land,
     * any suffix ending in {@code C} ({@code _C}, {@code _NC}, {@code _SC}) is coast.
     */
    public static PartKind fromPartId(String partId) {
        int separator = partId.lastIndexOf('_');
        if (separator < 0 || separator == partId.length() - 1) {
            throw new IllegalArgumentException("Part id has no kind suffix: " + partId);
        }
        String suffix = partId.substring(separator + 1);
        if (suffix.equals("L")) {
            return LAND;
        }
        if (suffix.endsWith("C")) {
            return COAST;
        }
        throw new IllegalArgumentException("Unknown part suffix '" + suffix + "' in " + partId);
    }
}
