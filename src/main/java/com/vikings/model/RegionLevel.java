package com.vikings.model;

/**
 * Administrative tier of a region, from a bare hamlet up to a capital.
 */
public enum RegionLevel {
    HAMLET,
    VILLAGE,
    TOWN,
    CITY,
    CAPITAL;

    /**
     * Ordinal tier in 1..5.
     */
    public int tier() {
        return ordinal() + 1;
    }
}
