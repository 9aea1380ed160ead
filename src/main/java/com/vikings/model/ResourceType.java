package com.vikings.model;

/**
 * Resources a region yields. {@link #GOLD} is the treasury resource, the rest are primary.
 */
public enum ResourceType {
    FOOD,
    WOOD,
    IRON,
    STONE,
    GOLD;

    public boolean isTreasury() {
        return this == GOLD;
    }
}
