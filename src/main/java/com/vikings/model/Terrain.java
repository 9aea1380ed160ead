package com.vikings.model;

/**
 * Terrain archetypes and the movement points it costs to enter them.
 */
public enum Terrain {
    PLAINS(2, true),
    FOREST(3, true),
    HILLS(4, true),
    MARSH(4, true),
    MOUNTAINS(6, true),
    SEA(0, false);

    private final int baseEnterCost;
    private final boolean passable;

    Terrain(int baseEnterCost, boolean passable) {
        this.baseEnterCost = baseEnterCost;
        this.passable = passable;
    }

    public int getBaseEnterCost() {
        return baseEnterCost;
    }

    public boolean isPassable() {
        return passable;
    }
}
