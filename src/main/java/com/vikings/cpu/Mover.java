package com.vikings.cpu;

/**
 * Anything the AI can move across the world graph.
 */
public interface Mover {

    /**
     * Stable identifier; seeds jitter, so it must not change between turns.
     */
    String getId();

    String getName();

    String getPlayerId();

    int getRegionId();

    int getMovementPoints();

    void spendMovementPoints(int cost);

    void relocateTo(int regionId);
}
