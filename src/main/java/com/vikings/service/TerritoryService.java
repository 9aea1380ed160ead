package com.vikings.service;

import com.vikings.model.Region;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read access to the world graph plus the one ownership mutation the AI performs.
 * Region ids are dense integers in {@code [0, regionCount())}.
 */
public interface TerritoryService {

    /** Enter cost of a region that cannot be entered at all. */
    int IMPASSABLE = Integer.MAX_VALUE;

    int regionCount();

    Region getRegion(int regionId);

    List<Integer> neighborRegions(int regionId);

    /**
     * @return owning player id, or {@code null} when the region is neutral
     */
    String regionOwner(int regionId);

    /**
     * Regions adjacent to any region the player owns that the player does not own itself.
     */
    Set<Integer> frontierRegions(String playerId);

    /**
     * Movement points {@code playerId} pays to enter the region: the terrain's cost, one less
     * (but at least 1) on the player's own land, or {@link #IMPASSABLE}.
     */
    int enterCost(int regionId, String playerId);

    /**
     * Stronghold owned by the player that is cheapest to reach from the region in movement points,
     * the region itself included.
     */
    OptionalInt nearestOwnedStronghold(int regionId, String playerId);

    boolean isStronghold(int regionId);

    void transferOwnership(int regionId, String playerId);
}
