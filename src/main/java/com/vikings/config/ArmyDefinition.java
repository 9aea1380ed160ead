package com.vikings.config;

/**
 * An army placed on the world at game start.
 *
 * @param id             stable id
 * @param name           display name
 * @param player         owning player id
 * @param region         starting region id
 * @param movementPoints movement points per turn
 * @param strength       full-strength head count
 */
public record ArmyDefinition(
        String id,
        String name,
        String player,
        int region,
        int movementPoints,
        int strength
) {}
