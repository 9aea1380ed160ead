package com.vikings.config;

import java.util.List;

/**
 * Root definition of a playable world, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "jutland"
 * @param name        human-readable name
 * @param description short description of the world
 * @param author      map author / credit
 * @param regions     every region, ids dense from 0
 * @param armies      armies placed at game start
 */
public record MapDefinition(
        String id,
        String name,
        String description,
        String author,
        List<RegionDefinition> regions,
        List<ArmyDefinition> armies
) {

    public List<RegionDefinition> regions() {
        return regions != null ? regions : List.of();
    }

    public List<ArmyDefinition> armies() {
        return armies != null ? armies : List.of();
    }
}
