package com.vikings.config;

import com.vikings.model.RegionLevel;
import com.vikings.model.ResourceType;
import com.vikings.model.Terrain;

import java.util.List;
import java.util.Map;

/**
 * A single region of the world.
 *
 * @param id         dense region id, 0-based
 * @param key        unique key, e.g. "HEDEBY"
 * @param name       display name
 * @param terrain    terrain archetype, decides the enter cost
 * @param level      administrative tier
 * @param population inhabitants
 * @param resources  yearly yield per resource
 * @param owner      owning player id, absent for neutral regions
 * @param garrison   defenders stationed there
 * @param stronghold whether armies can be reinforced there
 * @param neighbors  ids of adjacent regions
 */
public record RegionDefinition(
        int id,
        String key,
        String name,
        Terrain terrain,
        RegionLevel level,
        int population,
        Map<ResourceType, Integer> resources,
        String owner,
        int garrison,
        boolean stronghold,
        List<Integer> neighbors
) {}
