package com.vikings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A node of the world graph: the atomic unit of ownership and terrain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Region {

    private int id;

    private String key;

    private String name;

    @Builder.Default
    private Terrain terrain = Terrain.PLAINS;

    @Builder.Default
    private RegionLevel level = RegionLevel.HAMLET;

    private int population;

    @Builder.Default
    private Map<ResourceType, Integer> resources = new EnumMap<>(ResourceType.class);

    /** Owning player id, {@code null} when neutral. */
    private String ownerId;

    /** Defenders stationed in the region. */
    private int garrison;

    private boolean stronghold;

    @Builder.Default
    private Set<Integer> neighborIds = new LinkedHashSet<>();

    public boolean isNeutral() {
        return ownerId == null;
    }

    public boolean isOwnedBy(String playerId) {
        return ownerId != null && ownerId.equals(playerId);
    }

    public boolean hasDefenders() {
        return garrison > 0;
    }

    public int resourceAmount(ResourceType type) {
        return resources.getOrDefault(type, 0);
    }
}
