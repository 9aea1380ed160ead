package com.vikings.service;

import com.vikings.config.MapDefinition;
import com.vikings.config.MapLoader;
import com.vikings.config.RegionDefinition;
import com.vikings.cpu.path.MinHeap;
import com.vikings.model.Region;
import com.vikings.model.ResourceType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory world graph built from the active map definition.
 */
@Service
@Slf4j
public class WorldService implements TerritoryService {

    private final MapLoader mapLoader;
    private final String mapId;

    private Region[] regions = new Region[0];

    public WorldService(MapLoader mapLoader, @Value("${game.world.map-id:jutland}") String mapId) {
        this.mapLoader = mapLoader;
        this.mapId = mapId;
    }

    @PostConstruct
    public void init() {
        if (!mapLoader.getMaps().containsKey(mapId)) {
            log.warn("World '{}' not found, starting with an empty world", mapId);
            return;
        }
        loadWorld(mapLoader.getMap(mapId));
    }

    /**
     * Replaces the current world. Adjacency is made symmetric, so a neighbour listed on one side
     * only still connects both regions.
     */
    public void loadWorld(MapDefinition map) {
        List<RegionDefinition> definitions = map.regions();
        Region[] loaded = new Region[definitions.size()];
        for (RegionDefinition def : definitions) {
            Map<ResourceType, Integer> resources = new EnumMap<>(ResourceType.class);
            if (def.resources() != null) {
                resources.putAll(def.resources());
            }
            loaded[def.id()] = Region.builder()
                    .id(def.id())
                    .key(def.key())
                    .name(def.name())
                    .terrain(def.terrain())
                    .level(def.level())
                    .population(def.population())
                    .resources(resources)
                    .ownerId(def.owner())
                    .garrison(def.garrison())
                    .stronghold(def.stronghold())
                    .neighborIds(new TreeSet<>())
                    .build();
        }
        for (RegionDefinition def : definitions) {
            if (def.neighbors() == null) {
                continue;
            }
            for (int neighbor : def.neighbors()) {
                loaded[def.id()].getNeighborIds().add(neighbor);
                loaded[neighbor].getNeighborIds().add(def.id());
            }
        }
        this.regions = loaded;
        log.info("World '{}' ready with {} regions", map.name(), loaded.length);
    }

    @Override
    public int regionCount() {
        return regions.length;
    }

    @Override
    public Region getRegion(int regionId) {
        if (regionId < 0 || regionId >= regions.length) {
            throw new IllegalArgumentException("Unknown region: " + regionId);
        }
        return regions[regionId];
    }

    public List<Region> getRegions() {
        return List.of(regions);
    }

    @Override
    public List<Integer> neighborRegions(int regionId) {
        return List.copyOf(getRegion(regionId).getNeighborIds());
    }

    @Override
    public String regionOwner(int regionId) {
        return getRegion(regionId).getOwnerId();
    }

    @Override
    public Set<Integer> frontierRegions(String playerId) {
        Set<Integer> frontier = new TreeSet<>();
        for (Region region : regions) {
            if (!region.isOwnedBy(playerId)) {
                continue;
            }
            for (int neighbor : region.getNeighborIds()) {
                if (!regions[neighbor].isOwnedBy(playerId)) {
                    frontier.add(neighbor);
                }
            }
        }
        return Collections.unmodifiableSet(frontier);
    }

    @Override
    public int enterCost(int regionId, String playerId) {
        Region region = getRegion(regionId);
        if (!region.getTerrain().isPassable()) {
            return IMPASSABLE;
        }
        int cost = region.getTerrain().getBaseEnterCost();
        if (region.isOwnedBy(playerId) && cost > 1) {
            cost = Math.max(1, cost - 1);
        }
        return cost;
    }

    /**
     * Cheapest owned stronghold by the movement points the player would pay to get there, the
     * same cost the detour is later routed by. Among strongholds at the same cost the lowest id
     * wins.
     */
    @Override
    public OptionalInt nearestOwnedStronghold(int regionId, String playerId) {
        getRegion(regionId);
        int[] cost = new int[regions.length];
        Arrays.fill(cost, IMPASSABLE);
        boolean[] settled = new boolean[regions.length];
        MinHeap<Integer> open = new MinHeap<>(regions.length);
        cost[regionId] = 0;
        open.insert(regionId, 0);

        int best = -1;
        while (!open.isEmpty()) {
            MinHeap.Entry<Integer> entry = open.extractMin();
            int current = entry.item();
            if (settled[current]) {
                continue;
            }
            if (best >= 0 && entry.key() > cost[best]) {
                break;
            }
            settled[current] = true;
            Region region = regions[current];
            if (region.isStronghold() && region.isOwnedBy(playerId) && (best < 0 || current < best)) {
                best = current;
            }
            for (int neighbor : region.getNeighborIds()) {
                int enter = enterCost(neighbor, playerId);
                if (settled[neighbor] || enter == IMPASSABLE) {
                    continue;
                }
                long candidate = (long) cost[current] + enter;
                if (candidate < cost[neighbor]) {
                    cost[neighbor] = (int) candidate;
                    open.insert(neighbor, cost[neighbor]);
                }
            }
        }
        return best >= 0 ? OptionalInt.of(best) : OptionalInt.empty();
    }

    @Override
    public boolean isStronghold(int regionId) {
        return getRegion(regionId).isStronghold();
    }

    @Override
    public void transferOwnership(int regionId, String playerId) {
        Region region = getRegion(regionId);
        log.info("Region {} ({}) passes from {} to {}", region.getName(), regionId,
                region.isNeutral() ? "neutral" : region.getOwnerId(), playerId);
        region.setOwnerId(playerId);
        region.setGarrison(0);
    }

    /**
     * Ids of all regions the player owns, ascending.
     */
    public List<Integer> regionsOwnedBy(String playerId) {
        return Arrays.stream(regions)
                .filter(r -> r.isOwnedBy(playerId))
                .map(Region::getId)
                .toList();
    }
}
