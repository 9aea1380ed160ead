package com.vikings.config;

import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads all available world definitions at startup.
 * <p>
 * Worlds are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:maps/*.json} – built-in worlds shipped with the app</li>
 *   <li>External folder: {@code ./maps/} next to the running jar – user-created worlds</li>
 * </ol>
 * If a custom world has the same {@code id} as a built-in one, the custom one wins. Files whose
 * region ids are not dense or whose neighbours point nowhere are rejected.
 */
@Component
@Slf4j
public class MapLoader {

    private final ObjectMapper objectMapper;

    /** All loaded worlds keyed by their id. */
    @Getter
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();

    public MapLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadMaps() {
        loadClasspathMaps();
        loadExternalMaps();

        if (maps.isEmpty()) {
            log.warn("No world definitions found! The AI has nothing to plan on without at least one map.");
        } else {
            log.info("Loaded {} world(s): {}", maps.size(),
                    maps.values().stream().map(MapDefinition::name).toList());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded world definition.
     */
    public List<MapDefinition> getAvailableMaps() {
        return List.copyOf(maps.values());
    }

    /**
     * Get a specific world by its id.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public MapDefinition getMap(String mapId) {
        MapDefinition map = maps.get(mapId);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + mapId
                    + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    /**
     * Checks that region ids are exactly {@code 0..n-1}, that neighbours and army positions refer
     * to existing regions, and that every region has a terrain and a level.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    static void validate(MapDefinition map) {
        List<RegionDefinition> regions = map.regions();
        boolean[] seen = new boolean[regions.size()];
        for (RegionDefinition region : regions) {
            if (region.id() < 0 || region.id() >= regions.size() || seen[region.id()]) {
                throw new IllegalArgumentException("Region ids must be dense and unique, offending id "
                        + region.id() + " in map " + map.id());
            }
            seen[region.id()] = true;
            if (region.terrain() == null || region.level() == null) {
                throw new IllegalArgumentException("Region " + region.id() + " lacks terrain or level");
            }
            if (region.neighbors() != null) {
                for (int neighbor : region.neighbors()) {
                    if (neighbor < 0 || neighbor >= regions.size() || neighbor == region.id()) {
                        throw new IllegalArgumentException("Region " + region.id()
                                + " has invalid neighbour " + neighbor);
                    }
                }
            }
        }
        for (ArmyDefinition army : map.armies()) {
            if (army.region() < 0 || army.region() >= regions.size()) {
                throw new IllegalArgumentException("Army " + army.id() + " stands on unknown region " + army.region());
            }
        }
    }

    // ── classpath maps ──────────────────────────────────────────────────

    private void loadClasspathMaps() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    MapDefinition map = objectMapper.readValue(is, MapDefinition.class);
                    validate(map);
                    maps.put(map.id(), map);
                    log.info("Loaded built-in world '{}' ({}) from classpath",
                            map.name(), map.id());
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to load classpath map: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for maps: {}", e.getMessage());
        }
    }

    // ── external maps (./maps/ folder) ──────────────────────────────────

    private void loadExternalMaps() {
        Path externalDir = Paths.get("maps");
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external maps directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalMapFile);
        } catch (IOException e) {
            log.error("Error reading external maps directory", e);
        }
    }

    private void loadExternalMapFile(Path path) {
        try {
            MapDefinition map = objectMapper.readValue(path.toFile(), MapDefinition.class);
            validate(map);
            maps.put(map.id(), map);
            log.info("Loaded custom world '{}' ({}) from {}", map.name(), map.id(), path);
        } catch (Exception e) {
            log.error("Failed to load custom map: {}", path, e);
        }
    }
}
