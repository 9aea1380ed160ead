package com.vikings.config;

import com.vikings.model.RegionLevel;
import com.vikings.model.Terrain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;

import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MapLoader: classpath and external world loading, plus structural validation.
 */
class MapLoaderTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    private static RegionDefinition region(int id, List<Integer> neighbors) {
        return new RegionDefinition(id, "R" + id, "Region " + id, Terrain.PLAINS, RegionLevel.HAMLET, 10,
                Map.of(), null, 0, false, neighbors);
    }

    // ── getMap / getAvailableMaps ────────────────────────────────────────

    @Test
    @DisplayName("loadMaps() should load the built-in Jutland world")
    void shouldLoadClasspathMaps() {
        MapLoader loader = new MapLoader(objectMapper);
        loader.loadMaps();

        MapDefinition jutland = loader.getMap("jutland");

        assertEquals(12, jutland.regions().size());
        assertEquals(3, jutland.armies().size());
        assertEquals(Terrain.SEA, jutland.regions().get(7).terrain());
    }

    @Test
    @DisplayName("getAvailableMaps() should return an unmodifiable list")
    void shouldReturnAvailableMaps() {
        MapLoader loader = new MapLoader(objectMapper);
        loader.loadMaps();

        List<MapDefinition> maps = loader.getAvailableMaps();

        assertFalse(maps.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> maps.add(null));
    }

    @Test
    @DisplayName("getMap() should name the available worlds when the id is unknown")
    void shouldThrowForUnknownMapId() {
        MapLoader loader = new MapLoader(objectMapper);
        loader.loadMaps();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> loader.getMap("atlantis"));

        assertTrue(ex.getMessage().contains("atlantis"));
        assertTrue(ex.getMessage().contains("jutland"));
    }

    // ── external maps ───────────────────────────────────────────────────

    @Test
    @DisplayName("loadExternalMapFile() should override a built-in world with the same id")
    void shouldOverrideBuiltInWorld(@TempDir Path tempDir) throws Exception {
        String json = """
                {
                  "id": "jutland",
                  "name": "Tiny Jutland",
                  "regions": [
                    { "id": 0, "key": "RIBE", "name": "Ribe", "terrain": "PLAINS", "level": "TOWN",
                      "population": 100, "owner": "norse", "garrison": 2, "stronghold": true, "neighbors": [1] },
                    { "id": 1, "key": "HEDEBY", "name": "Hedeby", "terrain": "MARSH", "level": "CITY",
                      "population": 300, "garrison": 0, "stronghold": false, "neighbors": [0] }
                  ]
                }
                """;
        Path file = tempDir.resolve("jutland.json");
        Files.writeString(file, json);

        MapLoader loader = new MapLoader(objectMapper);
        loader.loadMaps();

        Method method = MapLoader.class.getDeclaredMethod("loadExternalMapFile", Path.class);
        method.setAccessible(true);
        method.invoke(loader, file);

        MapDefinition loaded = loader.getMap("jutland");
        assertEquals("Tiny Jutland", loaded.name());
        assertEquals(2, loaded.regions().size());
        assertTrue(loaded.armies().isEmpty());
    }

    @Test
    @DisplayName("loadExternalMapFile() should skip malformed and invalid files")
    void shouldSkipBadExternalFiles(@TempDir Path tempDir) throws Exception {
        Path malformed = tempDir.resolve("bad.json");
        Files.writeString(malformed, "{ not json ]");
        Path invalid = tempDir.resolve("gap.json");
        Files.writeString(invalid, """
                { "id": "gap", "name": "Gap",
                  "regions": [ { "id": 1, "terrain": "PLAINS", "level": "HAMLET" } ] }
                """);

        MapLoader loader = new MapLoader(objectMapper);
        Method method = MapLoader.class.getDeclaredMethod("loadExternalMapFile", Path.class);
        method.setAccessible(true);

        assertDoesNotThrow(() -> method.invoke(loader, malformed));
        assertDoesNotThrow(() -> method.invoke(loader, invalid));
        assertTrue(loader.getMaps().isEmpty());
    }

    @Test
    @DisplayName("loadMaps() should pick up JSON files from the ./maps directory")
    void shouldLoadExternalMapsFromCwd() throws Exception {
        Path mapsDir = Paths.get("maps");
        Files.createDirectories(mapsDir);
        Path mapFile = mapsDir.resolve("cwd-world.json");
        Path notes = mapsDir.resolve("notes.txt");

        try {
            Files.writeString(mapFile, """
                    { "id": "cwd-world", "name": "CWD World",
                      "regions": [ { "id": 0, "key": "A", "name": "A", "terrain": "FOREST", "level": "HAMLET",
                                     "population": 20, "garrison": 0, "stronghold": false } ] }
                    """);
            Files.writeString(notes, "not a map");

            MapLoader loader = new MapLoader(objectMapper);
            loader.loadMaps();

            assertEquals("CWD World", loader.getMap("cwd-world").name());
            assertNotNull(loader.getMap("jutland"));
            assertFalse(loader.getMaps().containsKey("notes"));
        } finally {
            Files.deleteIfExists(mapFile);
            Files.deleteIfExists(notes);
            Files.deleteIfExists(mapsDir);
        }
    }

    // ── validation ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("validate()")
    class ValidateTests {

        @Test
        @DisplayName("should accept a well-formed world")
        void shouldAcceptValidWorld() {
            MapDefinition map = new MapDefinition("ok", "OK", null, null,
                    List.of(region(0, List.of(1)), region(1, List.of(0))),
                    List.of(new ArmyDefinition("a", "A", "norse", 1, 5, 10)));

            assertDoesNotThrow(() -> MapLoader.validate(map));
        }

        @Test
        @DisplayName("should reject gaps and duplicates in region ids")
        void shouldRejectNonDenseIds() {
            MapDefinition gap = new MapDefinition("gap", "Gap", null, null,
                    List.of(region(0, null), region(2, null)), null);
            MapDefinition duplicate = new MapDefinition("dup", "Dup", null, null,
                    List.of(region(0, null), region(0, null)), null);

            assertThrows(IllegalArgumentException.class, () -> MapLoader.validate(gap));
            assertThrows(IllegalArgumentException.class, () -> MapLoader.validate(duplicate));
        }

        @Test
        @DisplayName("should reject dangling neighbours and self-loops")
        void shouldRejectBadNeighbors() {
            MapDefinition dangling = new MapDefinition("d", "D", null, null,
                    List.of(region(0, List.of(5))), null);
            MapDefinition selfLoop = new MapDefinition("s", "S", null, null,
                    List.of(region(0, List.of(0))), null);

            assertThrows(IllegalArgumentException.class, () -> MapLoader.validate(dangling));
            assertThrows(IllegalArgumentException.class, () -> MapLoader.validate(selfLoop));
        }

        @Test
        @DisplayName("should reject regions without terrain and armies off the map")
        void shouldRejectMissingTerrainAndStrayArmies() {
            MapDefinition noTerrain = new MapDefinition("t", "T", null, null,
                    List.of(new RegionDefinition(0, "A", "A", null, RegionLevel.HAMLET, 0, null, null, 0, false, null)),
                    null);
            MapDefinition strayArmy = new MapDefinition("a", "A", null, null,
                    List.of(region(0, null)),
                    List.of(new ArmyDefinition("x", "X", "norse", 3, 5, 10)));

            assertThrows(IllegalArgumentException.class, () -> MapLoader.validate(noTerrain));
            assertThrows(IllegalArgumentException.class, () -> MapLoader.validate(strayArmy));
        }
    }
}
