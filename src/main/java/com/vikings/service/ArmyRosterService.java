package com.vikings.service;

import com.vikings.config.AIProperties;
import com.vikings.config.ArmyDefinition;
import com.vikings.config.MapDefinition;
import com.vikings.config.MapLoader;
import com.vikings.cpu.Mover;
import com.vikings.model.Army;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory roster of every army on the active world.
 */
@Service
@Slf4j
public class ArmyRosterService implements ArmyService {

    private final MapLoader mapLoader;
    private final AIProperties properties;
    private final String mapId;

    private final Map<String, Army> armies = new LinkedHashMap<>();

    public ArmyRosterService(MapLoader mapLoader, AIProperties properties,
                             @Value("${game.world.map-id:jutland}") String mapId) {
        this.mapLoader = mapLoader;
        this.properties = properties;
        this.mapId = mapId;
    }

    @PostConstruct
    public void init() {
        if (mapLoader.getMaps().containsKey(mapId)) {
            loadArmies(mapLoader.getMap(mapId));
        }
    }

    public void loadArmies(MapDefinition map) {
        armies.clear();
        for (ArmyDefinition def : map.armies()) {
            armies.put(def.id(), Army.builder()
                    .id(def.id())
                    .name(def.name())
                    .playerId(def.player())
                    .regionId(def.region())
                    .movementPoints(def.movementPoints())
                    .maxMovementPoints(def.movementPoints())
                    .strength(def.strength())
                    .maxStrength(def.strength())
                    .build());
        }
        log.info("Placed {} armies on world '{}'", armies.size(), map.name());
    }

    public void addArmy(Army army) {
        armies.put(army.getId(), army);
    }

    public Optional<Army> findArmy(String armyId) {
        return Optional.ofNullable(armies.get(armyId));
    }

    public List<Army> getArmies() {
        return List.copyOf(armies.values());
    }

    /**
     * Armies that can still fight, in the order they were placed.
     */
    @Override
    public List<Army> armiesOf(String playerId) {
        return armies.values().stream()
                .filter(a -> playerId.equals(a.getPlayerId()))
                .filter(a -> !a.isDepleted())
                .toList();
    }

    @Override
    public void startTurn(String playerId) {
        armiesOf(playerId).forEach(Army::restoreMovementPoints);
    }

    @Override
    public boolean needsReinforcement(Mover mover) {
        Army army = require(mover);
        return army.getStrength() < army.getMaxStrength() * properties.getTurn().getReinforceThreshold();
    }

    @Override
    public void reinforce(Mover mover) {
        Army army = require(mover);
        log.debug("{} refilled from {} to {}", army.getName(), army.getStrength(), army.getMaxStrength());
        army.setStrength(army.getMaxStrength());
    }

    private Army require(Mover mover) {
        return findArmy(mover.getId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown army: " + mover.getId()));
    }
}
