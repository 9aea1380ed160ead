package com.vikings.service;

import com.vikings.cpu.Mover;
import com.vikings.model.Army;
import com.vikings.model.BattleVerdict;
import com.vikings.model.Region;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Stand-in battle resolver for the in-memory world: one strength roll per side, strongholds
 * defend at half again their garrison. Resolves immediately.
 */
@Service
@Slf4j
public class SkirmishBattleService implements BattleService {

    private static final double STRONGHOLD_BONUS = 1.5;

    private final TerritoryService territoryService;
    private final ArmyRosterService armyRoster;
    private final Random random;

    @Autowired
    public SkirmishBattleService(TerritoryService territoryService, ArmyRosterService armyRoster) {
        this(territoryService, armyRoster, new SecureRandom());
    }

    SkirmishBattleService(TerritoryService territoryService, ArmyRosterService armyRoster, Random random) {
        this.territoryService = territoryService;
        this.armyRoster = armyRoster;
        this.random = random;
    }

    @Override
    public boolean shouldTriggerBattle(Mover mover, int regionId) {
        Region region = territoryService.getRegion(regionId);
        if (region.isOwnedBy(mover.getPlayerId())) {
            return false;
        }
        return !region.isNeutral() || region.hasDefenders();
    }

    @Override
    public CompletableFuture<BattleVerdict> startBattle(Mover mover, int regionId) {
        Army army = armyRoster.findArmy(mover.getId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown army: " + mover.getId()));
        Region region = territoryService.getRegion(regionId);

        double attack = army.getStrength() * roll();
        double defense = region.getGarrison() * roll() * (region.isStronghold() ? STRONGHOLD_BONUS : 1.0);

        BattleVerdict verdict;
        if (attack > defense) {
            verdict = BattleVerdict.VICTORY;
            army.setStrength(Math.max(1, army.getStrength() - region.getGarrison() / 2));
            region.setGarrison(0);
        } else if (attack < defense) {
            verdict = BattleVerdict.DEFEAT;
            region.setGarrison(Math.max(0, region.getGarrison() - army.getStrength() / 4));
            army.setStrength(army.getStrength() / 2);
        } else {
            verdict = BattleVerdict.DRAW;
        }

        log.info("{} ({}) against {} defenders of {}: {}", army.getName(), army.getStrength(),
                region.getGarrison(), region.getName(), verdict);
        return CompletableFuture.completedFuture(verdict);
    }

    private double roll() {
        return 0.5 + random.nextDouble();
    }
}
