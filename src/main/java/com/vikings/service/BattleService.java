package com.vikings.service;

import com.vikings.cpu.Mover;
import com.vikings.model.BattleVerdict;

import java.util.concurrent.CompletableFuture;

/**
 * Decides when arriving in a region means a fight and resolves that fight.
 */
public interface BattleService {

    /**
     * True when the region is contested for this mover: owned by a rival, or neutral with
     * defenders.
     */
    boolean shouldTriggerBattle(Mover mover, int regionId);

    /**
     * Starts a battle. The turn loop blocks on the returned future until the verdict is known.
     */
    CompletableFuture<BattleVerdict> startBattle(Mover mover, int regionId);
}
