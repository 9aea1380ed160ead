package com.vikings.service;

import com.vikings.cpu.Mover;

import java.util.List;

/**
 * Army roster and the turn-start bookkeeping the AI delegates.
 */
public interface ArmyService {

    /**
     * Armies of the player, in a stable order.
     */
    List<? extends Mover> armiesOf(String playerId);

    /**
     * Turn-start allocation: movement points, upkeep and similar budgets.
     */
    void startTurn(String playerId);

    boolean needsReinforcement(Mover mover);

    /**
     * Refills the army where it stands.
     */
    void reinforce(Mover mover);
}
