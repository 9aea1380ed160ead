package com.vikings.cpu;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Transient state of a single player turn. Created at turn start and discarded at turn end.
 */
@Getter
public class TurnState {

    private final String playerId;
    @Getter(AccessLevel.NONE)
    private final Set<String> movedArmyIds = new HashSet<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, Boolean> reinforcementNeeds = new HashMap<>();
    private List<Integer> frontier = List.of();
    private final List<MoveCandidate> candidates = new ArrayList<>();

    private int passes;
    private int movesExecuted;
    private int battlesFought;
    private int regionsConquered;
    private int armiesReinforced;

    public TurnState(String playerId) {
        this.playerId = playerId;
    }

    /**
     * Starts a new loop pass with a freshly computed frontier, kept in ascending region order.
     */
    public void beginPass(Collection<Integer> newFrontier) {
        passes++;
        frontier = List.copyOf(new TreeSet<>(newFrontier));
        candidates.clear();
    }

    public void snapshotReinforcementNeed(Mover mover, boolean needed) {
        reinforcementNeeds.put(mover.getId(), needed);
    }

    public boolean needsReinforcement(Mover mover) {
        return reinforcementNeeds.getOrDefault(mover.getId(), false);
    }

    /**
     * Once reinforced, an army is back to normal targeting for the rest of the turn.
     */
    public void clearReinforcementNeed(Mover mover) {
        reinforcementNeeds.put(mover.getId(), false);
    }

    public boolean hasMoved(Mover mover) {
        return movedArmyIds.contains(mover.getId());
    }

    public void markMoved(Mover mover) {
        movedArmyIds.add(mover.getId());
    }

    public void addCandidate(MoveCandidate candidate) {
        candidates.add(candidate);
    }

    /**
     * Read-only view of the candidates collected in the current pass.
     */
    public List<MoveCandidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    void recordMove() {
        movesExecuted++;
    }

    void recordBattle() {
        battlesFought++;
    }

    void recordConquest() {
        regionsConquered++;
    }

    void recordReinforcement() {
        armiesReinforced++;
    }

    TurnReport toReport(TurnExitReason exitReason) {
        return TurnReport.builder()
                .playerId(playerId)
                .passes(passes)
                .movesExecuted(movesExecuted)
                .battlesFought(battlesFought)
                .regionsConquered(regionsConquered)
                .armiesReinforced(armiesReinforced)
                .exitReason(exitReason)
                .build();
    }
}
