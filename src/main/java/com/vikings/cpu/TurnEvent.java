package com.vikings.cpu;

import java.util.List;

/**
 * Notification emitted by the turn loop for observers.
 *
 * @param type     what happened
 * @param playerId player whose turn is running
 * @param armyId   army involved, {@code null} for turn-level events
 * @param regionId region involved, {@code -1} for turn-level events
 * @param path     route involved, empty when not a movement event
 */
public record TurnEvent(
        TurnEventType type,
        String playerId,
        String armyId,
        int regionId,
        List<Integer> path
) {

    public static TurnEvent turnStarted(String playerId) {
        return new TurnEvent(TurnEventType.TURN_STARTED, playerId, null, -1, List.of());
    }

    public static TurnEvent turnFinished(String playerId) {
        return new TurnEvent(TurnEventType.TURN_FINISHED, playerId, null, -1, List.of());
    }

    public static TurnEvent ofArmy(TurnEventType type, Mover mover, int regionId) {
        return new TurnEvent(type, mover.getPlayerId(), mover.getId(), regionId, List.of());
    }

    public static TurnEvent ofMove(TurnEventType type, Mover mover, int regionId, List<Integer> path) {
        return new TurnEvent(type, mover.getPlayerId(), mover.getId(), regionId, List.copyOf(path));
    }
}
