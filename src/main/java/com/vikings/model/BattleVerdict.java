package com.vikings.model;

/**
 * Outcome of a battle as seen by the attacking army.
 */
public enum BattleVerdict {
    VICTORY,
    DEFEAT,
    DRAW
}
