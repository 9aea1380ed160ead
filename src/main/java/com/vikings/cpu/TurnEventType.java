package com.vikings.cpu;

public enum TurnEventType {
    TURN_STARTED,
    ARMY_REINFORCED,
    MOVE_PREPARED,
    MOVE_STARTED,
    BATTLE_STARTED,
    REGION_CONQUERED,
    TURN_FINISHED
}
