package com.vikings.cpu;

/**
 * Why a turn loop stopped.
 */
public enum TurnExitReason {
    FRONTIER_EMPTY,
    NO_CANDIDATE
}
