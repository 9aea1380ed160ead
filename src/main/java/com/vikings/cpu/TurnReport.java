package com.vikings.cpu;

import lombok.Builder;
import lombok.Data;

/**
 * Summary of one finished AI turn.
 */
@Data
@Builder
public class TurnReport {
    private String playerId;
    private int passes;
    private int movesExecuted;
    private int battlesFought;
    private int regionsConquered;
    private int armiesReinforced;
    private TurnExitReason exitReason;
}
