package com.vikings.service;

import com.vikings.cpu.MoveCandidate;
import com.vikings.cpu.TurnPacer;
import com.vikings.cpu.TurnState;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Gives observers time to render each move by pausing a fixed delay after it.
 */
@Component
@ConditionalOnProperty(name = "game.ai.turn.pacing", havingValue = "delay", matchIfMissing = true)
public class DelayTurnPacer implements TurnPacer {

    @Value("${game.ai.turn.think-delay-ms:500}")
    private long thinkDelayMs;

    @Override
    public void awaitNextStep(TurnState state, MoveCandidate executed) throws InterruptedException {
        if (thinkDelayMs > 0) {
            Thread.sleep(thinkDelayMs);
        }
    }
}
