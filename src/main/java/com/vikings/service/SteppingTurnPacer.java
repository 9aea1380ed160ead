package com.vikings.service;

import com.vikings.cpu.MoveCandidate;
import com.vikings.cpu.TurnPacer;
import com.vikings.cpu.TurnState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;

/**
 * Holds the turn loop after every move until someone calls {@link #resume()}. Lets a UI or a test
 * driver single-step a turn. A resume sent before the loop gets there is kept and consumed by
 * the next step.
 * <p>
 * {@link AITurnService} runs one turn at a time for the whole world, so there is never more than
 * one turn waiting here and a resume always reaches the running one.
 */
@Component
@ConditionalOnProperty(name = "game.ai.turn.pacing", havingValue = "step")
@Slf4j
public class SteppingTurnPacer implements TurnPacer {

    private final Semaphore permits = new Semaphore(0);

    @Override
    public void awaitNextStep(TurnState state, MoveCandidate executed) throws InterruptedException {
        log.debug("Turn of player {} suspended after pass {}", state.getPlayerId(), state.getPasses());
        permits.acquire();
    }

    @Override
    public void resume() {
        permits.release();
    }

    public boolean isWaiting() {
        return permits.hasQueuedThreads();
    }
}
