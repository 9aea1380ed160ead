package com.vikings.cpu;

/**
 * Suspension point the turn loop hits after every executed move, so a host can render the step
 * or a driver can single-step the turn.
 */
public interface TurnPacer {

    /**
     * Blocks until the loop may continue.
     *
     * @throws InterruptedException if the host cancels the turn while it is suspended
     */
    void awaitNextStep(TurnState state, MoveCandidate executed) throws InterruptedException;

    /**
     * Signals a suspended loop to continue. No-op for pacers that resume on their own.
     */
    default void resume() {
    }
}
