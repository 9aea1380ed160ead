package com.vikings.service;

import com.vikings.cpu.TurnOrchestrator;
import com.vikings.cpu.TurnReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs AI turns off the request thread. All players share one world, so at most one turn runs
 * at a time whoever it belongs to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AITurnService {

    private final TurnOrchestrator turnOrchestrator;

    private final ReentrantLock worldLock = new ReentrantLock();
    private volatile String runningPlayerId;

    /**
     * Play a full AI turn for the player.
     *
     * @return the turn report, or a failed future if any turn was already running, the turn was
     *         interrupted or it failed
     */
    @Async
    public CompletableFuture<TurnReport> playTurn(String playerId) {
        if (!worldLock.tryLock()) {
            String running = runningPlayer().orElse("unknown");
            log.info("Refusing AI turn for player {}: turn of player {} still running", playerId, running);
            return CompletableFuture.failedFuture(
                    new IllegalStateException("AI turn already running for player " + running));
        }
        runningPlayerId = playerId;
        try {
            return CompletableFuture.completedFuture(turnOrchestrator.runTurn(playerId));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("AI turn interrupted for player {}", playerId);
            return CompletableFuture.failedFuture(ie);
        } catch (RuntimeException e) {
            log.error("Error executing AI turn for player {}", playerId, e);
            return CompletableFuture.failedFuture(e);
        } finally {
            runningPlayerId = null;
            worldLock.unlock();
        }
    }

    public boolean isTurnRunning() {
        return worldLock.isLocked();
    }

    /**
     * @return the player whose turn holds the world, if any
     */
    public Optional<String> runningPlayer() {
        return Optional.ofNullable(runningPlayerId);
    }
}
