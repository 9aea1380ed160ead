package com.vikings.cpu;

import com.vikings.config.AIProperties;
import com.vikings.cpu.path.PathPlanner;
import com.vikings.cpu.path.PathResult;
import com.vikings.cpu.path.ReachabilitySet;
import com.vikings.cpu.scoring.TargetScorer;
import com.vikings.model.BattleVerdict;
import com.vikings.service.ArmyService;
import com.vikings.service.BattleService;
import com.vikings.service.TerritoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Runs one AI player turn: pairs armies with frontier targets, moves the best pairing, fights
 * where the move lands on contested ground, and repeats until no army has anything left to do.
 * <p>
 * Each loop pass recomputes the frontier from scratch, so conquests made earlier in the turn are
 * picked up without incremental bookkeeping. Every pass either exits or marks one more army as
 * moved, which bounds the turn by armies times passes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnOrchestrator {

    private final TerritoryService territoryService;
    private final ArmyService armyService;
    private final BattleService battleService;
    private final PathPlanner pathPlanner;
    private final TargetScorer targetScorer;
    private final AIProperties properties;
    private final TurnPacer turnPacer;
    private final List<TurnEventListener> listeners;

    /**
     * Plays a full turn for {@code playerId}.
     *
     * @throws InterruptedException if the host cancels the turn; state stays as it was after the
     *                              last completed move
     */
    public TurnReport runTurn(String playerId) throws InterruptedException {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player id is required");
        }

        TurnState state = new TurnState(playerId);
        armyService.startTurn(playerId);
        List<? extends Mover> armies = armyService.armiesOf(playerId);
        for (Mover army : armies) {
            state.snapshotReinforcementNeed(army, armyService.needsReinforcement(army));
        }
        log.info("AI turn started for player {} with {} armies", playerId, armies.size());
        publish(TurnEvent.turnStarted(playerId));

        TurnExitReason exitReason;
        while (true) {
            Set<Integer> frontier = territoryService.frontierRegions(playerId);
            state.beginPass(frontier);
            if (frontier.isEmpty()) {
                exitReason = TurnExitReason.FRONTIER_EMPTY;
                break;
            }

            MoveCandidate best = null;
            for (Mover army : armies) {
                MoveCandidate candidate = candidateFor(army, state);
                if (candidate == null) {
                    continue;
                }
                state.addCandidate(candidate);
                if (candidate.beats(best)) {
                    best = candidate;
                }
            }

            if (best == null) {
                exitReason = TurnExitReason.NO_CANDIDATE;
                break;
            }

            log.debug("Pass {}: {} heads for region {} (score {}, cost {}, {})", state.getPasses(),
                    best.getMover().getName(), best.getTargetRegionId(), best.getFinalScore(),
                    best.getMpCost(), best.getGoalTag());
            execute(best, state);
            state.markMoved(best.getMover());
            turnPacer.awaitNextStep(state, best);
        }

        publish(TurnEvent.turnFinished(playerId));
        TurnReport report = state.toReport(exitReason);
        log.info("AI turn finished for player {}: {} moves, {} battles, {} conquests ({})", playerId,
                report.getMovesExecuted(), report.getBattlesFought(), report.getRegionsConquered(), exitReason);
        return report;
    }

    /**
     * The single move this army proposes for the current pass, or {@code null}. Reinforcement is
     * a hard override: an army that needs it either refills in place or heads for a stronghold.
     */
    MoveCandidate candidateFor(Mover army, TurnState state) {
        if (state.hasMoved(army) || army.getMovementPoints() <= 0) {
            return null;
        }

        if (state.needsReinforcement(army)) {
            int here = army.getRegionId();
            if (territoryService.isStronghold(here) && army.getPlayerId().equals(territoryService.regionOwner(here))) {
                armyService.reinforce(army);
                state.clearReinforcementNeed(army);
                state.markMoved(army);
                state.recordReinforcement();
                log.info("{} reinforced at stronghold {}", army.getName(), here);
                publish(TurnEvent.ofArmy(TurnEventType.ARMY_REINFORCED, army, here));
                return null;
            }

            MoveCandidate detour = reinforcementDetour(army);
            if (detour != null) {
                return detour;
            }
            log.debug("{} needs reinforcement but has no stronghold to reach", army.getName());
        }

        return bestFrontierCandidate(army, state.getFrontier());
    }

    private MoveCandidate reinforcementDetour(Mover army) {
        OptionalInt stronghold = territoryService.nearestOwnedStronghold(army.getRegionId(), army.getPlayerId());
        if (stronghold.isEmpty()) {
            return null;
        }
        PathResult route = pathPlanner.shortestPath(army.getRegionId(), stronghold.getAsInt(), army.getPlayerId());
        if (!route.success()) {
            return null;
        }
        return MoveCandidate.builder()
                .mover(army)
                .targetRegionId(stronghold.getAsInt())
                .path(route.path())
                .mpCost(route.cost())
                .finalScore(Double.POSITIVE_INFINITY)
                .canReachNow(route.cost() <= army.getMovementPoints())
                .goalTag(GoalTag.REINFORCE)
                .build();
    }

    /**
     * Best frontier target inside this army's lookahead horizon. Targets reachable with the
     * current movement points always win over targets that need more turns.
     */
    private MoveCandidate bestFrontierCandidate(Mover army, List<Integer> frontier) {
        int movementPoints = army.getMovementPoints();
        long lookahead = (long) movementPoints * properties.getTurn().getLookaheadTurns();
        int horizon = (int) Math.min(lookahead, Integer.MAX_VALUE);
        ReachabilitySet reachable = pathPlanner.reachableRegions(army.getRegionId(), army.getPlayerId(), horizon);

        MoveCandidate bestNow = null;
        MoveCandidate bestLater = null;
        for (int regionId : frontier) {
            if (regionId == army.getRegionId()) {
                continue;
            }
            OptionalInt cost = reachable.costOf(regionId);
            if (cost.isEmpty()) {
                continue;
            }
            List<Integer> path = reachable.pathTo(regionId);
            if (path.isEmpty()) {
                continue;
            }

            boolean reachableNow = cost.getAsInt() <= movementPoints;
            MoveCandidate candidate = MoveCandidate.builder()
                    .mover(army)
                    .targetRegionId(regionId)
                    .path(path)
                    .mpCost(cost.getAsInt())
                    .finalScore(targetScorer.adjustedScore(army, regionId, cost.getAsInt()))
                    .canReachNow(reachableNow)
                    .goalTag(GoalTag.NORMAL)
                    .build();

            if (reachableNow) {
                if (candidate.beats(bestNow)) {
                    bestNow = candidate;
                }
            } else if (candidate.beats(bestLater)) {
                bestLater = candidate;
            }
        }
        return bestNow != null ? bestNow : bestLater;
    }

    private void execute(MoveCandidate candidate, TurnState state) throws InterruptedException {
        Mover mover = candidate.getMover();
        String playerId = mover.getPlayerId();
        int target = candidate.getTargetRegionId();
        boolean affordable = candidate.getMpCost() <= mover.getMovementPoints();

        publish(TurnEvent.ofMove(TurnEventType.MOVE_PREPARED, mover, target, candidate.getPath()));

        List<Integer> trimmed = pathPlanner.trimPathToBudget(candidate.getPath(), playerId, mover.getMovementPoints());
        if (trimmed.size() > 1) {
            publish(TurnEvent.ofMove(TurnEventType.MOVE_STARTED, mover, target, trimmed));
            for (int i = 1; i < trimmed.size(); i++) {
                mover.relocateTo(trimmed.get(i));
            }
            mover.spendMovementPoints(pathPlanner.pathCost(trimmed, playerId));
            state.recordMove();
        }

        boolean arrived = !trimmed.isEmpty() && trimmed.get(trimmed.size() - 1) == target;
        if (affordable && arrived && candidate.getGoalTag() == GoalTag.NORMAL
                && battleService.shouldTriggerBattle(mover, target)) {
            fight(mover, target, state);
        }
    }

    private void fight(Mover mover, int regionId, TurnState state) throws InterruptedException {
        publish(TurnEvent.ofArmy(TurnEventType.BATTLE_STARTED, mover, regionId));
        state.recordBattle();

        BattleVerdict verdict = awaitVerdict(mover, regionId);
        if (verdict == BattleVerdict.VICTORY) {
            territoryService.transferOwnership(regionId, mover.getPlayerId());
            state.recordConquest();
            log.info("{} conquered region {} for player {}", mover.getName(), regionId, mover.getPlayerId());
            publish(TurnEvent.ofArmy(TurnEventType.REGION_CONQUERED, mover, regionId));
        } else {
            log.info("{} fought for region {}: {}", mover.getName(), regionId, verdict);
        }
    }

    private BattleVerdict awaitVerdict(Mover mover, int regionId) throws InterruptedException {
        try {
            return battleService.startBattle(mover, regionId).get();
        } catch (ExecutionException e) {
            log.error("Battle of {} for region {} failed, counting it as a draw", mover.getName(), regionId, e.getCause());
            return BattleVerdict.DRAW;
        }
    }

    private void publish(TurnEvent event) {
        for (TurnEventListener listener : listeners) {
            try {
                listener.onTurnEvent(event);
            } catch (RuntimeException e) {
                log.error("Turn event listener failed on {}", event.type(), e);
            }
        }
    }
}
