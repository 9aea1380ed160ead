package com.vikings.cpu.path;

import com.vikings.config.AIProperties;
import com.vikings.service.TerritoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Movement-point search over the region graph.
 * <p>
 * Two modes share one Dijkstra core. {@link #reachableRegions} enumerates everything inside a
 * horizon and therefore drains the queue; {@link #shortestPath} stops the moment the target is
 * popped, which is already optimal because enter costs are never negative. Settled regions are
 * skipped at pop time instead of being removed from the queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PathPlanner {

    private static final int NO_TARGET = -1;

    private final TerritoryService territoryService;
    private final AIProperties properties;

    /**
     * All regions {@code playerId} can reach from {@code start} spending at most {@code horizon}
     * movement points. A region costing exactly {@code horizon} is included.
     * <p>
     * If the iteration cap trips, the best-known partial set is returned and flagged as truncated.
     */
    public ReachabilitySet reachableRegions(int start, String playerId, int horizon) {
        requireRegion(start);
        if (horizon < 0) {
            throw new IllegalArgumentException("Horizon must not be negative: " + horizon);
        }
        Search search = run(start, NO_TARGET, playerId, horizon,
                properties.getSearch().getReachableIterationCap());
        return new ReachabilitySet(start, horizon, search.cost, search.parent, search.truncated,
                properties.getSearch().getMaxPathLength());
    }

    /**
     * Cheapest route from {@code start} to {@code target}, regardless of how many turns it takes.
     */
    public PathResult shortestPath(int start, int target, String playerId) {
        requireRegion(start);
        requireRegion(target);
        if (start == target) {
            return PathResult.trivial(start);
        }

        Search search = run(start, target, playerId, Integer.MAX_VALUE,
                properties.getSearch().getPathIterationCap());
        if (!search.reachedTarget) {
            return PathResult.unreachable();
        }

        List<Integer> path = reconstruct(search.parent, start, target,
                properties.getSearch().getMaxPathLength());
        if (path.isEmpty()) {
            return PathResult.unreachable();
        }
        return PathResult.found(path, search.cost[target]);
    }

    /**
     * Longest prefix of {@code path} whose cumulative enter cost fits in {@code budget}. Costs are
     * re-read because ownership may have changed since the path was planned; the walk stops at the
     * first step that overflows or has become impassable.
     */
    public List<Integer> trimPathToBudget(List<Integer> path, String playerId, int budget) {
        if (path.isEmpty()) {
            return List.of();
        }
        List<Integer> trimmed = new ArrayList<>(path.size());
        trimmed.add(path.get(0));
        long spent = 0;
        for (int i = 1; i < path.size(); i++) {
            int enter = territoryService.enterCost(path.get(i), playerId);
            if (enter == TerritoryService.IMPASSABLE || spent + enter > budget) {
                break;
            }
            spent += enter;
            trimmed.add(path.get(i));
        }
        return Collections.unmodifiableList(trimmed);
    }

    /**
     * Current cost of walking {@code path}; {@link TerritoryService#IMPASSABLE} if any step can no
     * longer be entered.
     */
    public int pathCost(List<Integer> path, String playerId) {
        long total = 0;
        for (int i = 1; i < path.size(); i++) {
            int enter = territoryService.enterCost(path.get(i), playerId);
            if (enter == TerritoryService.IMPASSABLE) {
                return TerritoryService.IMPASSABLE;
            }
            total += enter;
        }
        return (int) Math.min(total, TerritoryService.IMPASSABLE - 1L);
    }

    /**
     * Walks parent pointers back from {@code target} to {@code start}. A chain longer than
     * {@code maxLength}, or one that breaks off before reaching the start, yields an empty path.
     */
    static List<Integer> reconstruct(int[] parent, int start, int target, int maxLength) {
        List<Integer> path = new ArrayList<>();
        int current = target;
        while (current != start) {
            if (current < 0 || path.size() >= maxLength) {
                log.warn("Malformed parent chain from {} back to {}, dropping path", target, start);
                return List.of();
            }
            path.add(current);
            current = parent[current];
        }
        path.add(start);
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }

    private Search run(int start, int target, String playerId, int horizon, int iterationCap) {
        int regionCount = territoryService.regionCount();
        Search search = new Search(regionCount);
        search.cost[start] = 0;

        MinHeap<Integer> open = new MinHeap<>(regionCount);
        open.insert(start, 0);
        int iterations = 0;

        while (!open.isEmpty()) {
            if (++iterations > iterationCap) {
                search.truncated = true;
                log.warn("Search from region {} for player {} exceeded {} iterations, returning partial result",
                        start, playerId, iterationCap);
                break;
            }

            int current = open.extractMin().item();
            if (search.settled[current]) {
                continue;
            }
            search.settled[current] = true;

            if (current == target) {
                search.reachedTarget = true;
                break;
            }
            relaxNeighbors(current, playerId, horizon, search, open);
        }
        return search;
    }

    private void relaxNeighbors(int current, String playerId, int horizon, Search search, MinHeap<Integer> open) {
        for (int next : territoryService.neighborRegions(current)) {
            if (search.settled[next]) {
                continue;
            }
            int enter = territoryService.enterCost(next, playerId);
            if (enter == TerritoryService.IMPASSABLE) {
                continue;
            }
            if (enter < 0) {
                throw new IllegalStateException("Negative enter cost " + enter + " for region " + next);
            }
            long candidate = (long) search.cost[current] + enter;
            if (candidate > horizon) {
                continue;
            }
            if (search.cost[next] == ReachabilitySet.UNREACHED || candidate < search.cost[next]) {
                search.cost[next] = (int) candidate;
                search.parent[next] = current;
                open.insert(next, (int) candidate);
            }
        }
    }

    private void requireRegion(int regionId) {
        if (regionId < 0 || regionId >= territoryService.regionCount()) {
            throw new IllegalArgumentException("Unknown region: " + regionId);
        }
    }

    private static final class Search {
        final int[] cost;
        final int[] parent;
        final boolean[] settled;
        boolean truncated;
        boolean reachedTarget;

        Search(int regionCount) {
            cost = new int[regionCount];
            parent = new int[regionCount];
            settled = new boolean[regionCount];
            Arrays.fill(cost, ReachabilitySet.UNREACHED);
            Arrays.fill(parent, -1);
        }
    }
}
