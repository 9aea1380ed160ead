package com.vikings.cpu.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Every region a player can reach from a start region within a movement horizon, with the cheapest
 * cost and the parent on that cheapest route. Backed by dense arrays indexed by region id.
 */
public class ReachabilitySet {

    static final int UNREACHED = -1;

    private final int start;
    private final int horizon;
    private final int[] cost;
    private final int[] parent;
    private final boolean truncated;
    private final int maxPathLength;

    ReachabilitySet(int start, int horizon, int[] cost, int[] parent, boolean truncated, int maxPathLength) {
        this.start = start;
        this.horizon = horizon;
        this.cost = cost;
        this.parent = parent;
        this.truncated = truncated;
        this.maxPathLength = maxPathLength;
    }

    public int getStart() {
        return start;
    }

    public int getHorizon() {
        return horizon;
    }

    /**
     * True when the search hit its iteration cap and this set is the best partial answer.
     */
    public boolean isTruncated() {
        return truncated;
    }

    public boolean contains(int regionId) {
        return regionId >= 0 && regionId < cost.length && cost[regionId] != UNREACHED;
    }

    public OptionalInt costOf(int regionId) {
        return contains(regionId) ? OptionalInt.of(cost[regionId]) : OptionalInt.empty();
    }

    /**
     * @return parent on the cheapest route, {@code -1} for the start or unreached regions
     */
    public int parentOf(int regionId) {
        return contains(regionId) ? parent[regionId] : -1;
    }

    /**
     * Cheapest route from the start to {@code regionId}, empty when the region is not in the set.
     */
    public List<Integer> pathTo(int regionId) {
        if (!contains(regionId)) {
            return List.of();
        }
        return PathPlanner.reconstruct(parent, start, regionId, maxPathLength);
    }

    /**
     * Reached region ids in ascending order, the start included.
     */
    public List<Integer> regionIds() {
        List<Integer> ids = new ArrayList<>();
        for (int id = 0; id < cost.length; id++) {
            if (cost[id] != UNREACHED) {
                ids.add(id);
            }
        }
        return Collections.unmodifiableList(ids);
    }

    public int size() {
        int count = 0;
        for (int c : cost) {
            if (c != UNREACHED) {
                count++;
            }
        }
        return count;
    }
}
