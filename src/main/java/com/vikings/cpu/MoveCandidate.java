package com.vikings.cpu;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A proposed move of one army toward one target region.
 */
@Value
@Builder
public class MoveCandidate {

    Mover mover;
    int targetRegionId;
    List<Integer> path;
    int mpCost;
    double finalScore;
    boolean canReachNow;
    GoalTag goalTag;

    public boolean isForced() {
        return finalScore == Double.POSITIVE_INFINITY;
    }

    /**
     * True when this candidate should be picked over {@code other}. Infinite scores beat finite
     * ones; on equal scores the incumbent is kept.
     */
    public boolean beats(MoveCandidate other) {
        if (other == null) {
            return true;
        }
        return Double.compare(finalScore, other.finalScore) > 0;
    }
}
