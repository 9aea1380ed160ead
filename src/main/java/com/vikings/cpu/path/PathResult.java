package com.vikings.cpu.path;

import java.util.List;

/**
 * Outcome of a point-to-point search. An unreachable target is a result, not an exception.
 *
 * @param success whether a route exists
 * @param path    regions from start to target inclusive, empty when unsuccessful
 * @param cost    movement points the route costs, 0 when unsuccessful
 */
public record PathResult(boolean success, List<Integer> path, int cost) {

    public PathResult {
        path = List.copyOf(path);
    }

    public static PathResult found(List<Integer> path, int cost) {
        return new PathResult(true, path, cost);
    }

    public static PathResult trivial(int start) {
        return new PathResult(true, List.of(start), 0);
    }

    public static PathResult unreachable() {
        return new PathResult(false, List.of(), 0);
    }
}
