package com.vikings.config;

import com.vikings.model.ResourceType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Balance constants consumed by the AI: search limits, scoring weights and bands, jitter, pacing.
 * <p>
 * Everything here is bound from {@code game.ai.*} and can be overridden in
 * {@code application.properties} or via environment variables. The AI never decides these values
 * itself.
 */
@Data
@Component
@ConfigurationProperties(prefix = "game.ai")
public class AIProperties {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    private Search search = new Search();
    private Scoring scoring = new Scoring();
    private Jitter jitter = new Jitter();
    private Turn turn = new Turn();

    /**
     * Rejects weight sets that do not add up to 1.0.
     */
    @PostConstruct
    public void validate() {
        double sum = scoring.getPopulationWeight() + scoring.getResourceWeight()
                + scoring.getLevelWeight() + scoring.getOwnershipWeight();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("Scoring weights must sum to 1.0 but sum to " + sum);
        }
        if (scoring.getPopulationBandMax() <= scoring.getPopulationBandMin()) {
            throw new IllegalStateException("Population band is empty: "
                    + scoring.getPopulationBandMin() + ".." + scoring.getPopulationBandMax());
        }
        if (search.getDefaultHorizon() < 0) {
            throw new IllegalStateException("Default horizon must not be negative");
        }
        if (turn.getLookaheadTurns() < 1) {
            throw new IllegalStateException("Lookahead must cover at least one turn");
        }
    }

    @Data
    public static class Search {

        /** Horizon used by inspection endpoints when the caller gives none. */
        private int defaultHorizon = 12;

        /** Pop limit for the full-horizon enumeration. */
        private int reachableIterationCap = 10_000;

        /** Pop limit for point-to-point searches, which may cross the whole map. */
        private int pathIterationCap = 50_000;

        /** Longest parent chain accepted during path reconstruction. */
        private int maxPathLength = 1_000;
    }

    @Data
    public static class Scoring {

        private double populationWeight = 0.30;
        private double resourceWeight = 0.40;
        private double levelWeight = 0.20;
        private double ownershipWeight = 0.10;

        private double ownershipNeutral = 0.8;
        private double ownershipOwn = 0.1;
        private double ownershipRival = 1.0;

        /** Reference population band of the lowest tier; fixed so scores compare across a session. */
        private int populationBandMin = 50;
        private int populationBandMax = 1_000;

        /** Share of the primary resources in the resource score, the rest is the treasury bonus. */
        private double primaryResourceShare = 0.8;

        private double treasuryDivisor = 3.0;

        /** Highest amount of each resource any terrain archetype can yield. */
        private Map<ResourceType, Integer> resourceMaxima = defaultResourceMaxima();

        /** Importance of each primary resource. */
        private Map<ResourceType, Double> resourceWeights = defaultResourceWeights();

        private static Map<ResourceType, Integer> defaultResourceMaxima() {
            Map<ResourceType, Integer> maxima = new EnumMap<>(ResourceType.class);
            maxima.put(ResourceType.FOOD, 20);
            maxima.put(ResourceType.WOOD, 15);
            maxima.put(ResourceType.IRON, 8);
            maxima.put(ResourceType.STONE, 12);
            maxima.put(ResourceType.GOLD, 30);
            return maxima;
        }

        private static Map<ResourceType, Double> defaultResourceWeights() {
            Map<ResourceType, Double> weights = new EnumMap<>(ResourceType.class);
            weights.put(ResourceType.FOOD, 0.4);
            weights.put(ResourceType.WOOD, 0.25);
            weights.put(ResourceType.IRON, 0.2);
            weights.put(ResourceType.STONE, 0.15);
            return weights;
        }
    }

    @Data
    public static class Jitter {

        /** Jitter is drawn uniformly from [-amplitude, +amplitude]. */
        private double amplitude = 5.0;

        /** Mixed into every jitter seed so a whole session can be replayed. */
        private long seed = 0L;
    }

    @Data
    public static class Turn {

        /** How many turns of movement an army looks ahead when collecting targets. */
        private int lookaheadTurns = 1;

        /** Armies below this fraction of their full strength go back for reinforcement. */
        private double reinforceThreshold = 0.5;

        /** Pause after each executed move when pacing is {@code delay}. */
        private long thinkDelayMs = 500;

        /** {@code delay} sleeps between moves, {@code step} waits for an explicit resume. */
        private String pacing = "delay";
    }
}
