package com.vikings.cpu.scoring;

import com.vikings.config.AIProperties;
import com.vikings.cpu.Mover;
import com.vikings.cpu.path.PathPlanner;
import com.vikings.cpu.path.PathResult;
import com.vikings.model.Region;
import com.vikings.model.RegionLevel;
import com.vikings.model.ResourceType;
import com.vikings.service.TerritoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Scores how desirable a region is as a target, from population, resources, administrative level
 * and who owns it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TargetScorer {

    private static final int TOP_TIER = RegionLevel.values().length;

    private final TerritoryService territoryService;
    private final PathPlanner pathPlanner;
    private final AIProperties properties;

    /**
     * Full score of {@code regionId} from the point of view of {@code forPlayer}.
     */
    public ScoreRecord scoreRegion(int regionId, String forPlayer) {
        AIProperties.Scoring scoring = properties.getScoring();
        Region region = territoryService.getRegion(regionId);

        double population = populationScore(region);
        double resources = resourceScore(region);
        double level = levelScore(region);
        double ownership = ownershipScore(region, forPlayer);
        double overall = population * scoring.getPopulationWeight()
                + resources * scoring.getResourceWeight()
                + level * scoring.getLevelWeight()
                + ownership * scoring.getOwnershipWeight();

        return new ScoreRecord(regionId, population, resources, level, ownership, overall);
    }

    /**
     * Score without the ownership term, rescaled to 0..100. Used to rank targets for any mover.
     */
    public double scoreRegionBase(int regionId) {
        AIProperties.Scoring scoring = properties.getScoring();
        Region region = territoryService.getRegion(regionId);

        double weighted = populationScore(region) * scoring.getPopulationWeight()
                + resourceScore(region) * scoring.getResourceWeight()
                + levelScore(region) * scoring.getLevelWeight();
        double weightSum = scoring.getPopulationWeight() + scoring.getResourceWeight()
                + scoring.getLevelWeight();
        return weightSum > 0 ? weighted / weightSum * 100.0 : 0.0;
    }

    /**
     * Regions ordered by descending overall score; equal scores keep ascending region id.
     */
    public List<ScoreRecord> rank(List<Integer> regionIds, String forPlayer) {
        return regionIds.stream()
                .map(id -> scoreRegion(id, forPlayer))
                .sorted(Comparator.comparingDouble(ScoreRecord::overallScore).reversed()
                        .thenComparingInt(ScoreRecord::regionId))
                .toList();
    }

    /**
     * Base score plus the mover's jitter minus the movement cost of getting there.
     *
     * @return the adjusted score, or empty when the mover has no route to the region
     */
    public OptionalDouble scoreForArmy(Mover mover, int regionId) {
        PathResult path = pathPlanner.shortestPath(mover.getRegionId(), regionId, mover.getPlayerId());
        if (!path.success()) {
            log.debug("{} has no route to region {}", mover.getName(), regionId);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(adjustedScore(mover, regionId, path.cost()));
    }

    /**
     * {@code base + jitter - mpCost} for a route whose cost is already known.
     */
    public double adjustedScore(Mover mover, int regionId, int mpCost) {
        return scoreRegionBase(regionId) + jitter(mover.getId(), regionId) - mpCost;
    }

    /**
     * Reproducible perturbation in [-amplitude, +amplitude], seeded from the stable mover id and
     * the region so the same army always sees the same value for the same target.
     */
    public double jitter(String moverId, int regionId) {
        double amplitude = properties.getJitter().getAmplitude();
        if (amplitude <= 0) {
            return 0.0;
        }
        long seed = properties.getJitter().getSeed() ^ ((long) moverId.hashCode() << 32 | (regionId & 0xffffffffL));
        Random random = new Random(seed);
        return (random.nextDouble() * 2.0 - 1.0) * amplitude;
    }

    double populationScore(Region region) {
        AIProperties.Scoring scoring = properties.getScoring();
        return normalize(region.getPopulation(), scoring.getPopulationBandMin(), scoring.getPopulationBandMax());
    }

    double resourceScore(Region region) {
        AIProperties.Scoring scoring = properties.getScoring();
        Map<ResourceType, Integer> maxima = scoring.getResourceMaxima();

        double weighted = 0.0;
        double weightTotal = 0.0;
        for (Map.Entry<ResourceType, Double> entry : scoring.getResourceWeights().entrySet()) {
            ResourceType type = entry.getKey();
            if (type.isTreasury()) {
                continue;
            }
            weighted += normalize(region.resourceAmount(type), 0, maxima.getOrDefault(type, 0)) * entry.getValue();
            weightTotal += entry.getValue();
        }
        double primary = weightTotal > 0 ? weighted / weightTotal : 0.0;

        double treasury = normalize(region.resourceAmount(ResourceType.GOLD), 0,
                maxima.getOrDefault(ResourceType.GOLD, 0)) / scoring.getTreasuryDivisor();

        double share = scoring.getPrimaryResourceShare();
        return primary * share + treasury * (1.0 - share);
    }

    double levelScore(Region region) {
        return (region.getLevel().tier() - 1) / (double) (TOP_TIER - 1);
    }

    double ownershipScore(Region region, String forPlayer) {
        AIProperties.Scoring scoring = properties.getScoring();
        if (region.isNeutral()) {
            return scoring.getOwnershipNeutral();
        }
        return region.isOwnedBy(forPlayer) ? scoring.getOwnershipOwn() : scoring.getOwnershipRival();
    }

    private static double normalize(double value, double min, double max) {
        if (max <= min) {
            return 0.0;
        }
        double scaled = (value - min) / (max - min);
        return Math.max(0.0, Math.min(1.0, scaled));
    }
}
