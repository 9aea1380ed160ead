package com.vikings.cpu.scoring;

/**
 * Desirability of a region for one player, broken down by factor. Sub-scores are in [0, 1].
 */
public record ScoreRecord(
        int regionId,
        double populationScore,
        double resourceScore,
        double levelScore,
        double ownershipScore,
        double overallScore
) {}
