package com.vikings.controller;

import com.vikings.config.AIProperties;
import com.vikings.cpu.TurnPacer;
import com.vikings.cpu.path.PathPlanner;
import com.vikings.cpu.path.PathResult;
import com.vikings.cpu.scoring.ScoreRecord;
import com.vikings.cpu.scoring.TargetScorer;
import com.vikings.dto.ReachabilityDTO;
import com.vikings.service.AITurnService;
import com.vikings.service.TerritoryService;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST API for inspecting the AI's planning and for starting AI turns.
 */
@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
@Validated
@Slf4j
@CrossOrigin(origins = "*")
public class PlanningController {

    private final PathPlanner pathPlanner;
    private final TargetScorer targetScorer;
    private final TerritoryService territoryService;
    private final AITurnService aiTurnService;
    private final TurnPacer turnPacer;
    private final AIProperties properties;

    /**
     * Regions a player can reach from a region within a horizon (defaults to the configured one).
     */
    @GetMapping("/regions/{regionId}/reachable")
    public ResponseEntity<ReachabilityDTO> getReachableRegions(
            @PathVariable int regionId,
            @RequestParam @NotBlank String player,
            @RequestParam(required = false) @Min(0) Integer horizon) {
        int effectiveHorizon = horizon != null ? horizon : properties.getSearch().getDefaultHorizon();
        return ResponseEntity.ok(ReachabilityDTO.fromSet(
                pathPlanner.reachableRegions(regionId, player, effectiveHorizon),
                territoryService::getRegion));
    }

    /**
     * Cheapest route between two regions. An unreachable target is a normal response with
     * {@code success=false}.
     */
    @GetMapping("/path")
    public ResponseEntity<PathResult> getShortestPath(
            @RequestParam int from,
            @RequestParam int to,
            @RequestParam @NotBlank String player) {
        return ResponseEntity.ok(pathPlanner.shortestPath(from, to, player));
    }

    @GetMapping("/regions/{regionId}/score")
    public ResponseEntity<ScoreRecord> getRegionScore(
            @PathVariable int regionId,
            @RequestParam @NotBlank String player) {
        return ResponseEntity.ok(targetScorer.scoreRegion(regionId, player));
    }

    @GetMapping("/regions/{regionId}/base-score")
    public ResponseEntity<Map<String, Object>> getRegionBaseScore(@PathVariable int regionId) {
        return ResponseEntity.ok(Map.of(
                "regionId", regionId,
                "baseScore", targetScorer.scoreRegionBase(regionId)));
    }

    /**
     * Ranks the given regions for a player, or the player's frontier when none are given.
     */
    @GetMapping("/ranking")
    public ResponseEntity<List<ScoreRecord>> getRanking(
            @RequestParam @NotBlank String player,
            @RequestParam(required = false) List<Integer> regions) {
        List<Integer> candidates = regions != null && !regions.isEmpty()
                ? regions
                : new ArrayList<>(territoryService.frontierRegions(player));
        return ResponseEntity.ok(targetScorer.rank(candidates, player));
    }

    /**
     * Start an AI turn for the player in the background. Refused while any player's turn runs.
     */
    @PostMapping("/turns/{playerId}")
    public ResponseEntity<Map<String, String>> startTurn(@PathVariable @NotBlank String playerId) {
        if (aiTurnService.isTurnRunning()) {
            String running = aiTurnService.runningPlayer().orElse(playerId);
            throw new IllegalStateException("AI turn already running for player " + running);
        }
        log.info("Starting AI turn for player {}", playerId);
        aiTurnService.playTurn(playerId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "started", "playerId", playerId));
    }

    /**
     * Let a suspended AI turn continue with its next move.
     */
    @PostMapping("/turns/resume")
    public ResponseEntity<Void> resumeTurn() {
        turnPacer.resume();
        return ResponseEntity.noContent().build();
    }
}
