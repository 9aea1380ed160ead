package com.vikings.controller;

import com.vikings.config.AIProperties;
import com.vikings.cpu.TurnPacer;
import com.vikings.cpu.path.PathPlanner;
import com.vikings.cpu.path.PathResult;
import com.vikings.cpu.path.ReachabilitySet;
import com.vikings.cpu.scoring.ScoreRecord;
import com.vikings.cpu.scoring.TargetScorer;
import com.vikings.dto.ReachabilityDTO;
import com.vikings.model.Region;
import com.vikings.service.AITurnService;
import com.vikings.service.TerritoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PlanningController REST API.
 */
@ExtendWith(MockitoExtension.class)
class PlanningControllerTest {

    @Mock private PathPlanner pathPlanner;
    @Mock private TargetScorer targetScorer;
    @Mock private TerritoryService territoryService;
    @Mock private AITurnService aiTurnService;
    @Mock private TurnPacer turnPacer;

    private AIProperties properties;
    private PlanningController controller;

    @BeforeEach
    void setUp() {
        properties = new AIProperties();
        controller = new PlanningController(pathPlanner, targetScorer, territoryService, aiTurnService,
                turnPacer, properties);
    }

    @Nested
    @DisplayName("planning queries")
    class QueryTests {

        @Test
        @DisplayName("reachable regions should use the configured horizon when none is given")
        void shouldUseDefaultHorizon(@Mock ReachabilitySet reachable) {
            when(pathPlanner.reachableRegions(1, "norse", 12)).thenReturn(reachable);
            when(reachable.regionIds()).thenReturn(List.of(1, 3));
            when(reachable.costOf(1)).thenReturn(OptionalInt.of(0));
            when(reachable.costOf(3)).thenReturn(OptionalInt.of(3));
            when(reachable.pathTo(1)).thenReturn(List.of(1));
            when(reachable.pathTo(3)).thenReturn(List.of(1, 3));
            when(reachable.getStart()).thenReturn(1);
            when(reachable.getHorizon()).thenReturn(12);
            when(territoryService.getRegion(1)).thenReturn(Region.builder().id(1).name("Jelling").build());
            when(territoryService.getRegion(3)).thenReturn(Region.builder().id(3).name("Aarhus").build());

            ResponseEntity<ReachabilityDTO> response = controller.getReachableRegions(1, "norse", null);

            assertEquals(HttpStatus.OK, response.getStatusCode());
            ReachabilityDTO body = response.getBody();
            assertNotNull(body);
            assertEquals(12, body.getHorizon());
            assertFalse(body.isTruncated());
            assertEquals(2, body.getRegions().size());
            assertEquals("Aarhus", body.getRegions().get(1).getName());
            assertEquals(3, body.getRegions().get(1).getCost());
            assertEquals(List.of(1, 3), body.getRegions().get(1).getPath());
        }

        @Test
        @DisplayName("explicit horizon should be passed through")
        void shouldPassExplicitHorizon(@Mock ReachabilitySet reachable) {
            when(pathPlanner.reachableRegions(0, "norse", 4)).thenReturn(reachable);
            when(reachable.regionIds()).thenReturn(List.of());

            controller.getReachableRegions(0, "norse", 4);

            verify(pathPlanner).reachableRegions(0, "norse", 4);
        }

        @Test
        @DisplayName("unreachable path should still be a 200 with success=false")
        void shouldReturnUnreachablePath() {
            when(pathPlanner.shortestPath(0, 11, "norse")).thenReturn(PathResult.unreachable());

            ResponseEntity<PathResult> response = controller.getShortestPath(0, 11, "norse");

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertFalse(response.getBody().success());
        }

        @Test
        @DisplayName("score endpoints should delegate to the scorer")
        void shouldReturnScores() {
            ScoreRecord record = new ScoreRecord(2, 0.7, 0.4, 0.75, 0.8, 0.6);
            when(targetScorer.scoreRegion(2, "norse")).thenReturn(record);
            when(targetScorer.scoreRegionBase(2)).thenReturn(55.0);

            assertSame(record, controller.getRegionScore(2, "norse").getBody());
            Map<String, Object> base = controller.getRegionBaseScore(2).getBody();
            assertEquals(2, base.get("regionId"));
            assertEquals(55.0, base.get("baseScore"));
        }

        @Test
        @DisplayName("ranking without regions should rank the player's frontier")
        void shouldRankFrontierByDefault() {
            when(territoryService.frontierRegions("norse")).thenReturn(new TreeSet<>(List.of(3, 2)));
            when(targetScorer.rank(List.of(2, 3), "norse")).thenReturn(List.of());

            controller.getRanking("norse", null);

            verify(targetScorer).rank(List.of(2, 3), "norse");
        }

        @Test
        @DisplayName("ranking with regions should rank exactly those")
        void shouldRankGivenRegions() {
            when(targetScorer.rank(List.of(9, 4), "norse")).thenReturn(List.of());

            controller.getRanking("norse", List.of(9, 4));

            verify(territoryService, never()).frontierRegions(anyString());
        }
    }

    @Nested
    @DisplayName("turn control")
    class TurnControlTests {

        @Test
        @DisplayName("should start a turn and answer 202")
        void shouldStartTurn() {
            when(aiTurnService.isTurnRunning()).thenReturn(false);

            ResponseEntity<Map<String, String>> response = controller.startTurn("norse");

            assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
            assertEquals("started", response.getBody().get("status"));
            verify(aiTurnService).playTurn("norse");
        }

        @Test
        @DisplayName("should refuse a turn while another player's turn holds the world")
        void shouldRefuseRunningTurn() {
            when(aiTurnService.isTurnRunning()).thenReturn(true);
            when(aiTurnService.runningPlayer()).thenReturn(Optional.of("saxons"));

            IllegalStateException ex = assertThrows(IllegalStateException.class, () -> controller.startTurn("norse"));
            assertEquals("AI turn already running for player saxons", ex.getMessage());
            verify(aiTurnService, never()).playTurn("norse");
        }

        @Test
        @DisplayName("resume should release the pacer")
        void shouldResume() {
            ResponseEntity<Void> response = controller.resumeTurn();

            assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
            verify(turnPacer).resume();
        }
    }
}
