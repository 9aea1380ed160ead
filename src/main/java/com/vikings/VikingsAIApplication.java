package com.vikings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main entry point for the Vikings AI turn engine.
 *
 * Features:
 * - Movement-point bounded path planning over the region graph
 * - Region desirability scoring
 * - Turn-by-turn AI orchestration with battle interruption
 * - Live turn events via WebSockets
 */
@SpringBootApplication
@EnableAsync
public class VikingsAIApplication {

    public static void main(String[] args) {
        SpringApplication.run(VikingsAIApplication.class, args);
    }
}
