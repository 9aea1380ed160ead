package com.vikings.websocket;

import com.vikings.cpu.TurnEvent;
import com.vikings.cpu.TurnEventListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards every AI turn event to the player's WebSocket topic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnEventBroadcaster implements TurnEventListener {

    static final String TOPIC_PREFIX = "/topic/ai/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onTurnEvent(TurnEvent event) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + event.playerId(), event);
            log.debug("Broadcast {} for player {}", event.type(), event.playerId());
        } catch (RuntimeException e) {
            log.error("Error broadcasting {} for player {}", event.type(), event.playerId(), e);
        }
    }
}
