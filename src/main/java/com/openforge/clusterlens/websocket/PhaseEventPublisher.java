package com.openforge.clusterlens.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Thin facade over SimpMessagingTemplate that routes events to the STOMP
 * topic of their channel.
 *
 * Topic layout:
 *   /topic/investigation/{sessionId}  → everything for one investigation session
 *   /topic/stream/{queryId}           → normalized phases of one agent push feed
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PhaseEventPublisher {

    public static final String INVESTIGATION_TOPIC = "/topic/investigation/";
    public static final String STREAM_TOPIC        = "/topic/stream/";

    private final SimpMessagingTemplate messagingTemplate;

    public void publishInvestigation(InvestigationEvent event) {
        publish(INVESTIGATION_TOPIC + event.channelId(), event);
    }

    public void publishStream(InvestigationEvent event) {
        publish(STREAM_TOPIC + event.channelId(), event);
    }

    /**
     * Fire-and-forget; the loop or feed reader is never blocked by slow consumers.
     */
    private void publish(String destination, InvestigationEvent event) {
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            // Delivery failures must not end an investigation or a feed
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
