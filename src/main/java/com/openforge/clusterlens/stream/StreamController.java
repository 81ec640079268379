package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clusterlens.websocket.PhaseEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

/**
 * REST API for agent push-feed subscriptions.
 *
 *   POST   /api/streams/{queryId}  — open (or reopen) the feed; phases go to /topic/stream/{queryId}
 *   DELETE /api/streams/{queryId}  — close it
 */
@RestController
@RequestMapping("/api/streams")
@RequiredArgsConstructor
public class StreamController {

    private final AgentStreamService streams;

    @PostMapping("/{queryId}")
    public ResponseEntity<SubscriptionResponse> subscribe(@PathVariable String queryId) {
        if (queryId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "queryId must not be blank");
        }
        StreamSession session = streams.subscribe(queryId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubscriptionResponse(queryId, PhaseEventPublisher.STREAM_TOPIC + queryId, session.openedAt()));
    }

    @DeleteMapping("/{queryId}")
    public ResponseEntity<Void> unsubscribe(@PathVariable String queryId) {
        if (!streams.unsubscribe(queryId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No open stream for query: " + queryId);
        }
        return ResponseEntity.noContent().build();
    }

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record SubscriptionResponse(String queryId, String wsSubscribePath, Instant openedAt) {}
}
