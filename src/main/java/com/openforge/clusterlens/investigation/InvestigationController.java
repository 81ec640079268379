package com.openforge.clusterlens.investigation;

import com.openforge.clusterlens.investigation.diagnostic.TargetResource;
import com.openforge.clusterlens.investigation.dto.AskRequest;
import com.openforge.clusterlens.investigation.dto.InvestigationResponse;
import com.openforge.clusterlens.investigation.dto.StartInvestigationRequest;
import com.openforge.clusterlens.investigation.dto.ToolResponse;
import com.openforge.clusterlens.investigation.tool.ToolCatalog;
import com.openforge.clusterlens.websocket.PhaseEventPublisher;
import com.openforge.clusterlens.websocket.PhaseThrottlerFactory;
import com.openforge.clusterlens.websocket.PublishingInvestigationListener;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * REST API for investigation sessions.
 *
 * Endpoints:
 *   GET    /api/investigations/tools            — the tool catalog
 *   POST   /api/investigations                  — open a session for one resource
 *   GET    /api/investigations/{id}             — state, transcript, last result
 *   POST   /api/investigations/{id}/questions   — start a turn; 409 while one is running
 *   POST   /api/investigations/{id}/cancel      — cancel the running turn
 *   DELETE /api/investigations/{id}             — cancel and forget the session
 *
 * WebSocket subscription (returned in every response):
 *   /topic/investigation/{sessionId} receives throttled phases, transcript
 *   messages and the terminal result while a turn runs.
 */
@Slf4j
@RestController
@RequestMapping("/api/investigations")
@RequiredArgsConstructor
public class InvestigationController {

    private final InvestigationOrchestrator    orchestrator;
    private final InvestigationSessionRegistry registry;
    private final PhaseEventPublisher          publisher;
    private final PhaseThrottlerFactory        throttlers;
    private final ExecutorService              investigationExecutor;

    // ── Catalog ──────────────────────────────────────────────────────────────

    @GetMapping("/tools")
    public List<ToolResponse> tools() {
        return Arrays.stream(ToolCatalog.values()).map(ToolResponse::from).toList();
    }

    // ── Open ─────────────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<InvestigationResponse> open(@Valid @RequestBody StartInvestigationRequest request) {
        TargetResource target = new TargetResource(request.kind().trim(),
                request.namespace() == null ? "" : request.namespace().trim(),
                request.name().trim());
        InvestigationSession session = registry.open(target);
        return ResponseEntity.status(HttpStatus.CREATED).body(InvestigationResponse.from(session));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<InvestigationResponse> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(InvestigationResponse.from(findOrThrow(sessionId)));
    }

    // ── Ask ──────────────────────────────────────────────────────────────────

    /**
     * Starts one investigation turn on the shared executor.
     * HTTP 202: progress and the answer arrive over WebSocket, or by polling GET.
     */
    @PostMapping("/{sessionId}/questions")
    public ResponseEntity<InvestigationResponse> ask(@PathVariable String sessionId,
                                                     @Valid @RequestBody AskRequest request) {
        InvestigationSession session = findOrThrow(sessionId);
        PublishingInvestigationListener listener =
                new PublishingInvestigationListener(session, publisher, throttlers);
        try {
            orchestrator.start(session, request.question().trim(), listener, investigationExecutor)
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.error("[Controller] Uncaught exception in loop for session {}: {}",
                                    sessionId, error.getMessage(), error);
                        }
                    });
        } catch (InvestigationBusyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        log.info("[Controller] Question accepted for session {}", sessionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(InvestigationResponse.from(session));
    }

    // ── Cancel & close ───────────────────────────────────────────────────────

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<InvestigationResponse> cancel(@PathVariable String sessionId) {
        InvestigationSession session = findOrThrow(sessionId);
        if (!session.cancel()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Investigation is not running, current state: " + session.state());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(InvestigationResponse.from(session));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<InvestigationResponse> close(@PathVariable String sessionId) {
        InvestigationSession session = registry.close(sessionId)
                .orElseThrow(() -> notFound(sessionId));
        return ResponseEntity.ok(InvestigationResponse.from(session));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private InvestigationSession findOrThrow(String sessionId) {
        return registry.find(sessionId).orElseThrow(() -> notFound(sessionId));
    }

    private static ResponseStatusException notFound(String sessionId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Investigation not found: " + sessionId);
    }
}
