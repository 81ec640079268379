package com.openforge.clusterlens.investigation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clusterlens.investigation.InvestigationResult;
import com.openforge.clusterlens.investigation.InvestigationSession;
import com.openforge.clusterlens.investigation.Message;
import com.openforge.clusterlens.investigation.diagnostic.TargetResource;
import com.openforge.clusterlens.websocket.PhaseEventPublisher;

import java.time.Instant;
import java.util.List;

/**
 * Response body for the investigation endpoints.
 *
 * camelCase is pinned here because the global ObjectMapper writes snake_case
 * for the model wire format.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record InvestigationResponse(

        @JsonProperty("sessionId")       String              sessionId,
        @JsonProperty("target")          TargetResource      target,
        @JsonProperty("state")           String              state,
        @JsonProperty("running")         boolean             running,
        @JsonProperty("iteration")       int                 iteration,
        @JsonProperty("transcript")      List<Message>       transcript,
        @JsonProperty("lastResult")      InvestigationResult lastResult,
        @JsonProperty("wsSubscribePath") String              wsSubscribePath,
        @JsonProperty("createdAt")       Instant             createdAt
) {

    public static InvestigationResponse from(InvestigationSession session) {
        return new InvestigationResponse(
                session.id(),
                session.target(),
                session.state().name(),
                session.isRunning(),
                session.iteration(),
                session.transcript().messages(),
                session.lastResult(),
                PhaseEventPublisher.INVESTIGATION_TOPIC + session.id(),
                session.createdAt()
        );
    }
}
