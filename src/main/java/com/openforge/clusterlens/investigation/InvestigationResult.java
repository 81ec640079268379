package com.openforge.clusterlens.investigation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clusterlens.llm.ModelFailureClassifier;

/**
 * Terminal value of one investigation turn.
 *
 * @param answer       the final assistant message (answer, canned failure text or cancellation notice)
 * @param failureKind  set only for ABORTED
 * @param iterations   follow-up rounds used, 0..maxIterations
 * @param modelCalls   model calls made, at most maxIterations + 1
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record InvestigationResult(
        InvestigationState          state,
        String                      answer,
        ModelFailureClassifier.Kind failureKind,
        int                         iterations,
        int                         modelCalls
) {

    public static InvestigationResult complete(String answer, int iterations, int modelCalls) {
        return new InvestigationResult(InvestigationState.COMPLETE, answer, null, iterations, modelCalls);
    }

    public static InvestigationResult aborted(ModelFailureClassifier.ModelFailure failure, int iterations, int modelCalls) {
        return new InvestigationResult(InvestigationState.ABORTED, failure.message(), failure.kind(), iterations, modelCalls);
    }

    public static InvestigationResult cancelled(String message, int iterations, int modelCalls) {
        return new InvestigationResult(InvestigationState.CANCELLED, message, null, iterations, modelCalls);
    }
}
