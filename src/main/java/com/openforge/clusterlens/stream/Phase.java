package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * Immutable progress snapshot pushed to the dashboard.
 *
 * commandHistory is the full history at the time of the snapshot, so a
 * consumer that only sees the latest phase still sees every command.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record Phase(
        PhaseKind              kind,
        String                 message,
        String                 currentStep,
        Integer                stepsCompleted,
        Integer                totalSteps,
        List<CommandExecution> commandHistory,
        List<String>           suggestions
) {

    public Phase {
        commandHistory = commandHistory == null ? List.of() : List.copyOf(commandHistory);
        suggestions    = suggestions == null ? null : List.copyOf(suggestions);
    }

    public static Phase of(PhaseKind kind, String message, List<CommandExecution> history) {
        return Phase.builder().kind(kind).message(message).commandHistory(history).build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return kind != null && kind.isTerminal();
    }
}
