package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One command shown in a progress history. Immutable: completing a command
 * produces a new instance that replaces the running one.
 *
 * @param id correlation id supplied by the event source; null when it sent none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record CommandExecution(
        String        id,
        String        command,
        CommandStatus status,
        String        summary,
        String        output,
        Instant       timestamp
) {

    public static CommandExecution running(String id, String command, Instant timestamp) {
        return new CommandExecution(id, command, CommandStatus.RUNNING, null, null, timestamp);
    }

    public CommandExecution complete(CommandStatus outcome, String summary, String output) {
        return new CommandExecution(id, command, outcome, summary, output, timestamp);
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == CommandStatus.RUNNING;
    }
}
