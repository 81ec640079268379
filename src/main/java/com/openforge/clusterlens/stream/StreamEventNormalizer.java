package com.openforge.clusterlens.stream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the agent's noisy event vocabulary into dashboard phases.
 *
 * Event mapping:
 *   planning, supervisor                          → planning
 *   executing, tool_call, command, command_start  → executing (currentStep = command / tool)
 *   command_complete, tool_result                 → executing, history entry completed
 *   analyzing, reflection, synthesizing           → analyzing
 *   kb_search, plan_decision                      → analyzing, message built from data
 *   plan_progress                                 → executing with step counts
 *   done / error                                  → complete / error
 *   progress                                      → inferred from message keywords
 *   debug, internal, anything else                → nothing
 *
 * The command history is updated by every event, whether or not the phase
 * built from it is ever delivered. One instance per stream; not thread-safe.
 */
@Slf4j
public class StreamEventNormalizer {

    static final String CONNECTION_LOST = "Lost connection to agent";

    private static final Set<String> COMMAND_STARTS    = Set.of("command_start", "executing");
    private static final Set<String> COMMAND_COMPLETES = Set.of("command_complete", "tool_result");
    private static final List<String> CORRELATION_KEYS = List.of("command_id", "call_id", "id");

    private static final String EXECUTING_DEFAULT = "Executing kubectl commands...";

    private final Clock                  clock;
    private final List<CommandExecution> history = new ArrayList<>();

    public StreamEventNormalizer() {
        this(Clock.systemUTC());
    }

    public StreamEventNormalizer(Clock clock) {
        this.clock = clock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Records the event in the command history and maps it to a phase.
     *
     * @return empty for suppressed event types
     */
    public Optional<Phase> normalize(RawAgentEvent event) {
        String type = event.type() == null ? "" : event.type();
        if (COMMAND_STARTS.contains(type)) {
            startCommand(event);
        } else if (COMMAND_COMPLETES.contains(type)) {
            completeCommand(event);
        }

        return switch (type) {
            case "planning", "supervisor" -> phase(PhaseKind.PLANNING,
                    event.messageText().orElse("Creating investigation plan..."));

            case "executing", "tool_call", "command", "command_start" -> Optional.of(Phase.builder()
                    .kind(PhaseKind.EXECUTING)
                    .message(event.messageText().orElse(EXECUTING_DEFAULT))
                    .currentStep(event.dataText("command").or(() -> event.dataText("tool")).orElse(null))
                    .commandHistory(history)
                    .build());

            case "command_complete", "tool_result" -> phase(PhaseKind.EXECUTING, EXECUTING_DEFAULT);

            case "analyzing", "reflection", "synthesizing" -> phase(PhaseKind.ANALYZING,
                    event.messageText().orElse("Analyzing results..."));

            case "kb_search" -> phase(PhaseKind.ANALYZING, knowledgeBaseMessage(event.data()));

            case "plan_decision" -> phase(PhaseKind.ANALYZING, planDecisionMessage(event));

            case "plan_progress" -> Optional.of(Phase.builder()
                    .kind(PhaseKind.EXECUTING)
                    .message("Executing investigation plan")
                    .stepsCompleted(intField(event.data(), "completed", 0))
                    .totalSteps(intField(event.data(), "total", 1))
                    .commandHistory(history)
                    .build());

            case "done" -> Optional.of(Phase.builder()
                    .kind(PhaseKind.COMPLETE)
                    .message("Investigation complete")
                    .commandHistory(history)
                    .suggestions(suggestions(event.data()))
                    .build());

            case "error" -> phase(PhaseKind.ERROR, event.messageText().orElse("An error occurred"));

            case "progress" -> {
                String message = event.messageText().orElse("");
                yield phase(inferKind(message), message);
            }

            default -> {
                log.trace("[StreamNormalizer] Suppressed event type '{}'", type);
                yield Optional.empty();
            }
        };
    }

    /** Terminal phase for a feed that broke before a done or error event. */
    public Phase connectionLost() {
        return Phase.of(PhaseKind.ERROR, CONNECTION_LOST, history);
    }

    /** Forgets the command history; called when a new stream starts. */
    public void reset() {
        history.clear();
    }

    public List<CommandExecution> history() {
        return List.copyOf(history);
    }

    // ── Command history ──────────────────────────────────────────────────────

    private void startCommand(RawAgentEvent event) {
        String command = event.dataText("command")
                .or(() -> event.dataText("tool"))
                .orElse("Unknown command");
        history.add(CommandExecution.running(correlationId(event).orElse(null), command, clock.instant()));
    }

    private void completeCommand(RawAgentEvent event) {
        Optional<String> id = correlationId(event);
        int slot = id.map(this::runningSlotWithId).orElse(-1);
        if (slot < 0) {
            slot = lastRunningSlot();
        }
        if (slot < 0) {
            log.debug("[StreamNormalizer] Completion without a running command (id={})", id.orElse("none"));
            return;
        }

        CommandExecution running = history.get(slot);
        String output = event.dataText("output").or(() -> event.dataText("result")).orElse(null);
        CommandStatus status = event.data() != null && event.data().hasNonNull("error")
                ? CommandStatus.ERROR
                : CommandStatus.SUCCESS;
        String summary = event.dataText("summary")
                .orElseGet(() -> CommandSummaries.summarize(output,
                        event.dataText("command").orElse(running.command())));
        history.set(slot, running.complete(status, summary, output));
    }

    private int runningSlotWithId(String id) {
        for (int i = history.size() - 1; i >= 0; i--) {
            CommandExecution entry = history.get(i);
            if (entry.isRunning() && id.equals(entry.id())) {
                return i;
            }
        }
        return -1;
    }

    private int lastRunningSlot() {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isRunning()) {
                return i;
            }
        }
        return -1;
    }

    private static Optional<String> correlationId(RawAgentEvent event) {
        for (String key : CORRELATION_KEYS) {
            Optional<String> id = event.dataText(key);
            if (id.isPresent()) {
                return id;
            }
        }
        return Optional.empty();
    }

    // ── Message builders ─────────────────────────────────────────────────────

    private static String knowledgeBaseMessage(JsonNode data) {
        String query = data == null ? "" : data.path("query").asText("");
        boolean hasResults = data != null && data.path("has_results").asBoolean(false);
        return hasResults
                ? "📚 Found %d KB entries for: \"%s\"".formatted(data.path("results_found").asInt(0), query)
                : "📚 No KB entries found for: \"%s\"".formatted(query);
    }

    private static String planDecisionMessage(RawAgentEvent event) {
        JsonNode data = event.data();
        double confidence = data == null ? 0 : data.path("confidence").asDouble(0);
        return "🧠 Plan: %s (confidence: %d%%) using %s".formatted(
                event.dataText("action").orElse("unknown"),
                Math.round(confidence * 100),
                event.dataText("model_used").orElse("LLM"));
    }

    static PhaseKind inferKind(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (containsAny(lower, "brain", "reasoning", "planner", "supervisor")) {
            return PhaseKind.PLANNING;
        }
        if (containsAny(lower, "executing", "python", "running", "kubectl")) {
            return PhaseKind.EXECUTING;
        }
        return PhaseKind.ANALYZING;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> suggestions(JsonNode data) {
        List<String> out = new ArrayList<>();
        if (data != null && data.path("suggested_next_steps").isArray()) {
            data.get("suggested_next_steps").forEach(step -> out.add(step.asText()));
        }
        return out;
    }

    private static int intField(JsonNode data, String field, int fallback) {
        if (data == null || !data.hasNonNull(field)) {
            return fallback;
        }
        int value = data.get(field).asInt(fallback);
        return value == 0 ? fallback : value;
    }

    private Optional<Phase> phase(PhaseKind kind, String message) {
        return Optional.of(Phase.of(kind, message, history));
    }
}
