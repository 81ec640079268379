package com.openforge.clusterlens.investigation;

import com.openforge.clusterlens.config.InvestigationProperties;
import com.openforge.clusterlens.investigation.tool.CommandParser;
import com.openforge.clusterlens.investigation.tool.ParsedReply;
import com.openforge.clusterlens.investigation.tool.ToolDispatcher;
import com.openforge.clusterlens.investigation.tool.ToolInvocation;
import com.openforge.clusterlens.investigation.tool.ToolOutcome;
import com.openforge.clusterlens.llm.ModelFailureClassifier;
import com.openforge.clusterlens.stream.CommandExecution;
import com.openforge.clusterlens.stream.CommandStatus;
import com.openforge.clusterlens.stream.Phase;
import com.openforge.clusterlens.stream.PhaseKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * The autonomous investigation loop for one question about one resource.
 *
 * Loop shape:
 *   1. ASK      — first prompt (target + question), history as it stood before the question
 *   2. PARSE    — no TOOL: lines? → the reply is the final answer, DONE
 *   3. ACT      — run every requested tool in order, one tool Message each
 *   4. ANALYZE  — send the combined results back to the model, iteration + 1
 *   5. CHECK    — at maxIterations a reply that still asks for tools is taken as the answer
 *
 * So a turn makes at most maxIterations + 1 model calls. A failing model call
 * aborts the turn with one canned explanation; tool failures never do. The
 * cancellation token is checked before every model call and every tool call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvestigationOrchestrator {

    static final String CANCELLED_MESSAGE = "Investigation cancelled";

    private final ModelInference          model;
    private final CommandParser           parser;
    private final ToolDispatcher          dispatcher;
    private final ModelFailureClassifier  failureClassifier;
    private final InvestigationProperties properties;

    // ── Entry points ─────────────────────────────────────────────────────────

    /**
     * Claims the session on the caller's thread, then runs the loop on the executor.
     *
     * @throws InvestigationBusyException if the session is already running a turn
     */
    public CompletableFuture<InvestigationResult> start(InvestigationSession session,
                                                        String question,
                                                        InvestigationListener listener,
                                                        Executor executor) {
        session.begin();
        try {
            return CompletableFuture.supplyAsync(() -> runClaimed(session, question, listener), executor);
        } catch (RejectedExecutionException e) {
            session.finish(InvestigationResult.cancelled(CANCELLED_MESSAGE, 0, 0));
            throw e;
        }
    }

    /** Synchronous variant: claims the session and runs the loop on the calling thread. */
    public InvestigationResult investigate(InvestigationSession session,
                                           String question,
                                           InvestigationListener listener) {
        session.begin();
        return runClaimed(session, question, listener);
    }

    // ── Main loop ────────────────────────────────────────────────────────────

    private InvestigationResult runClaimed(InvestigationSession session,
                                           String question,
                                           InvestigationListener listener) {
        String sessionId = session.id();
        Turn turn = new Turn(session, listener);
        InvestigationResult result = null;
        log.info("[Investigation:{}] Question about {}: {}", sessionId, session.target().display(), question);

        try {
            List<Message> priorHistory = session.transcript().conversationHistory();
            turn.append(Message.user(question));

            turn.phase(PhaseKind.PLANNING, "🤔 Thinking...", null, null, null);
            String reply = turn.callModel(
                    InvestigationPrompts.firstPrompt(session.target(), question),
                    InvestigationPrompts.systemPrompt(),
                    priorHistory);

            int maxIterations = properties.maxIterations();
            while (true) {
                session.transition(InvestigationState.PARSING_TOOLS);
                ParsedReply parsed = parser.parse(reply);

                if (!parsed.requestsTools()) {
                    result = turn.complete(reply);
                    break;
                }
                if (turn.iteration >= maxIterations) {
                    log.warn("[Investigation:{}] Reached {} iterations with {} tool request(s) pending; "
                            + "using the last reply as the answer", sessionId, maxIterations, parsed.invocations().size());
                    result = turn.complete(reply);
                    break;
                }

                // ── Act ──────────────────────────────────────────────────────
                if (!parsed.reasoning().isBlank()) {
                    turn.append(Message.assistant(parsed.reasoning()));
                }
                session.transition(InvestigationState.EXECUTING_TOOLS);
                String combined = turn.runTools(parsed.invocations());

                // ── Analyze ──────────────────────────────────────────────────
                turn.iteration++;
                session.iteration(turn.iteration);
                String prompt = turn.iteration == 1
                        ? InvestigationPrompts.analysisPrompt(combined, question)
                        : InvestigationPrompts.continuePrompt(combined);
                turn.phase(PhaseKind.ANALYZING,
                        "🧠 Analyzing results... (step %d)".formatted(turn.iteration), null, null, null);
                reply = turn.callModel(prompt,
                        InvestigationPrompts.iterativeSystemPrompt(),
                        session.transcript().conversationHistory());
            }

        } catch (CancellationToken.CancelledException e) {
            log.info("[Investigation:{}] Cancelled after {} model call(s)", sessionId, turn.modelCalls);
            turn.append(Message.assistant(CANCELLED_MESSAGE));
            result = InvestigationResult.cancelled(CANCELLED_MESSAGE, turn.iteration, turn.modelCalls);

        } catch (ModelCallFailedException e) {
            ModelFailureClassifier.ModelFailure failure = failureClassifier.classify(e.getCause());
            log.error("[Investigation:{}] Model call failed ({}): {}",
                    sessionId, failure.kind(), e.getCause().getMessage());
            turn.append(Message.assistant(failure.message()));
            result = InvestigationResult.aborted(failure, turn.iteration, turn.modelCalls);

        } catch (RuntimeException e) {
            log.error("[Investigation:{}] Loop failed unexpectedly", sessionId, e);
            ModelFailureClassifier.ModelFailure failure = failureClassifier.classify(e);
            turn.append(Message.assistant(failure.message()));
            result = InvestigationResult.aborted(failure, turn.iteration, turn.modelCalls);

        } finally {
            if (result == null) {
                result = InvestigationResult.cancelled(CANCELLED_MESSAGE, turn.iteration, turn.modelCalls);
            }
            session.finish(result);
        }

        log.info("[Investigation:{}] Finished: state={} iterations={} modelCalls={}",
                sessionId, result.state(), result.iterations(), result.modelCalls());
        turn.finished(result);
        return result;
    }

    // ── Per-turn state ───────────────────────────────────────────────────────

    /** Mutable bookkeeping of one turn; confined to the loop thread. */
    private final class Turn {

        private final InvestigationSession   session;
        private final InvestigationListener  listener;
        private final CancellationToken      token;
        private final List<CommandExecution> history = new ArrayList<>();
        private int iteration;
        private int modelCalls;

        Turn(InvestigationSession session, InvestigationListener listener) {
            this.session  = session;
            this.listener = listener == null ? InvestigationListener.NONE : listener;
            this.token    = session.cancellationToken();
        }

        String callModel(String prompt, String systemPrompt, List<Message> history) {
            token.throwIfCancelled();
            session.transition(InvestigationState.AWAITING_MODEL);
            modelCalls++;
            log.debug("[Investigation:{}] Model call #{} (prompt {} chars, {} history message(s))",
                    session.id(), modelCalls, prompt.length(), history.size());
            try {
                return model.complete(prompt, systemPrompt, history);
            } catch (RuntimeException e) {
                throw new ModelCallFailedException(e);
            }
        }

        /** Runs the tools in order and returns the combined-results block for the next prompt. */
        String runTools(List<ToolInvocation> invocations) {
            List<String> blocks = new ArrayList<>();
            int total = invocations.size();
            for (int i = 0; i < total; i++) {
                token.throwIfCancelled();
                ToolInvocation invocation = invocations.get(i);
                String step = "TOOL: " + invocation.display();

                history.add(CommandExecution.running(null, step, Instant.now()));
                int slot = history.size() - 1;
                phase(PhaseKind.EXECUTING, "🔧 Running " + invocation.name() + "...", step, i, total);

                ToolOutcome outcome = dispatcher.execute(invocation, session.target());
                log.info("[Investigation:{}] {} → {}", session.id(), invocation.display(), outcome.status());

                history.set(slot, new CommandExecution(null,
                        outcome.command() != null ? outcome.command() : step,
                        outcome.isSuccess() ? CommandStatus.SUCCESS : CommandStatus.ERROR,
                        outcome.summary(),
                        outcome.content(),
                        history.get(slot).timestamp()));
                append(Message.tool(invocation.name(), outcome.content(), outcome.command()));
                blocks.add(InvestigationPrompts.resultBlock(invocation.name(), outcome.content()));
            }
            phase(PhaseKind.EXECUTING, "Ran %d tool(s)".formatted(total), null, total, total);
            return String.join(InvestigationPrompts.RESULT_SEPARATOR, blocks);
        }

        InvestigationResult complete(String answer) {
            append(Message.assistant(answer));
            return InvestigationResult.complete(answer, iteration, modelCalls);
        }

        void append(Message message) {
            session.transcript().append(message);
            listener.onMessage(message);
        }

        void phase(PhaseKind kind, String message, String currentStep, Integer done, Integer total) {
            listener.onPhase(Phase.builder()
                    .kind(kind)
                    .message(message)
                    .currentStep(currentStep)
                    .stepsCompleted(done)
                    .totalSteps(total)
                    .commandHistory(history)
                    .build());
        }

        void finished(InvestigationResult result) {
            PhaseKind kind = result.state() == InvestigationState.COMPLETE ? PhaseKind.COMPLETE : PhaseKind.ERROR;
            String message = result.state() == InvestigationState.COMPLETE ? "Investigation complete" : result.answer();
            phase(kind, message, null, null, null);
            listener.onFinished(result);
        }
    }

    /** Marks a failure of the model collaborator, as opposed to a bug in the loop. */
    private static final class ModelCallFailedException extends RuntimeException {
        ModelCallFailedException(RuntimeException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
