package com.openforge.clusterlens.investigation;

import com.openforge.clusterlens.investigation.diagnostic.TargetResource;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;

/**
 * In-memory state of one investigation: the target resource, its transcript
 * and the orchestration state of the question currently being worked on.
 *
 * At most one loop runs per session. {@link #begin()} claims the session and
 * every terminal transition releases it through {@link #finish(InvestigationResult)}.
 */
@Slf4j
public class InvestigationSession {

    private final String         id;
    private final TargetResource target;
    private final Transcript     transcript = new Transcript();
    private final Instant        createdAt;
    private final Object         lock       = new Object();

    private boolean running; // guarded by lock, together with cancellationToken
    private volatile InvestigationState  state = InvestigationState.IDLE;
    private volatile int                 iteration;
    private volatile CancellationToken   cancellationToken = new CancellationToken();
    private volatile InvestigationResult lastResult;

    public InvestigationSession(TargetResource target) {
        this(UUID.randomUUID().toString(), target, Instant.now());
    }

    public InvestigationSession(String id, TargetResource target, Instant createdAt) {
        this.id        = id;
        this.target    = target;
        this.createdAt = createdAt;
    }

    // ── Single flight ────────────────────────────────────────────────────────

    /**
     * Claims the session for one turn and hands out a fresh cancellation token.
     *
     * @throws InvestigationBusyException if a turn is already running
     */
    public CancellationToken begin() {
        synchronized (lock) {
            if (running) {
                throw new InvestigationBusyException(id);
            }
            CancellationToken token = new CancellationToken();
            cancellationToken = token;
            iteration = 0;
            state = InvestigationState.AWAITING_MODEL;
            running = true;
            return token;
        }
    }

    /** Records the terminal result and releases the session for the next question. */
    public void finish(InvestigationResult result) {
        synchronized (lock) {
            lastResult = result;
            state = result.state();
            running = false;
        }
    }

    /** Requests cancellation of the running turn; a no-op when idle. */
    public boolean cancel() {
        synchronized (lock) {
            if (!running) {
                return false;
            }
            cancellationToken.cancel();
        }
        log.info("[Investigation:{}] Cancellation requested", id);
        return true;
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    // ── State ────────────────────────────────────────────────────────────────

    void transition(InvestigationState next) {
        log.debug("[Investigation:{}] {} → {}", id, state, next);
        state = next;
    }

    void iteration(int value) {
        iteration = value;
    }

    public String id()                        { return id; }
    public TargetResource target()            { return target; }
    public Transcript transcript()            { return transcript; }
    public Instant createdAt()                { return createdAt; }
    public InvestigationState state()         { return state; }
    public int iteration()                    { return iteration; }
    public CancellationToken cancellationToken() { return cancellationToken; }
    public InvestigationResult lastResult()   { return lastResult; }
}
