package com.skein.transport;

import com.skein.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Connection lifecycle and backoff policy for the relay subscription.
 *
 * <p>State machine: {@code CONNECTED → DISCONNECTED → BACKOFF → CONNECTED}.  The
 * delay before attempt {@code n} is {@code min(maxDelay, baseDelay * 2^n)} with equal
 * jitter: a fixed share of the delay plus a random share of {@code jitter} of it.
 * Attempts never stop.</p>
 *
 * <p>The attempt counter is reset only once a connection has been delivering frames for
 * {@code stableAfter}.  A relay that accepts the socket and drops it after a frame or two
 * therefore keeps climbing the backoff curve.</p>
 */
@Slf4j
public class ReconnectionManager {

    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final Duration stableAfter;
    private final int outageThreshold;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    private final AtomicLong failedAttempts = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private int attempt;
    private int consecutiveFailures;
    private Instant connectedAt;
    private boolean outage;

    public ReconnectionManager(PipelineConfig.ReconnectSection config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReconnectionManager(PipelineConfig.ReconnectSection config, Clock clock,
                               Sleeper sleeper, DoubleSupplier random) {
        if (config.getJitter() < 0 || config.getJitter() > 1) {
            throw new IllegalArgumentException("reconnect.jitter must be within [0, 1]: " + config.getJitter());
        }
        this.baseDelay = Duration.ofMillis(config.getBaseDelayMs());
        this.maxDelay = Duration.ofMillis(config.getMaxDelayMs());
        this.jitter = config.getJitter();
        this.stableAfter = config.getStableAfter();
        this.outageThreshold = config.getOutageThreshold();
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    // ── Lifecycle events ─────────────────────────────────────────────────

    public synchronized void onConnected() {
        state = ConnectionState.CONNECTED;
        connectedAt = clock.instant();
        log.info("Relay connected after attempt={}", attempt);
    }

    /**
     * Called for every frame received.  Resets backoff once the connection has been
     * flowing for {@code stableAfter}.
     */
    public synchronized void onFrame() {
        if (connectedAt == null || (attempt == 0 && consecutiveFailures == 0)) {
            return;
        }
        if (Duration.between(connectedAt, clock.instant()).compareTo(stableAfter) >= 0) {
            log.info("Relay connection stable for {}, resetting backoff (was attempt={})", stableAfter, attempt);
            attempt = 0;
            consecutiveFailures = 0;
            if (outage) {
                outage = false;
                log.info("Relay outage over");
            }
        }
    }

    /**
     * Records a failed connection attempt or a lost stream.
     */
    public synchronized void onFailure(Throwable cause) {
        state = ConnectionState.DISCONNECTED;
        connectedAt = null;
        failedAttempts.incrementAndGet();
        consecutiveFailures++;
        log.warn("Relay connection lost (consecutiveFailures={}): {}", consecutiveFailures,
                cause == null ? "unknown" : cause.getMessage());
        if (!outage && consecutiveFailures >= outageThreshold) {
            outage = true;
            log.warn("Sustained relay outage: {} consecutive failed attempts", consecutiveFailures);
        }
    }

    // ── Backoff ──────────────────────────────────────────────────────────

    /**
     * Computes the delay before the next attempt and advances the attempt counter.
     */
    public synchronized Duration nextDelay() {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = Math.min(attempt, MAX_SHIFT);
        long exponential = base > (cap >> shift) ? cap : Math.min(cap, base << shift);
        attempt++;

        double fixedShare = exponential * (1.0 - jitter);
        double randomShare = exponential * jitter * random.getAsDouble();
        return Duration.ofMillis(Math.round(fixedShare + randomShare));
    }

    /**
     * Waits out the next backoff delay.
     */
    public void awaitNextAttempt() throws InterruptedException {
        Duration delay = nextDelay();
        state = ConnectionState.BACKOFF;
        log.info("Reconnecting to relay in {} ms (attempt={})", delay.toMillis(), getAttempt());
        sleeper.sleep(delay);
    }

    // ── Observability ────────────────────────────────────────────────────

    public ConnectionState getState() {
        return state;
    }

    public long getFailedAttempts() {
        return failedAttempts.get();
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized boolean isSustainedOutage() {
        return outage;
    }
}
