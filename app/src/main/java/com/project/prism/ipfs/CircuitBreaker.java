package com.project.prism.ipfs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stops hammering a blob store that keeps failing.
 * <p>
 * CLOSED lets requests through; {@code failureThreshold} consecutive failures move it to
 * OPEN, which rejects requests until {@code openDuration} has passed. It then goes
 * HALF_OPEN: {@code successThreshold} successes close it again, any failure re-opens it.
 */
public class CircuitBreaker {
    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openDuration;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicReference<Instant> stateChangedAt;

    public CircuitBreaker(String name) {
        this(name, 5, 3, Duration.ofSeconds(30), Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, int successThreshold,
                          Duration openDuration, Clock clock) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openDuration = openDuration;
        this.clock = clock;
        this.stateChangedAt = new AtomicReference<>(clock.instant());
    }

    public boolean canExecute() {
        switch (state.get()) {
            case CLOSED:
            case HALF_OPEN:
                return true;
            case OPEN:
                if (openWindowElapsed()) {
                    transitionTo(State.HALF_OPEN);
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    public void recordSuccess() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (successCount.incrementAndGet() >= successThreshold) {
                transitionTo(State.CLOSED);
            }
        } else if (current == State.CLOSED) {
            failureCount.set(0);
        }
    }

    public void recordFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            transitionTo(State.OPEN);
        } else if (current == State.CLOSED && failureCount.incrementAndGet() >= failureThreshold) {
            transitionTo(State.OPEN);
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && openWindowElapsed()) {
            transitionTo(State.HALF_OPEN);
        }
        return state.get();
    }

    public String getName() {
        return name;
    }

    /**
     * Closes the breaker after someone has checked the store by hand.
     */
    public void reset() {
        transitionTo(State.CLOSED);
    }

    private boolean openWindowElapsed() {
        return clock.instant().isAfter(stateChangedAt.get().plus(openDuration));
    }

    private synchronized void transitionTo(State newState) {
        State oldState = state.get();
        if (oldState == newState) {
            return;
        }
        state.set(newState);
        stateChangedAt.set(clock.instant());
        successCount.set(0);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            LOG.warn("[CircuitBreaker:{}] {} -> {}", name, oldState, newState);
        } else {
            LOG.info("[CircuitBreaker:{}] {} -> {}", name, oldState, newState);
        }
    }
}
