package com.openrangelabs.donpetre.issuesync.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide degraded mode flag.
 *
 * <p>While degraded, no new import may start and a running import stops writing after
 * its current chunk. Leaving degraded mode is an explicit operator action.
 */
@Component
public class DegradedModeState {

    private static final Logger logger = LoggerFactory.getLogger(DegradedModeState.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<DegradedModeListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    private boolean degraded;
    private String reason;
    private Instant since;

    @Autowired
    public DegradedModeState(List<DegradedModeListener> listeners, Clock clock) {
        this.listeners.addAll(listeners);
        this.clock = clock;
    }

    public void addListener(DegradedModeListener listener) {
        listeners.add(listener);
    }

    /**
     * Enters degraded mode.
     *
     * @return true if the state changed; false if already degraded
     */
    public boolean enter(String reason) {
        lock.lock();
        try {
            if (degraded) {
                return false;
            }
            this.degraded = true;
            this.reason = reason;
            this.since = clock.instant();
        } finally {
            lock.unlock();
        }
        logger.error("Entering degraded mode: {}", reason);
        notifyListeners(true, reason);
        return true;
    }

    /**
     * Leaves degraded mode. Calling it when not degraded is a no-op.
     *
     * @return true if the state changed
     */
    public boolean exit() {
        String previousReason;
        lock.lock();
        try {
            if (!degraded) {
                return false;
            }
            previousReason = reason;
            this.degraded = false;
            this.reason = null;
            this.since = null;
        } finally {
            lock.unlock();
        }
        logger.info("Leaving degraded mode (was: {})", previousReason);
        notifyListeners(false, previousReason);
        return true;
    }

    public boolean isDegraded() {
        lock.lock();
        try {
            return degraded;
        } finally {
            lock.unlock();
        }
    }

    public String getReason() {
        lock.lock();
        try {
            return reason;
        } finally {
            lock.unlock();
        }
    }

    public Instant getSince() {
        lock.lock();
        try {
            return since;
        } finally {
            lock.unlock();
        }
    }

    private void notifyListeners(boolean nowDegraded, String why) {
        for (DegradedModeListener listener : listeners) {
            try {
                listener.onDegradedModeChanged(nowDegraded, why);
            } catch (RuntimeException e) {
                logger.warn("Degraded mode listener {} failed: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
