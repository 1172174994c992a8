package com.openrangelabs.donpetre.issuesync.recovery;

/**
 * Notified when the process enters or leaves degraded mode
 */
public interface DegradedModeListener {

    void onDegradedModeChanged(boolean degraded, String reason);
}
