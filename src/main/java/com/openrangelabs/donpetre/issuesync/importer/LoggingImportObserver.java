package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.model.ProgressEvent;
import com.openrangelabs.donpetre.issuesync.recovery.DegradedModeListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default observer writing import progress and degraded mode changes to the log
 */
@Slf4j
@Component
public class LoggingImportObserver implements ImportObserver, DegradedModeListener {

    @Override
    public void onProgress(ProgressEvent event) {
        if (event.getPhase().isTerminal()) {
            log.info("Import {} {}: {}/{} processed", event.getSessionId(), event.getPhase(),
                    event.getProcessed(), event.getTotal());
        } else {
            log.info("Import {} {}: {}/{} ({}%) after {} chunk(s){}", event.getSessionId(), event.getPhase(),
                    event.getProcessed(), event.getTotal(), String.format("%.1f", event.getPercentComplete()),
                    event.getChunks(), event.getDetail() != null ? " - " + event.getDetail() : "");
        }
    }

    @Override
    public void onItemError(String itemKey, String message) {
        log.warn("Failed to import {}: {}", itemKey, message);
    }

    @Override
    public void onDegradedModeChanged(boolean degraded, String reason) {
        if (degraded) {
            log.error("Sync engine degraded, imports suspended: {}", reason);
        } else {
            log.info("Sync engine back to normal operation");
        }
    }
}
