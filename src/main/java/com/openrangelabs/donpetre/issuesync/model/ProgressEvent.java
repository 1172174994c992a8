package com.openrangelabs.donpetre.issuesync.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProgressEvent {
    String sessionId;
    ImportPhase phase;
    long processed;
    long total;
    int chunks;
    String detail;

    public double getPercentComplete() {
        if (total <= 0) {
            return 0.0;
        }
        return Math.min(100.0, processed * 100.0 / total);
    }
}
