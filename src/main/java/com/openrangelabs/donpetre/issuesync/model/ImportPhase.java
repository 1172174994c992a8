package com.openrangelabs.donpetre.issuesync.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an import session
 */
public enum ImportPhase {
    IDLE,
    FETCHING,
    IMPORTING,
    PAUSED,
    RESUMING,
    CANCELLED,
    COMPLETE,
    ERROR;

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETE || this == ERROR;
    }

    public boolean canTransitionTo(ImportPhase next) {
        return allowedTargets().contains(next);
    }

    private Set<ImportPhase> allowedTargets() {
        return switch (this) {
            case IDLE -> EnumSet.of(FETCHING);
            case FETCHING -> EnumSet.of(IMPORTING, PAUSED, CANCELLED, COMPLETE, ERROR);
            case IMPORTING -> EnumSet.of(PAUSED, CANCELLED, COMPLETE, ERROR);
            case PAUSED -> EnumSet.of(RESUMING);
            case RESUMING -> EnumSet.of(IMPORTING, PAUSED, CANCELLED, COMPLETE, ERROR);
            case CANCELLED, COMPLETE, ERROR -> EnumSet.noneOf(ImportPhase.class);
        };
    }
}
