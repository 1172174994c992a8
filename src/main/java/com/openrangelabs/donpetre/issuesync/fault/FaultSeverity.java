package com.openrangelabs.donpetre.issuesync.fault;

/**
 * Severity levels for classified faults
 */
public enum FaultSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
