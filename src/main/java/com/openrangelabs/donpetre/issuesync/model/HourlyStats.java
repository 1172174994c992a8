package com.openrangelabs.donpetre.issuesync.model;

import lombok.Value;

import java.time.Instant;

/**
 * Aggregates of one clock hour
 */
@Value
public class HourlyStats {
    Instant hourStart;
    long operations;
    long items;
    long errors;
}
