package com.openrangelabs.donpetre.issuesync.model;

import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import lombok.Value;

@Value
public class ErrorCategorySummary {
    long totalErrors;
    /** null when no error has been recorded */
    FaultCategory mostCommon;
    int categoryCount;
}
