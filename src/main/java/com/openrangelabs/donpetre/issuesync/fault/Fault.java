package com.openrangelabs.donpetre.issuesync.fault;

import java.time.Duration;
import java.time.Instant;

/**
 * A classified failure.
 * Created where a lower layer reports an error and read-only afterwards.
 */
public class Fault {

    private final FaultCategory category;
    private final FaultSeverity severity;
    private final RecoveryStrategy strategy;
    private final Duration retryAfter;
    private final Integer httpStatus;
    private final String message;
    private final Throwable cause;
    private final ErrorContext context;
    private final Instant occurredAt;

    private Fault(Builder builder) {
        this.category = builder.category;
        this.severity = builder.severity != null ? builder.severity : builder.category.getDefaultSeverity();
        this.strategy = builder.strategy != null ? builder.strategy : builder.category.getDefaultStrategy();
        this.retryAfter = builder.retryAfter;
        this.httpStatus = builder.httpStatus;
        this.message = builder.message;
        this.cause = builder.cause;
        this.context = builder.context;
        this.occurredAt = builder.occurredAt;
    }

    public static Builder builder(FaultCategory category) {
        return new Builder(category);
    }

    // Getters
    public FaultCategory getCategory() { return category; }
    public FaultSeverity getSeverity() { return severity; }
    public RecoveryStrategy getStrategy() { return strategy; }
    public Duration getRetryAfter() { return retryAfter; }
    public Integer getHttpStatus() { return httpStatus; }
    public String getMessage() { return message; }
    public Throwable getCause() { return cause; }
    public ErrorContext getContext() { return context; }
    public Instant getOccurredAt() { return occurredAt; }

    public String getItemKey() {
        return context != null ? context.getItemKey() : null;
    }

    public boolean hasRetryAfter() {
        return retryAfter != null;
    }

    /**
     * Faults the engine will never resolve on its own; they must be surfaced to an operator
     */
    public boolean requiresIntervention() {
        return strategy == RecoveryStrategy.USER_INTERVENTION;
    }

    public boolean isTransient() {
        return strategy == RecoveryStrategy.RETRY;
    }

    /**
     * Operator-facing text for the fault
     */
    public String getUserMessage() {
        return switch (category) {
            case RATE_LIMIT -> retryAfter != null
                    ? "Issue tracker rate limit exceeded. Automatic retry in " + formatDelay(retryAfter) + "."
                    : "Issue tracker rate limit exceeded. Retrying automatically.";
            case AUTH -> "Authentication with the issue tracker failed. Please check the API credentials.";
            case REMOTE_4XX -> httpStatus != null && httpStatus == 400
                    ? "Invalid query syntax. Please check the query in the sync configuration."
                    : "Issue tracker rejected the request: " + message;
            case REMOTE_5XX -> "Issue tracker server error. Retrying automatically.";
            case NETWORK -> "Network connectivity issue. Sync will retry automatically when the connection is restored.";
            case LOCAL_IO -> "Could not write to the local store: " + message;
            case VALIDATION -> "Record could not be imported: " + message;
            case CONFLICT -> "Local copy conflicts with the remote record: " + message;
            case CONFIGURATION -> "Configuration error: " + message + ". Please review the sync settings.";
            case UNKNOWN -> message;
        };
    }

    /**
     * One-line summary stored with deferred operations
     */
    public String summary() {
        return category.label() + "/" + severity.name().toLowerCase() + ": " + message;
    }

    private static String formatDelay(Duration delay) {
        long seconds = Math.max(1, (delay.toMillis() + 999) / 1000);
        if (seconds < 60) {
            return seconds + " seconds";
        }
        return ((seconds + 59) / 60) + " minutes";
    }

    public static class Builder {
        private final FaultCategory category;
        private FaultSeverity severity;
        private RecoveryStrategy strategy;
        private Duration retryAfter;
        private Integer httpStatus;
        private String message;
        private Throwable cause;
        private ErrorContext context = ErrorContext.forOperation("unspecified");
        private Instant occurredAt = Instant.now();

        private Builder(FaultCategory category) {
            if (category == null) {
                throw new IllegalArgumentException("Fault category is required");
            }
            this.category = category;
        }

        public Builder severity(FaultSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder strategy(RecoveryStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder retryAfter(Duration retryAfter) {
            this.retryAfter = retryAfter;
            return this;
        }

        public Builder httpStatus(Integer httpStatus) {
            this.httpStatus = httpStatus;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder context(ErrorContext context) {
            this.context = context;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Fault build() {
            if (message == null || message.isBlank()) {
                message = cause != null && cause.getMessage() != null
                        ? cause.getMessage()
                        : category.label() + " failure";
            }
            return new Fault(this);
        }
    }

    @Override
    public String toString() {
        return "Fault{" +
                "category=" + category +
                ", severity=" + severity +
                ", strategy=" + strategy +
                (httpStatus != null ? ", httpStatus=" + httpStatus : "") +
                (retryAfter != null ? ", retryAfter=" + retryAfter : "") +
                ", message='" + message + '\'' +
                ", context=" + context +
                '}';
    }
}
