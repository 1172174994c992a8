package com.openrangelabs.donpetre.issuesync.exception;

import java.time.Duration;
import java.util.List;

/**
 * Exception thrown when the remote issue tracker answers with a non-success status.
 *
 * <p>Carries the HTTP status, the optional retry-after hint sent by the server and
 * any error messages extracted from the response body. A status of {@code 0}
 * means the request never produced a response.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class RemoteApiException extends SyncException {

    private final int statusCode;
    private final Duration retryAfter;
    private final List<String> remoteMessages;

    public RemoteApiException(int statusCode, String message) {
        this(statusCode, message, null, List.of());
    }

    public RemoteApiException(int statusCode, String message, Duration retryAfter, List<String> remoteMessages) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
        this.remoteMessages = remoteMessages != null ? List.copyOf(remoteMessages) : List.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Gets the server supplied retry-after hint.
     *
     * @return the hint, or null when the server did not send one
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public List<String> getRemoteMessages() {
        return remoteMessages;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
