package com.openrangelabs.donpetre.issuesync.fault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openrangelabs.donpetre.issuesync.exception.InvalidItemException;
import com.openrangelabs.donpetre.issuesync.exception.ItemConflictException;
import com.openrangelabs.donpetre.issuesync.exception.LocalWriteException;
import com.openrangelabs.donpetre.issuesync.exception.RemoteApiException;
import com.openrangelabs.donpetre.issuesync.exception.SyncConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.nio.file.FileSystemException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.Collections;
import java.util.concurrent.TimeoutException;

/**
 * Maps any failure raised by the fetcher, the sink or the store to a {@link Fault}.
 *
 * <p>The whole cause chain is inspected, so a wrapped connectivity or write failure is
 * still recognized. Rules are applied in a fixed precedence order and the first match
 * wins.
 */
@Component
public class FaultClassifier {

    private static final Logger logger = LoggerFactory.getLogger(FaultClassifier.class);

    private static final String RETRY_AFTER_HEADER = "Retry-After";

    public Fault classify(Throwable error, ErrorContext context) {
        List<Throwable> chain = causeChain(error);
        Fault fault = doClassify(error, chain, context);
        logger.debug("Classified {} in {} as {}", error.getClass().getSimpleName(), context, fault.getCategory());
        return fault;
    }

    private Fault doClassify(Throwable error, List<Throwable> chain, ErrorContext context) {
        Integer status = httpStatus(chain);
        Duration retryAfter = retryAfter(chain);
        String message = error.getMessage();

        if ((status != null && status == 429) || retryAfter != null) {
            return build(FaultCategory.RATE_LIMIT, error, context, status, retryAfter, message);
        }
        if (chain.stream().anyMatch(FaultClassifier::isConnectivityFailure)) {
            return build(FaultCategory.NETWORK, error, context, status, null, message);
        }
        if (status != null && status >= 500) {
            return build(FaultCategory.REMOTE_5XX, error, context, status, null, message);
        }
        if (status != null && (status == 401 || status == 403)) {
            return build(FaultCategory.AUTH, error, context, status, null, message);
        }
        if (status != null && status >= 400) {
            return build(FaultCategory.REMOTE_4XX, error, context, status, null, message);
        }
        if (find(chain, LocalWriteException.class) != null || find(chain, FileSystemException.class) != null) {
            return build(FaultCategory.LOCAL_IO, error, context, null, null, message);
        }
        if (find(chain, InvalidItemException.class) != null || find(chain, JsonProcessingException.class) != null) {
            return build(FaultCategory.VALIDATION, error, context, null, null, message);
        }
        if (find(chain, ItemConflictException.class) != null) {
            return build(FaultCategory.CONFLICT, error, context, null, null, message);
        }
        if (find(chain, SyncConfigurationException.class) != null) {
            return build(FaultCategory.CONFIGURATION, error, context, null, null, message);
        }
        return build(FaultCategory.UNKNOWN, error, context, status, null, message);
    }

    private Fault build(FaultCategory category, Throwable error, ErrorContext context,
                        Integer status, Duration retryAfter, String message) {
        return Fault.builder(category)
                .cause(error)
                .context(context)
                .httpStatus(status)
                .retryAfter(retryAfter)
                .message(message)
                .build();
    }

    private static boolean isConnectivityFailure(Throwable t) {
        if (t instanceof RemoteApiException remote) {
            return remote.getStatusCode() == 0;
        }
        return t instanceof ConnectException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof ClosedChannelException
                || t instanceof SocketException
                || t instanceof TimeoutException
                || t instanceof WebClientRequestException;
    }

    private static Integer httpStatus(List<Throwable> chain) {
        for (Throwable t : chain) {
            if (t instanceof RemoteApiException remote && remote.getStatusCode() > 0) {
                return remote.getStatusCode();
            }
            if (t instanceof WebClientResponseException response) {
                return response.getStatusCode().value();
            }
        }
        return null;
    }

    private static Duration retryAfter(List<Throwable> chain) {
        for (Throwable t : chain) {
            if (t instanceof RemoteApiException remote && remote.getRetryAfter() != null) {
                return remote.getRetryAfter();
            }
            if (t instanceof WebClientResponseException response) {
                String header = response.getHeaders().getFirst(RETRY_AFTER_HEADER);
                Duration parsed = parseSeconds(header);
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return null;
    }

    static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-date form is not supported
            return null;
        }
    }

    private static <T extends Throwable> T find(List<Throwable> chain, Class<T> type) {
        for (Throwable t : chain) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
        }
        return null;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
