package com.openrangelabs.donpetre.issuesync.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.issuesync.config.SyncProperties;
import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.fault.RecoveryStrategy;
import com.openrangelabs.donpetre.issuesync.statistics.SyncStatisticsAggregator;
import com.openrangelabs.donpetre.issuesync.store.DeferredOperation;
import com.openrangelabs.donpetre.issuesync.store.DurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the recovery strategy of a classified fault.
 *
 * <p>Every fault is counted by category before its strategy runs, and every outcome is
 * counted per strategy. The service never sleeps itself: a retry outcome carries the
 * delay and the caller decides how to wait.
 */
@Service
public class ErrorRecoveryService {

    private static final Logger logger = LoggerFactory.getLogger(ErrorRecoveryService.class);

    private final SyncProperties properties;
    private final BackoffCalculator backoff;
    private final DurableStore durableStore;
    private final DegradedModeState degradedMode;
    private final SyncStatisticsAggregator statistics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<FaultCategory, FallbackAction> fallbacks = new EnumMap<>(FaultCategory.class);

    @Autowired
    public ErrorRecoveryService(
            SyncProperties properties,
            BackoffCalculator backoff,
            DurableStore durableStore,
            DegradedModeState degradedMode,
            SyncStatisticsAggregator statistics,
            ObjectMapper objectMapper,
            Clock clock,
            List<FallbackAction> fallbackActions) {

        this.properties = properties;
        this.backoff = backoff;
        this.durableStore = durableStore;
        this.degradedMode = degradedMode;
        this.statistics = statistics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        fallbackActions.forEach(action -> fallbacks.put(action.category(), action));

        logger.info("Initialized recovery service with fallbacks for: {}", fallbacks.keySet());
    }

    /**
     * Recovers from a fault.
     *
     * @param fault the classified fault
     * @param attempt 1-based number of the attempt that failed
     * @param payload the operation input, serialized if the operation gets deferred; may be null
     */
    public Mono<RecoveryOutcome> recover(Fault fault, int attempt, Object payload) {
        return Mono.defer(() -> {
            statistics.recordFailure(fault.getCategory());
            return execute(fault, Math.max(attempt, 1), payload);
        }).doOnNext(outcome -> {
            statistics.recordRecovery(outcome.getStrategy(), outcome.isSuccess());
            logger.debug("Recovery of {} -> {}", fault, outcome);
        });
    }

    private Mono<RecoveryOutcome> execute(Fault fault, int attempt, Object payload) {
        return switch (fault.getStrategy()) {
            case RETRY -> retry(fault, attempt, payload);
            case QUEUE -> queue(fault, attempt, payload);
            case FALLBACK -> fallback(fault, attempt, payload);
            case GRACEFUL_DEGRADATION -> degrade(fault, attempt);
            case USER_INTERVENTION -> userIntervention(fault, attempt);
        };
    }

    private Mono<RecoveryOutcome> retry(Fault fault, int attempt, Object payload) {
        int maxAttempts = properties.getRecovery().maxAttemptsFor(fault.getCategory());
        if (attempt >= maxAttempts) {
            logger.warn("Retries exhausted for {} after {} attempt(s), deferring: {}",
                    fault.getCategory().label(), attempt, fault.getMessage());
            return queue(fault, attempt, payload);
        }

        Duration delay = fault.hasRetryAfter()
                ? fault.getRetryAfter()
                : Duration.ofMillis(backoff.delay(attempt, properties.getBackoff()));
        logger.warn("Attempt {}/{} failed with {}, retrying in {} ms: {}",
                attempt, maxAttempts, fault.getCategory().label(), delay.toMillis(), fault.getMessage());
        return Mono.just(RecoveryOutcome.retry(attempt, delay));
    }

    private Mono<RecoveryOutcome> queue(Fault fault, int attempt, Object payload) {
        String serialized;
        try {
            serialized = payload != null ? objectMapper.writeValueAsString(payload) : null;
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException(
                    "Cannot serialize deferred payload for " + fault.getItemKey(), e));
        }

        DeferredOperation operation = DeferredOperation.builder()
                .operation(fault.getContext().getOperation())
                .itemKey(fault.getItemKey())
                .payload(serialized)
                .attempts(attempt)
                .category(fault.getCategory())
                .faultMessage(fault.summary())
                .enqueuedAt(clock.instant())
                .build();

        return durableStore.enqueue(operation)
                .defaultIfEmpty(operation)
                .map(stored -> {
                    logger.info("Deferred {} for {} ({})",
                            stored.getOperation(), stored.getItemKey(), fault.getCategory().label());
                    return RecoveryOutcome.queued(attempt, stored);
                });
    }

    private Mono<RecoveryOutcome> fallback(Fault fault, int attempt, Object payload) {
        FallbackAction action = fallbacks.get(fault.getCategory());
        if (action == null) {
            logger.warn("No fallback registered for {}, deferring", fault.getCategory().label());
            return queue(fault, attempt, payload);
        }
        return action.execute(fault, payload)
                .then(Mono.fromCallable(() -> RecoveryOutcome.recovered(RecoveryStrategy.FALLBACK, attempt)))
                .onErrorResume(e -> {
                    logger.warn("Fallback for {} failed, deferring: {}", fault.getCategory().label(), e.getMessage());
                    return queue(fault, attempt, payload);
                });
    }

    private Mono<RecoveryOutcome> degrade(Fault fault, int attempt) {
        return Mono.fromCallable(() -> {
            degradedMode.enter(fault.getUserMessage());
            return RecoveryOutcome.recovered(RecoveryStrategy.GRACEFUL_DEGRADATION, attempt);
        });
    }

    private Mono<RecoveryOutcome> userIntervention(Fault fault, int attempt) {
        return Mono.fromCallable(() -> {
            logger.error("Operator action required: {}", fault.getUserMessage());
            return RecoveryOutcome.failed(RecoveryStrategy.USER_INTERVENTION, attempt);
        });
    }
}
