package com.openrangelabs.donpetre.issuesync.store;

import com.openrangelabs.donpetre.issuesync.entity.DeferredOperationEntity;
import com.openrangelabs.donpetre.issuesync.entity.ImportCheckpointEntity;
import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.model.ImportCheckpoint;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import com.openrangelabs.donpetre.issuesync.repository.DeferredOperationRepository;
import com.openrangelabs.donpetre.issuesync.repository.ImportCheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * {@link DurableStore} backed by Spring Data R2DBC repositories.
 * Timestamps are stored as UTC local date-times.
 */
@Component
public class R2dbcDurableStore implements DurableStore {

    private static final Logger logger = LoggerFactory.getLogger(R2dbcDurableStore.class);

    private final ImportCheckpointRepository checkpointRepository;
    private final DeferredOperationRepository deferredOperationRepository;

    @Autowired
    public R2dbcDurableStore(ImportCheckpointRepository checkpointRepository,
                             DeferredOperationRepository deferredOperationRepository) {
        this.checkpointRepository = checkpointRepository;
        this.deferredOperationRepository = deferredOperationRepository;
    }

    @Override
    public Mono<Void> saveCheckpoint(ImportCheckpoint checkpoint) {
        return checkpointRepository.findBySessionId(checkpoint.getSessionId())
                .defaultIfEmpty(new ImportCheckpointEntity(checkpoint.getSessionId()))
                .map(entity -> applyCheckpoint(entity, checkpoint))
                .flatMap(checkpointRepository::save)
                .doOnNext(saved -> logger.debug("Saved checkpoint {}", saved))
                .then();
    }

    @Override
    public Mono<ImportCheckpoint> loadCheckpoint(String sessionId) {
        return checkpointRepository.findBySessionId(sessionId)
                .map(this::toCheckpoint);
    }

    @Override
    public Mono<Void> clearCheckpoint(String sessionId) {
        return checkpointRepository.deleteBySessionId(sessionId)
                .doOnNext(deleted -> logger.debug("Cleared {} checkpoint(s) of session {}", deleted, sessionId))
                .then();
    }

    @Override
    public Mono<DeferredOperation> enqueue(DeferredOperation operation) {
        return deferredOperationRepository.save(toEntity(operation))
                .map(this::toDeferredOperation)
                .doOnNext(saved -> logger.debug("Enqueued deferred operation {} for {}",
                        saved.getId(), saved.getItemKey()));
    }

    @Override
    public Flux<DeferredOperation> pendingOperations() {
        return deferredOperationRepository.findByStatusOrderByEnqueuedAtAsc(DeferredOperation.STATUS_PENDING)
                .map(this::toDeferredOperation);
    }

    private ImportCheckpointEntity applyCheckpoint(ImportCheckpointEntity entity, ImportCheckpoint checkpoint) {
        QuerySpec query = checkpoint.getQuery();
        entity.setProcessedCount(checkpoint.getProcessedCount());
        entity.setLastItemKey(checkpoint.getLastItemKey());
        entity.setQueryText(query.getQuery());
        entity.setQueryFields(String.join(",", query.getFields()));
        entity.setPageSize(query.getPageSize());
        entity.setMaxResults(query.getMaxResults());
        entity.setBatchSize(checkpoint.getBatchSize());
        entity.setSavedAt(toLocal(checkpoint.getSavedAt()));
        return entity;
    }

    private ImportCheckpoint toCheckpoint(ImportCheckpointEntity entity) {
        QuerySpec query = QuerySpec.builder(entity.getQueryText())
                .fields(splitFields(entity.getQueryFields()))
                .pageSize(entity.getPageSize())
                .maxResults(entity.getMaxResults())
                .build();
        return new ImportCheckpoint(entity.getSessionId(), entity.getProcessedCount(), entity.getLastItemKey(),
                query, entity.getBatchSize(), toInstant(entity.getSavedAt()));
    }

    private DeferredOperationEntity toEntity(DeferredOperation operation) {
        DeferredOperationEntity entity = new DeferredOperationEntity();
        entity.setId(operation.getId());
        entity.setOperation(operation.getOperation());
        entity.setItemKey(operation.getItemKey());
        entity.setPayload(operation.getPayload());
        entity.setAttempts(operation.getAttempts());
        entity.setFaultCategory(operation.getCategory() != null ? operation.getCategory().name() : null);
        entity.setFaultMessage(operation.getFaultMessage());
        entity.setStatus(operation.getStatus());
        entity.setEnqueuedAt(toLocal(operation.getEnqueuedAt()));
        return entity;
    }

    private DeferredOperation toDeferredOperation(DeferredOperationEntity entity) {
        return DeferredOperation.builder()
                .id(entity.getId())
                .operation(entity.getOperation())
                .itemKey(entity.getItemKey())
                .payload(entity.getPayload())
                .attempts(entity.getAttempts() != null ? entity.getAttempts() : 0)
                .category(entity.getFaultCategory() != null ? FaultCategory.valueOf(entity.getFaultCategory()) : null)
                .faultMessage(entity.getFaultMessage())
                .status(entity.getStatus())
                .enqueuedAt(toInstant(entity.getEnqueuedAt()))
                .build();
    }

    private static List<String> splitFields(String fields) {
        if (fields == null || fields.isBlank()) {
            return List.of();
        }
        return Arrays.stream(fields.split(","))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .toList();
    }

    private static LocalDateTime toLocal(Instant instant) {
        return instant != null ? LocalDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(LocalDateTime dateTime) {
        return dateTime != null ? dateTime.toInstant(ZoneOffset.UTC) : null;
    }
}
