package com.openrangelabs.donpetre.issuesync.repository;

import com.openrangelabs.donpetre.issuesync.entity.DeferredOperationEntity;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for deferred operations
 */
@Repository
public interface DeferredOperationRepository extends R2dbcRepository<DeferredOperationEntity, UUID> {

    /**
     * Find operations by status, oldest first
     */
    Flux<DeferredOperationEntity> findByStatusOrderByEnqueuedAtAsc(String status);
}
