package com.openrangelabs.donpetre.issuesync.repository;

import com.openrangelabs.donpetre.issuesync.entity.ImportCheckpointEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for import checkpoints
 */
@Repository
public interface ImportCheckpointRepository extends R2dbcRepository<ImportCheckpointEntity, UUID> {

    Mono<ImportCheckpointEntity> findBySessionId(String sessionId);

    @Modifying
    @Query("DELETE FROM import_checkpoints WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(@Param("sessionId") String sessionId);
}
