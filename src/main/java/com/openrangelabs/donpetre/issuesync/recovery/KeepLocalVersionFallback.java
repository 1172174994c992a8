package com.openrangelabs.donpetre.issuesync.recovery;

import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Default conflict resolution: the local copy wins and the remote change is skipped
 */
@Component
public class KeepLocalVersionFallback implements FallbackAction {

    private static final Logger logger = LoggerFactory.getLogger(KeepLocalVersionFallback.class);

    @Override
    public FaultCategory category() {
        return FaultCategory.CONFLICT;
    }

    @Override
    public Mono<Void> execute(Fault fault, Object payload) {
        return Mono.fromRunnable(() ->
                logger.info("Keeping local version of {}: {}", fault.getItemKey(), fault.getMessage()));
    }
}
