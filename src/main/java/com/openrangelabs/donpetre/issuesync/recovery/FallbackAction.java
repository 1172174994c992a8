package com.openrangelabs.donpetre.issuesync.recovery;

import com.openrangelabs.donpetre.issuesync.fault.Fault;
import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import reactor.core.publisher.Mono;

/**
 * Category-specific alternative path run by the fallback strategy.
 * An error signal makes the recovery service defer the operation instead.
 */
public interface FallbackAction {

    FaultCategory category();

    Mono<Void> execute(Fault fault, Object payload);
}
