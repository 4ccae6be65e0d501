package com.proposalbus.bus;

import reactor.core.publisher.Mono;

/**
 * A bus subscriber. The returned {@link Mono} may complete later; the bus bounds it
 * with the subscription's timeout and retries it on error.
 */
@FunctionalInterface
public interface EventHandler {

    Mono<HandlerResult> handle(BusEvent event);
}
