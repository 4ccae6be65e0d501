package com.proposalbus.judge;

import reactor.core.publisher.Mono;

/**
 * Boundary to the generative backend. Returns the raw text answer.
 */
public interface JudgeBackendClient {

    Mono<String> complete(JudgeBackendRequest request);
}
