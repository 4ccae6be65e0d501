package com.proposalbus.judge;

import com.proposalbus.proposal.BatchSummary;
import reactor.core.publisher.Mono;

/**
 * Picks a winner for one specialty. Implementations may fail; the calling {@link Judge}
 * turns a failure into an abstention.
 */
public interface EvaluationStrategy {

    Mono<Assessment> evaluate(JudgeSpecialty specialty, BatchSummary summary);
}
