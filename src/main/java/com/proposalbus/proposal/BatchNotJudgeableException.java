package com.proposalbus.proposal;

public class BatchNotJudgeableException extends RuntimeException {

    public BatchNotJudgeableException(String batchId, BatchStatus status) {
        super("Batch " + batchId + " cannot accept a decision (status=" + status.getValue() + ")");
    }
}
