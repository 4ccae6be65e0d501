package com.proposalbus.proposal;

public class BatchNotCollectingException extends RuntimeException {

    public BatchNotCollectingException(String batchId, BatchStatus status) {
        super("Batch " + batchId + " is not collecting proposals (status=" + status.getValue() + ")");
    }
}
