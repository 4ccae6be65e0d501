package com.proposalbus.proposal;

public class UnknownBatchException extends RuntimeException {

    public UnknownBatchException(String batchId) {
        super("Unknown batch: " + batchId);
    }
}
