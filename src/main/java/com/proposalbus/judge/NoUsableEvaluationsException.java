package com.proposalbus.judge;

public class NoUsableEvaluationsException extends RuntimeException {

    public NoUsableEvaluationsException(String batchId) {
        super("no usable evaluations for batch " + batchId);
    }
}
