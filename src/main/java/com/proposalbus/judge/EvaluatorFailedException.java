package com.proposalbus.judge;

public class EvaluatorFailedException extends RuntimeException {

    public EvaluatorFailedException(String message) {
        super(message);
    }

    public EvaluatorFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
