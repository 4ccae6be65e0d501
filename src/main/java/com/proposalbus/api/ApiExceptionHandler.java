package com.proposalbus.api;

import com.proposalbus.contract.ValidationFailedException;
import com.proposalbus.proposal.BatchNotCollectingException;
import com.proposalbus.proposal.BatchNotJudgeableException;
import com.proposalbus.proposal.UnknownBatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain failures to machine-readable bodies:
 * {@code {"error_code": "...", "message": "...", "timestamp": "..."}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationFailedException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationFailedException ex) {
        log.warn("Proposal validation failed: {}", ex.getErrors());
        Map<String, Object> body = errorResponse("VALIDATION_FAILED", ex.getMessage());
        body.put("errors", ex.getErrors());
        return body;
    }

    @ExceptionHandler(UnknownBatchException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownBatch(UnknownBatchException ex) {
        return errorResponse("UNKNOWN_BATCH", ex.getMessage());
    }

    @ExceptionHandler(BatchNotCollectingException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleNotCollecting(BatchNotCollectingException ex) {
        log.warn("Late submission: {}", ex.getMessage());
        return errorResponse("BATCH_NOT_COLLECTING", ex.getMessage());
    }

    @ExceptionHandler(BatchNotJudgeableException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleNotJudgeable(BatchNotJudgeableException ex) {
        return errorResponse("BATCH_NOT_JUDGEABLE", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
