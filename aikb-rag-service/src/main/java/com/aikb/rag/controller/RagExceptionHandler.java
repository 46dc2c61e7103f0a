package com.aikb.rag.controller;

import com.aikb.rag.dto.ErrorResponse;
import com.aikb.rag.error.RagFailureKind;
import com.aikb.rag.error.RagQueryException;
import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline failures to HTTP responses. Bodies never carry backend error text.
 */
@Slf4j
@RestControllerAdvice
public class RagExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("VALIDATION_ERROR", e.getMessage(), false));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("VALIDATION_ERROR", "Request body is not valid JSON", false));
    }

    @ExceptionHandler(RagQueryException.class)
    public ResponseEntity<ErrorResponse> handleRagQuery(RagQueryException e) {
        HttpStatus status;
        if (e.isTimeout()) {
            status = HttpStatus.GATEWAY_TIMEOUT;
        } else if (e.getKind() == RagFailureKind.RAG_QUERY_FAILED) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        } else {
            status = HttpStatus.BAD_GATEWAY;
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getKind().name(), e.getMessage(), e.isTimeout()));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamException e) {
        log.error("[RAG API] Upstream failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("UPSTREAM_ERROR", "A backend service failed. Please try again.", false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[RAG API] Unexpected failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "The request failed unexpectedly.", false));
    }
}
