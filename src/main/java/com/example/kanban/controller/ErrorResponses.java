package com.example.kanban.controller;

import com.example.kanban.service.EntityNotFoundException;
import com.example.kanban.transaction.TransactionFailureException;
import com.example.kanban.transaction.TransactionValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps failures of kanban operations to JSON error responses.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> from(String error, Exception e) {
        Throwable cause = e instanceof TransactionFailureException ? e.getCause() : e;

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", error);
        errorResponse.put("message", cause.getMessage());
        if (e instanceof TransactionFailureException failure) {
            errorResponse.put("transactionId", failure.getTransactionId());
            errorResponse.put("timeout", failure.isTimeout());
        }
        return ResponseEntity.status(statusFor(cause)).body(errorResponse);
    }

    static HttpStatus statusFor(Throwable cause) {
        if (cause instanceof EntityNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (cause instanceof IllegalArgumentException || cause instanceof TransactionValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
