package com.fieldreport.impound.controller;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fieldreport.impound.exception.ConfirmationRequiredException;
import com.fieldreport.impound.exception.InspectionNotFoundException;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.InvalidQuantityException;
import com.fieldreport.impound.exception.OverReleaseException;
import com.fieldreport.impound.exception.ReconciliationException;
import com.fieldreport.impound.exception.ReleaseNotFoundException;
import com.fieldreport.impound.exception.ReleaseOutcomeUnknownException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@code {"error": KIND, "message": ...}} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final String QUANTITY_FIELD = "boxesReleased";

    @ExceptionHandler(InvalidQuantityException.class)
    public ResponseEntity<Map<String, Object>> invalidQuantity(InvalidQuantityException e) {
        Map<String, Object> body = body(e);
        body.put("requested", e.getRequested());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(OverReleaseException.class)
    public ResponseEntity<Map<String, Object>> overRelease(OverReleaseException e) {
        Map<String, Object> body = body(e);
        body.put("requested", e.getRequested());
        body.put("available", e.getAvailable());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(InvalidFormException.class)
    public ResponseEntity<Map<String, Object>> invalidForm(InvalidFormException e) {
        Map<String, Object> body = body(e);
        body.put("fields", e.getFieldErrors());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({InspectionNotFoundException.class, ReleaseNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(ReconciliationException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(e));
    }

    @ExceptionHandler(ConfirmationRequiredException.class)
    public ResponseEntity<Map<String, Object>> confirmationRequired(ConfirmationRequiredException e) {
        Map<String, Object> body = body(e);
        body.put("missing", e.getMissing());
        return ResponseEntity.status(HttpStatus.PRECONDITION_REQUIRED).body(body);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> storeUnavailable(StoreUnavailableException e) {
        log.warn("Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body(e));
    }

    @ExceptionHandler(ReleaseOutcomeUnknownException.class)
    public ResponseEntity<Map<String, Object>> outcomeUnknown(ReleaseOutcomeUnknownException e) {
        Map<String, Object> body = body(e);
        body.put("inspectionId", e.getInspectionId());
        body.put("releaseId", e.getReleaseId());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        if (isQuantityMismatch(e.getCause())) {
            return invalidQuantity(new InvalidQuantityException(null));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "INVALID_FORM");
        body.put("message", "Request body is missing or malformed");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> dataAccess(DataAccessException e) {
        log.error("Unhandled store failure: {}", e.getMessage(), e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "STORE_UNAVAILABLE");
        body.put("message", "The inspection store is unavailable");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static boolean isQuantityMismatch(Throwable cause) {
        if (!(cause instanceof MismatchedInputException mismatch)) {
            return false;
        }
        return mismatch.getPath().stream()
                .map(JsonMappingException.Reference::getFieldName)
                .anyMatch(QUANTITY_FIELD::equals);
    }

    private static Map<String, Object> body(ReconciliationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.kind());
        body.put("message", e.getMessage());
        return body;
    }
}
