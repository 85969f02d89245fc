package tech.noetzold.verification_api.controller;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tech.noetzold.verification_api.ontology.OntologyLoadException;
import tech.noetzold.verification_api.service.UnknownConstraintException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(OntologyLoadException.class)
    public ResponseEntity<Map<String, Object>> handleOntology(OntologyLoadException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
        log.warn("Ontology load failed ({}): {}", ex.getReason(), ex.getMessage());

        Map<String, Object> body = body("ONTOLOGY_" + ex.getReason().name(), ex.getMessage());
        body.put("ontology", ex.getOntologyName());
        if (ex.getConstraintId() != null) {
            body.put("constraint_id", ex.getConstraintId());
        }
        if (ex.getReason() == OntologyLoadException.Reason.TIMEOUT
                || ex.getReason() == OntologyLoadException.Reason.UNAVAILABLE) {
            body.put("retry_after_ms", 500);
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", "));
        return body("INVALID_REQUEST", "Missing or invalid field(s): " + fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return body("INVALID_REQUEST", "Request body is not valid JSON");
    }

    @ExceptionHandler(UnknownConstraintException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownConstraint(UnknownConstraintException ex) {
        Map<String, Object> body = body("INVALID_REQUEST", ex.getMessage());
        body.put("ontology", ex.getOntologyName());
        body.put("constraint_ids", ex.getConstraintIds());
        return body;
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return body("INTERNAL_ERROR", "Verification failed unexpectedly");
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("trace_id", MDC.get("trace_id"));
        return body;
    }
}
