package com.sapiens.orchestrator.api;

import com.sapiens.orchestrator.api.dto.ErrorResponse;
import com.sapiens.orchestrator.service.OrchestrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.UUID;

/**
 * Maps failures to JSON bodies {@code {error, message, request_id}}.
 *
 * Server-side failures get a generic message; the details stay in the log
 * under the same request id. Anything that escapes the services (storage
 * errors on the read endpoints, corrupt payloads) ends up here as a 500.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<ErrorResponse> handleOrchestration(OrchestrationException ex) {
        String requestId = ex.getRequestId() != null ? ex.getRequestId() : UUID.randomUUID().toString();
        HttpStatus status = statusFor(ex.getKind());
        String code = ex.getKind().name().toLowerCase(Locale.ROOT);

        if (status.is5xxServerError()) {
            log.error("Request {} failed with {}", requestId, ex.getKind(), ex);
            return ResponseEntity.status(status)
                    .body(new ErrorResponse(code, "The request could not be completed. Please try again.", requestId));
        }
        log.info("Request {} refused: {}", requestId, ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(code, clientMessage(ex), requestId));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "validation_failure", "Malformed request", UUID.randomUUID().toString()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(new ErrorResponse(
                codeFor(ex.getStatusCode()), ex.getReason(), UUID.randomUUID().toString()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
        return handleOrchestration(new OrchestrationException(
                OrchestrationException.Kind.PERSISTENCE_FAILURE, "storage access failed", ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        // Spring MVC's own exceptions (405, 415, missing parameter...) keep their status.
        if (ex instanceof org.springframework.web.ErrorResponse mvc && !mvc.getStatusCode().is5xxServerError()) {
            return ResponseEntity.status(mvc.getStatusCode()).body(new ErrorResponse(
                    codeFor(mvc.getStatusCode()), mvc.getBody().getDetail(), UUID.randomUUID().toString()));
        }
        return handleOrchestration(new OrchestrationException(
                OrchestrationException.Kind.INTERNAL_FAILURE, "unexpected failure", ex));
    }

    static HttpStatus statusFor(OrchestrationException.Kind kind) {
        return switch (kind) {
            case UNKNOWN_USER       -> HttpStatus.NOT_FOUND;
            case USER_EXISTS        -> HttpStatus.CONFLICT;
            case VALIDATION_FAILURE -> HttpStatus.BAD_REQUEST;
            case BUSY               -> HttpStatus.TOO_MANY_REQUESTS;
            case PERSISTENCE_FAILURE, INTERNAL_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /** Strips the "[KIND] " prefix the exception message carries. */
    private static String clientMessage(OrchestrationException ex) {
        String m = ex.getMessage();
        int close = m.indexOf("] ");
        return m.startsWith("[") && close > 0 ? m.substring(close + 2) : m;
    }

    private static String codeFor(HttpStatusCode code) {
        HttpStatus status = HttpStatus.resolve(code.value());
        return status == null ? "error" : status.name().toLowerCase(Locale.ROOT);
    }
}
