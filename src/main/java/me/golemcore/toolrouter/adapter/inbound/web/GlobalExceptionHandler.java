package me.golemcore.toolrouter.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.toolrouter.domain.exception.CatalogUnavailableException;
import me.golemcore.toolrouter.domain.exception.CatalogValidationException;
import me.golemcore.toolrouter.domain.exception.InvalidRequestException;
import me.golemcore.toolrouter.domain.exception.NoEligibleCandidateException;
import me.golemcore.toolrouter.domain.exception.ServiceUnavailableException;
import me.golemcore.toolrouter.domain.model.PolicyRejection;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps domain failures of the router API onto {@link ApiErrorResponse}.
 * Rejections with no safe fallback are reported verbatim so callers can decide
 * whether and when to retry.
 */
@ControllerAdvice(basePackages = "me.golemcore.toolrouter.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("[API] Invalid request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), ex.getDetails());
    }

    @ExceptionHandler(NoEligibleCandidateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNoEligibleCandidate(NoEligibleCandidateException ex) {
        log.info("[API] No eligible candidate for {}: {} rejection(s)", ex.getCapability(),
                ex.getRejections().size());
        List<String> details = ex.getRejections().stream()
                .map(GlobalExceptionHandler::describe)
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "NO_ELIGIBLE_CANDIDATE", ex.getMessage(), details);
    }

    @ExceptionHandler(CatalogValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCatalogValidation(CatalogValidationException ex) {
        log.warn("[API] Catalog validation failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "CATALOG_VALIDATION", ex.getMessage(), ex.getViolations());
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.warn("[API] Service unavailable, retry after {}s: {}", ex.getRetryAfterSeconds(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                .code("SERVICE_UNAVAILABLE")
                .message(ex.getMessage())
                .retryAfterSeconds(ex.getRetryAfterSeconds())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body));
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCatalogUnavailable(CatalogUnavailableException ex) {
        log.warn("[API] Catalog unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CATALOG_UNAVAILABLE", ex.getMessage(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, status.name(), ex.getReason(), null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", null);
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String code, String message,
            List<String> details) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .details(details != null && !details.isEmpty() ? details : null)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private static String describe(PolicyRejection rejection) {
        return rejection.candidate() + ": " + rejection.violation() + " (" + rejection.detail() + ")";
    }
}
