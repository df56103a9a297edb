package com.bondplatform.relay.config;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.net.URI;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
        HttpStatus.BAD_REQUEST, "invalid-parameter",
        HttpStatus.UNAUTHORIZED, "unauthorized",
        HttpStatus.FORBIDDEN, "forbidden",
        HttpStatus.NOT_FOUND, "not-found",
        HttpStatus.UNPROCESSABLE_ENTITY, "rejected",
        HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler(BondException.class)
    public ResponseEntity<ProblemDetail> handleBond(BondException ex, ServerWebExchange exchange) {
        ResponseEntity<ProblemDetail> response = buildProblem(statusOf(ex.getCode()), ex, exchange);
        response.getBody().setProperty("errorCode", ex.getCode().name());
        response.getBody().setProperty("reason", ex.getCode().description());
        response.getBody().setProperty("component", ex.getComponent());
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException ex, ServerWebExchange exchange) {
        return buildProblem(HttpStatus.BAD_REQUEST, ex, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
                                                              ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return buildProblem(status, ex, exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, ServerWebExchange exchange) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, exchange);
    }

    static HttpStatus statusOf(ErrorCode code) {
        if (code == ErrorCode.UNAUTHORIZED_RELAYER) {
            return HttpStatus.UNAUTHORIZED;
        }
        return switch (code.category()) {
            case AUTHORIZATION        -> HttpStatus.FORBIDDEN;
            case NOT_FOUND            -> HttpStatus.NOT_FOUND;
            case PARAMETER_VALIDATION -> HttpStatus.BAD_REQUEST;
            default                   -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex, ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        logException(status, ex, exchange);
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(path));
        detail.setType(URI.create("https://bond-platform.dev/problems/" +
            TYPE_SLUGS.getOrDefault(status, "internal-error")));
        detail.setProperty("path", path);
        return ResponseEntity.status(status).body(detail);
    }

    private void logException(HttpStatus status, Exception ex, ServerWebExchange exchange) {
        String method = exchange.getRequest().getMethod().name();
        String uri = exchange.getRequest().getURI().getRawPath();
        String errorMessage = ex.getMessage();
        if (errorMessage == null || errorMessage.isBlank()) {
            errorMessage = ex.getClass().getName();
        }
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}", method, uri, status.value(), errorMessage, ex);
        } else {
            log.warn("Request {} {} returned status {}: {}", method, uri, status.value(), errorMessage);
        }
    }
}
