package com.bank.tlm.api.error;

import com.bank.tlm.application.service.CorrelationIdService;
import com.bank.tlm.domain.exception.ErrorCategory;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;

/**
 * Maps ledger failures to RFC 7807 responses.
 *
 * <p>Status follows the error category: NOT_FOUND is 404, INVALID_INPUT is 400 and every
 * conflict with recorded state is 409. The body carries {@code errorCode} and {@code correlationId}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_PREFIX = "urn:trade-lifecycle:error:";
    
    private final CorrelationIdService correlationIdService;
    
    public GlobalExceptionHandler(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }
    
    @ExceptionHandler(TradeLifecycleException.class)
    public ProblemDetail handleLifecycle(TradeLifecycleException ex) {
        HttpStatus status = statusFor(ex.getCategory());
        log.warn("Request rejected: code={}, category={}, message={}",
                ex.getErrorCode(), ex.getCategory(), ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(ex.getCategory().name());
        problem.setType(URI.create(TYPE_PREFIX + ex.getErrorCode().name()));
        problem.setProperty("errorCode", ex.getErrorCode().name());
        enrichWithCorrelation(problem);
        return problem;
    }
    
    /**
     * A unique constraint lost a race that the precondition checks could not see
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Write rejected by database constraint: {}", ex.getMostSpecificCause().getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT,
                "Write conflicts with an existing record");
        problem.setTitle(ErrorCategory.ALREADY_EXISTS.name());
        problem.setType(URI.create(TYPE_PREFIX + "CONSTRAINT_VIOLATION"));
        problem.setProperty("errorCode", "CONSTRAINT_VIOLATION");
        enrichWithCorrelation(problem);
        return problem;
    }
    
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request");
        problem.setTitle(ErrorCategory.INVALID_INPUT.name());
        problem.setType(URI.create(TYPE_PREFIX + "MALFORMED_REQUEST"));
        problem.setProperty("errorCode", "MALFORMED_REQUEST");
        enrichWithCorrelation(problem);
        return problem;
    }
    
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            log.warn("Request failed: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrichWithCorrelation(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        enrichWithCorrelation(problem);
        return problem;
    }
    
    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.CONFLICT;
        };
    }
    
    private void enrichWithCorrelation(ProblemDetail problem) {
        String correlationId = correlationIdService.getCurrentCorrelationId();
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
    }
}
