package com.changelab.mentor.api;

import com.changelab.mentor.convergence.IllegalTransitionException;
import com.changelab.mentor.project.PersistenceWriteException;
import com.changelab.mentor.project.ProjectNotFoundException;
import com.changelab.mentor.reasoning.ConfigurationException;
import com.changelab.mentor.reasoning.RateLimitedException;
import com.changelab.mentor.reasoning.ReasoningFailedException;
import com.changelab.mentor.reasoning.UnauthorizedException;
import com.changelab.mentor.strategy.StrategyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> configuration(ConfigurationException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiError> rateLimited(RateLimitedException e) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
    }

    @ExceptionHandler({UnauthorizedException.class, ReasoningFailedException.class})
    public ResponseEntity<ApiError> upstream(RuntimeException e) {
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(StrategyNotFoundException.class)
    public ResponseEntity<ApiError> strategyNotFound(StrategyNotFoundException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ResponseEntity<ApiError> illegalTransition(IllegalTransitionException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<ApiError> projectNotFound(ProjectNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(PersistenceWriteException.class)
    public ResponseEntity<ApiError> persistence(PersistenceWriteException e) {
        log.error("Project write failed", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Project could not be saved, try again");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message) {
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", status.value(), message);
        } else {
            log.warn("Request rejected with {}: {}", status.value(), message);
        }
        return ResponseEntity.status(status).body(ApiError.of(message));
    }
}
