package dev.aparikh.hybridsearch.web;

import dev.aparikh.hybridsearch.ConfigurationException;
import dev.aparikh.hybridsearch.InvalidQueryException;
import dev.aparikh.hybridsearch.ScoringException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps pipeline exceptions to {@link ErrorResponse} bodies. Anything not listed here falls through to
 * Spring Boot's default error handling (HTTP 500).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_configuration", ex.getMessage());
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_query", ex.getMessage());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(ScoringException.class)
    public ResponseEntity<ErrorResponse> handleScoring(ScoringException ex) {
        log.error("Request failed with a scoring error", ex);
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "scoring_error", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, @Nullable String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
