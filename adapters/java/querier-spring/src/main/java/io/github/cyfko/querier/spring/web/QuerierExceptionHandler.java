package io.github.cyfko.querier.spring.web;

import io.github.cyfko.querier.core.exception.QuerierStateException;
import io.github.cyfko.querier.core.exception.QuerierValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps querier failures to RFC 7807 problem responses.
 * <ul>
 *   <li>{@link QuerierValidationException}: 400, with {@code field}, {@code operator} and {@code value} properties</li>
 *   <li>{@link QuerierStateException}: 500</li>
 * </ul>
 *
 * @author Frank KOSSI
 */
@RestControllerAdvice
public class QuerierExceptionHandler {

    private static final Logger logger = Logger.getLogger(QuerierExceptionHandler.class.getName());

    @ExceptionHandler(QuerierValidationException.class)
    public ProblemDetail handleValidation(QuerierValidationException ex) {
        logger.fine(() -> "Rejected query: " + ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid query parameter");
        problem.setProperty("field", ex.getField());
        problem.setProperty("operator", ex.getOperator());
        problem.setProperty("value", ex.getRawValue());
        return problem;
    }

    @ExceptionHandler(QuerierStateException.class)
    public ProblemDetail handleState(QuerierStateException ex) {
        logger.log(Level.SEVERE, "Querier misuse", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
        problem.setTitle("Query execution error");
        return problem;
    }
}
