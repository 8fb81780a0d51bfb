package com.pipelinerecon.reconciliationapi.config;

import com.pipelinerecon.domain.reconciliation.ReconciliationDomainException;
import com.pipelinerecon.reconciliationapi.batches.BatchNameConflictException;
import com.pipelinerecon.reconciliationapi.batches.BatchNotFoundException;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure leaving a controller to an RFC 7807 body whose {@code type} is {@code
 * /problems/<slug>}. Clients branch on the slug, never on {@code detail}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(BatchNotFoundException.class)
  public ProblemDetail handleBatchNotFound(BatchNotFoundException ex) {
    ProblemDetail problem =
        problem(HttpStatus.NOT_FOUND, "batch-not-found", "Batch Not Found", ex.getMessage());
    problem.setProperty("batchId", ex.batchId());
    return problem;
  }

  @ExceptionHandler(BatchNameConflictException.class)
  public ProblemDetail handleBatchNameConflict(BatchNameConflictException ex) {
    return problem(
        HttpStatus.CONFLICT, "batch-name-conflict", "Batch Name Conflict", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    List<FieldViolation> violations =
        ex.getFieldErrors().stream()
            .map(
                error ->
                    new FieldViolation(
                        error.getField(),
                        error.getDefaultMessage(),
                        String.valueOf(error.getRejectedValue())))
            .toList();
    ProblemDetail problem =
        problem(
            HttpStatus.BAD_REQUEST,
            "validation-error",
            "Validation Error",
            "Request validation failed");
    problem.setProperty("errors", violations);
    return problem;
  }

  // Also reached for enum-typed JSON fields carrying an unknown value.
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    return problem(
        HttpStatus.BAD_REQUEST,
        "unreadable-request",
        "Unreadable Request",
        "Request body is malformed");
  }

  @ExceptionHandler({IllegalArgumentException.class, ReconciliationDomainException.class})
  public ProblemDetail handleInvalidArgument(RuntimeException ex) {
    return problem(HttpStatus.BAD_REQUEST, "invalid-argument", "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParameter(MissingServletRequestParameterException ex) {
    return problem(
        HttpStatus.BAD_REQUEST,
        "missing-parameter",
        "Missing Parameter",
        "Required parameter '" + ex.getParameterName() + "' is missing");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    Class<?> requiredType = ex.getRequiredType();
    String expected = requiredType == null ? "unknown" : requiredType.getSimpleName();
    return problem(
        HttpStatus.BAD_REQUEST,
        "type-mismatch",
        "Type Mismatch",
        "Parameter '" + ex.getName() + "' should be of type '" + expected + "'");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    return problem(
        HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed", "Method Not Allowed", ex.getMessage());
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNoResource(NoResourceFoundException ex) {
    return problem(
        HttpStatus.NOT_FOUND,
        "not-found",
        "Not Found",
        "No endpoint " + ex.getHttpMethod() + " /" + ex.getResourcePath());
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception type={}", ex.getClass().getName(), ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal-error",
        "Internal Server Error",
        "An unexpected error occurred. Please try again later.");
  }

  private static ProblemDetail problem(
      HttpStatus status, String slug, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create(TYPE_PREFIX + slug));
    problem.setTitle(title);
    return problem;
  }

  private record FieldViolation(String field, String message, String rejectedValue) {}
}
