package com.swapengine.orderapi.config;

import com.swapengine.infra.kafka.producer.EnqueueFailedException;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Maps failures to RFC 7807 bodies under {@code /problems/<slug>}. */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String MISSING_FIELDS = "Missing required fields";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail onInvalidBody(MethodArgumentNotValidException ex) {
    List<InvalidField> fields =
        ex.getFieldErrors().stream()
            .map(error -> new InvalidField(error.getField(), error.getDefaultMessage()))
            .toList();
    ProblemDetail problem = missingFields();
    problem.setProperty("errors", fields);
    return problem;
  }

  // Unparseable JSON or a non-numeric amount.
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail onUnreadableBody(HttpMessageNotReadableException ex) {
    return missingFields();
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ProblemDetail onMediaType(HttpMediaTypeNotSupportedException ex) {
    return problem(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type", ex.getMessage());
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail onMethod(HttpRequestMethodNotSupportedException ex) {
    return problem(HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed", ex.getMessage());
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail onUnknownPath(NoResourceFoundException ex) {
    return problem(HttpStatus.NOT_FOUND, "not-found", ex.getMessage());
  }

  @ExceptionHandler(EnqueueFailedException.class)
  public ProblemDetail onEnqueueFailed(EnqueueFailedException ex) {
    log.error("Order not queued topic={} orderId={}", ex.getTopic(), ex.getOrderId(), ex);
    return problem(
        HttpStatus.SERVICE_UNAVAILABLE,
        "queue-unavailable",
        "Order queue is unavailable. Please resubmit later.");
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail onUnexpected(Exception ex) {
    log.error("Request failed unexpectedly", ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal-error",
        "An unexpected error occurred. Please try again later.");
  }

  private static ProblemDetail missingFields() {
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation-error", MISSING_FIELDS);
    problem.setTitle("Validation Error");
    problem.setProperty("error", MISSING_FIELDS);
    return problem;
  }

  private static ProblemDetail problem(HttpStatus status, String slug, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create("/problems/" + slug));
    problem.setTitle(status.getReasonPhrase());
    return problem;
  }

  private record InvalidField(String field, String message) {}
}
