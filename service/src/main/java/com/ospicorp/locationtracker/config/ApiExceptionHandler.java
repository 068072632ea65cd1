package com.ospicorp.locationtracker.config;

import com.ospicorp.locationtracker.store.StoreAccessDeniedException;
import com.ospicorp.locationtracker.store.StoreException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Renders every failure as an RFC 7807 problem. The HTTP status carries the error kind:
 * 404 for a missing table without mock data, 403 when DynamoDB denies access, 500 otherwise.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex.getMessage(), ex, request);
  }

  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
  public ResponseEntity<ProblemDetail> handleRouting(Exception ex, HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
    if (status == null) {
      status = HttpStatus.NOT_FOUND;
    }
    return buildProblem(status, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(StoreAccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(StoreAccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ProblemDetail> handleStoreFailure(StoreException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex.getReason(), ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error: " + ex.getMessage(),
        ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String message,
      Exception ex, HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.location-tracker.dev/problems/"
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_PROBLEM_JSON)
        .body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(),
          ClientRequests.uriWithQuery(request),
          ClientRequests.clientIp(request),
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(),
          ClientRequests.uriWithQuery(request),
          ClientRequests.clientIp(request),
          status.value(),
          errorMessage);
    }
  }
}
