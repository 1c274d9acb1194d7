package io.b2mash.newsletter.senders.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders every failure as a {@link ProblemDetail} that also carries a {@code message} property.
 * Client errors expose their literal reason, server errors a generic phrase.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  static final String MESSAGE_PROPERTY = "message";

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex,
      Object body,
      HttpHeaders headers,
      HttpStatusCode statusCode,
      WebRequest request) {
    if (statusCode.is5xxServerError()) {
      log.error(
          "Request failed: status={}, request={}", statusCode.value(), describe(ex, request), ex);
    } else {
      log.warn(
          "Request rejected: status={}, request={}, reason={}",
          statusCode.value(),
          request.getDescription(false),
          ex.getMessage());
    }

    ResponseEntity<Object> response =
        super.handleExceptionInternal(ex, body, headers, statusCode, request);
    if (response != null && response.getBody() instanceof ProblemDetail problem) {
      problem.setProperty(MESSAGE_PROPERTY, messageOf(problem));
    }
    return response;
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error(
        "Unexpected failure: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Internal error");
    problem.setDetail("An unexpected error occurred");
    problem.setProperty(MESSAGE_PROPERTY, problem.getDetail());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  private static String messageOf(ProblemDetail problem) {
    if (problem.getDetail() != null) {
      return problem.getDetail();
    }
    return problem.getTitle() != null ? problem.getTitle() : "Request failed";
  }

  private static String describe(Exception ex, WebRequest request) {
    if (ex instanceof ExternalServiceException external) {
      return request.getDescription(false) + ", service=" + external.getService();
    }
    if (ex instanceof InternalProcessingException internal) {
      return request.getDescription(false) + ", reason=" + internal.getReason();
    }
    return request.getDescription(false);
  }
}
