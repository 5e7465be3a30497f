package io.b2mash.chores.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.time.DateTimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({
    InvalidRuleException.class,
    InvalidCompletionException.class,
    InvalidStateException.class
  })
  public ResponseEntity<ProblemDetail> handleChoreProblem(
      ErrorResponseException ex, HttpServletRequest request) {
    log.warn(
        "Rejected request: path={}, title={}, detail={}",
        request.getRequestURI(),
        ex.getBody().getTitle(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
  public ResponseEntity<ProblemDetail> handleBadValue(
      RuntimeException ex, HttpServletRequest request) {
    log.warn("Invalid value: path={}, reason={}", request.getRequestURI(), ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid value");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.badRequest().body(problem);
  }
}
