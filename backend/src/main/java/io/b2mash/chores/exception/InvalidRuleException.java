package io.b2mash.chores.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a recurrence rule or subtask policy carries a value outside its domain (a weekday
 * outside 0..6, a monthday outside 1..31, an unknown rule kind). Recoverable misconfigurations are
 * degraded instead and never end up here.
 */
public class InvalidRuleException extends ErrorResponseException {

  public InvalidRuleException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem("Invalid recurrence rule", detail), null);
  }

  public InvalidRuleException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
