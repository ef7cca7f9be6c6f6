package io.b2mash.b2b.automation.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Rejects a rule definition at authoring time. Carries every violation found, not just the first,
 * in the problem's {@code violations} property.
 */
public class InvalidRuleException extends ErrorResponseException {

  private final List<String> violations;

  public InvalidRuleException(List<String> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(violations), null);
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }

  @Override
  public String getMessage() {
    return "Invalid automation rule: " + String.join("; ", violations);
  }

  private static ProblemDetail createProblem(List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid automation rule");
    problem.setDetail(String.join("; ", violations));
    problem.setProperty("violations", violations);
    return problem;
  }
}
