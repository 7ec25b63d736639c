package fsa.check;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every finding of a validation pass.
 *
 * @param issues findings, in the order they were detected
 */
public record ValidationResult(List<ValidationIssue> issues) {

  public ValidationResult {
    issues = List.copyOf(issues);
  }

  public boolean valid() {
    return issues.isEmpty();
  }

  /**
   * Findings of one category.
   *
   * @param kind category to select
   * @return findings of that category, in detection order
   */
  public List<ValidationIssue> issues(IssueKind kind) {
    return issues
      .stream()
      .filter(issue -> issue.kind() == kind)
      .collect(Collectors.toList());
  }

  /**
   * Descriptions of the findings.
   */
  public List<String> errors() {
    return issues
      .stream()
      .map(ValidationIssue::message)
      .collect(Collectors.toList());
  }
}
