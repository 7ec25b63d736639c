package fsa.check;

/**
 * Single validation finding.
 *
 * @param kind category of the finding
 * @param message human readable description
 */
public record ValidationIssue(IssueKind kind, String message) {

  @Override
  public String toString() {
    return message;
  }
}
