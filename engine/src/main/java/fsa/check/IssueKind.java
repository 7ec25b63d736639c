package fsa.check;

/**
 * Categories of validation findings.
 */
public enum IssueKind {
  MISSING_INITIAL_STATE,
  NO_FINAL_STATES,

  /**
   * A DFA state lacks a transition for some alphabet symbol.
   */
  INCOMPLETE_DFA
}
