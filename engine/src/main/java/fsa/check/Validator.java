package fsa.check;

import fsa.Automaton;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on automata.
 *
 * <p>Validation never stops at the first problem: it reports a missing
 * initial state, the absence of accepting states and, for a DFA, every state
 * and symbol pair without a transition. NFAs need not be total.
 *
 * <p>Transformations and simulations assume an automaton which passes the
 * initial state check.
 */
public final class Validator {

  private Validator() { }

  public static ValidationResult validate(Automaton automaton) {
    final List<ValidationIssue> issues = new ArrayList<>();

    if (automaton.initialState().isEmpty()) {
      issues.add(new ValidationIssue(IssueKind.MISSING_INITIAL_STATE, "Initial state is not set"));
    }

    if (automaton.finalStates().isEmpty()) {
      issues.add(new ValidationIssue(IssueKind.NO_FINAL_STATES, "No final states defined"));
    }

    if (automaton.isDfa()) {
      for (String state : automaton.states()) {
        for (char symbol : automaton.alphabet()) {
          if (automaton.targets(state, symbol).isEmpty()) {
            issues.add(new ValidationIssue(
              IssueKind.INCOMPLETE_DFA,
              "State " + state + " has no transition for symbol " + symbol
            ));
          }
        }
      }
    }

    return new ValidationResult(issues);
  }
}
