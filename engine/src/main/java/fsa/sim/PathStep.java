package fsa.sim;

import fsa.StateSet;

import java.util.Optional;

/**
 * One entry of a run's path.
 *
 * @param states active states (a single state for a DFA)
 * @param remainingInput input not yet consumed at this point
 */
public record PathStep(StateSet states, String remainingInput) {

  /**
   * The active state, when exactly one is active.
   */
  public Optional<String> state() {
    return states.size() == 1 ? Optional.of(states.iterator().next()) : Optional.empty();
  }
}
