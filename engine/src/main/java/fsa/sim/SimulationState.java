package fsa.sim;

import fsa.AutomatonKind;
import fsa.StateSet;

import java.util.Optional;

/**
 * Snapshot of a run at one step.
 *
 * <p>Snapshots are recomputed from scratch on every query and are never
 * updated afterwards.
 *
 * @param kind kind of the automaton being run
 * @param states active states: at most one for a DFA
 * @param remainingInput input not yet consumed
 * @param accepted whether an active state is accepting
 * @param complete whether the run is over (input exhausted or failed)
 * @param error failure that ended the run, if any
 */
public record SimulationState(
  AutomatonKind kind,
  StateSet states,
  String remainingInput,
  boolean accepted,
  boolean complete,
  Optional<SimulationFailure> error
) {

  /**
   * Current state of a DFA run.
   *
   * @return the single active state, or nothing for an NFA or a run without
   *         initial state
   */
  public Optional<String> currentState() {
    if (kind != AutomatonKind.DFA || states.size() != 1) {
      return Optional.empty();
    }
    return Optional.of(states.iterator().next());
  }
}
