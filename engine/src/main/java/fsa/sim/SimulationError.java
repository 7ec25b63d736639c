package fsa.sim;

/**
 * Reasons for which a run halts before consuming all of its input.
 */
public enum SimulationError {

  /**
   * Input symbol is not in the alphabet.
   */
  UNKNOWN_SYMBOL,

  /**
   * DFA has no transition from the current state on the input symbol.
   */
  MISSING_TRANSITION,

  /**
   * NFA has no active states left after consuming the input symbol.
   */
  NO_REACHABLE_STATES,

  /**
   * Automaton has no initial state, so no run can start.
   */
  MISSING_INITIAL_STATE
}
