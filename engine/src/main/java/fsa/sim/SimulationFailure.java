package fsa.sim;

/**
 * Why a run stopped early.
 *
 * @param kind category of the failure
 * @param message human readable description
 */
public record SimulationFailure(SimulationError kind, String message) {

  static SimulationFailure unknownSymbol(char symbol) {
    return new SimulationFailure(
      SimulationError.UNKNOWN_SYMBOL,
      "Symbol " + symbol + " is not in the alphabet"
    );
  }

  static SimulationFailure missingTransition(String state, char symbol) {
    return new SimulationFailure(
      SimulationError.MISSING_TRANSITION,
      "No transition from state " + state + " on symbol " + symbol
    );
  }

  static SimulationFailure noReachableStates(char symbol) {
    return new SimulationFailure(
      SimulationError.NO_REACHABLE_STATES,
      "No transitions from current states on symbol " + symbol
    );
  }

  static SimulationFailure missingInitialState() {
    return new SimulationFailure(
      SimulationError.MISSING_INITIAL_STATE,
      "Initial state is not set"
    );
  }

  @Override
  public String toString() {
    return "Error: " + message;
  }
}
