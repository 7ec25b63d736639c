package fsa;

/**
 * Flavour of an automaton, which also decides the shape of its transition
 * table.
 */
public enum AutomatonKind {

  /**
   * Deterministic: at most one target per state and symbol, no epsilon.
   */
  DFA {
    @Override
    TransitionTable newTable() {
      return new DeterministicTable();
    }
  },

  /**
   * Non-deterministic: any number of targets per state and symbol, epsilon
   * transitions allowed.
   */
  NFA {
    @Override
    TransitionTable newTable() {
      return new NondeterministicTable();
    }
  };

  /**
   * Fresh empty transition table for this kind of automaton.
   */
  abstract TransitionTable newTable();
}
