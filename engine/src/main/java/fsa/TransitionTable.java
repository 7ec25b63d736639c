package fsa;

import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Transitions of an automaton, indexed along source states and then symbols.
 *
 * <p>Implementations never hold an entry whose target set is empty: removing
 * the last target of a {@code (state, symbol)} pair removes the pair, and
 * removing the last pair of a state removes the state's row.
 */
interface TransitionTable {

  /**
   * Targets of a state on a symbol.
   *
   * @param from source state
   * @param symbol symbol (epsilon included)
   * @return unmodifiable set of targets, empty if there are none
   */
  Set<String> targets(String from, char symbol);

  /**
   * Outgoing transitions of a state.
   *
   * @param from source state
   * @return unmodifiable mapping from symbols to (non-empty) target sets
   */
  Map<Character, Set<String>> outgoing(String from);

  /**
   * Record a transition.
   *
   * @return whether the transition was accepted by this table
   */
  boolean add(String from, char symbol, String to);

  /**
   * Remove a transition.
   *
   * @return whether the transition existed
   */
  boolean remove(String from, char symbol, String to);

  /**
   * Remove every transition into or out of a state.
   *
   * @param state state being deleted
   */
  void removeState(String state);

  /**
   * Is the symbol used by at least one transition?
   */
  boolean uses(char symbol);

  /**
   * All transitions, grouped by source state.
   */
  Stream<Transition> stream();

  /**
   * Independent copy of this table.
   */
  TransitionTable copy();
}
