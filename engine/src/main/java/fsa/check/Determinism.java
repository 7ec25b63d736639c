package fsa.check;

import fsa.Automaton;
import fsa.Transition;

import java.util.Set;

/**
 * Classification of automata as deterministic or not, based on their
 * transitions alone (the declared kind is ignored and never changed).
 */
public final class Determinism {

  private Determinism() { }

  /**
   * Is the automaton deterministic?
   *
   * <p>An automaton without states or with an empty alphabet counts as
   * deterministic. Otherwise any epsilon transition, or any state and symbol
   * with several targets, makes it non-deterministic. Missing transitions do
   * not.
   *
   * @param automaton automaton to classify
   * @return whether every state and symbol has at most one target
   */
  public static boolean isDeterministic(Automaton automaton) {
    if (automaton.states().isEmpty() || automaton.alphabet().isEmpty()) {
      return true;
    }

    if (automaton.transitions().anyMatch(Transition::isEpsilon)) {
      return false;
    }

    for (String state : automaton.states()) {
      for (Set<String> targets : automaton.outgoing(state).values()) {
        if (targets.size() > 1) {
          return false;
        }
      }
    }
    return true;
  }
}
