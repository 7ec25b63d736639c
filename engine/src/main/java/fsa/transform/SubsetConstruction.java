package fsa.transform;

import fsa.Automaton;
import fsa.AutomatonKind;
import fsa.Closures;
import fsa.StateSet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of an NFA into an equivalent DFA (powerset construction).
 *
 * <p>Every DFA state stands for the set of NFA states active at some point of
 * a run and is named after that set (see {@link StateSet#name()}). Equal sets
 * reached along different paths therefore collapse into a single DFA state.
 * Only non-empty sets become states: when a set has no successor on a symbol
 * the DFA simply has no transition, rather than a transition into a dead
 * state.
 */
public final class SubsetConstruction {

  private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

  private SubsetConstruction() { }

  /**
   * Construct a DFA accepting the same language as an automaton.
   *
   * @param automaton automaton to convert; a DFA is returned as a copy
   * @return equivalent DFA
   * @throws IllegalStateException if the automaton has no initial state
   */
  public static Automaton convert(Automaton automaton) {
    if (automaton.isDfa()) {
      return automaton.copy();
    }

    final String initial = automaton
      .initialState()
      .orElseThrow(() -> new IllegalStateException("cannot convert an automaton without initial state"));

    final var dfa = new Automaton(AutomatonKind.DFA);
    dfa.setAlphabet(automaton.alphabet());

    final Set<StateSet> seenStates = new HashSet<>();
    final Deque<StateSet> toVisit = new ArrayDeque<>();

    // Seed the worklist with the closure of the initial state
    final StateSet initialSet = Closures.epsilonClosure(automaton, List.of(initial));
    register(automaton, dfa, initialSet);
    dfa.setInitialState(initialSet.name());
    seenStates.add(initialSet);
    toVisit.add(initialSet);

    while (!toVisit.isEmpty()) {
      final StateSet powerState = toVisit.poll();

      for (char symbol : automaton.alphabet()) {
        final StateSet next = Closures.epsilonClosure(automaton, Closures.move(automaton, powerState, symbol));
        if (next.isEmpty()) {
          continue;
        }
        if (seenStates.add(next)) {
          register(automaton, dfa, next);
          toVisit.add(next);
        }
        dfa.addTransition(powerState.name(), symbol, next.name());
      }
    }

    LOG.debug(
      "subset construction: {} NFA states -> {} DFA states",
      automaton.states().size(),
      dfa.states().size()
    );
    return dfa;
  }

  // Add a powerset state to the DFA, accepting if any member is accepting
  private static void register(Automaton nfa, Automaton dfa, StateSet powerState) {
    if (!dfa.addState(powerState.name())) {
      throw new IllegalStateException("powerset state name is already taken: " + powerState.name());
    }
    if (powerState.intersects(nfa.finalStates())) {
      dfa.toggleFinalState(powerState.name(), true);
    }
  }
}
