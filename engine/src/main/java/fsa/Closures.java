package fsa;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.Stack;

/**
 * Reachability primitives over the transitions of an automaton.
 *
 * <p>{@link #epsilonClosure} and {@link #move} are the only places that walk
 * non-deterministic transitions: simulation and subset construction are both
 * built on top of them.
 */
public final class Closures {

  private Closures() { }

  /**
   * States reachable from a set of states using only epsilon transitions.
   *
   * <p>The starting states are always part of the closure.
   *
   * @param automaton automaton whose transitions are followed
   * @param startingStates states from which to initiate the search
   * @return closure, in canonical order
   */
  public static StateSet epsilonClosure(Automaton automaton, Collection<String> startingStates) {
    final var closure = new HashSet<String>(startingStates);
    final var toVisit = new Stack<String>();
    toVisit.addAll(startingStates);

    while (!toVisit.isEmpty()) {
      for (String target : automaton.targets(toVisit.pop(), Symbols.EPSILON)) {
        if (closure.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return new StateSet(closure);
  }

  /**
   * @see #epsilonClosure(Automaton, Collection)
   */
  public static StateSet epsilonClosure(Automaton automaton, StateSet startingStates) {
    return epsilonClosure(automaton, startingStates.toList());
  }

  /**
   * Union of the targets of a set of states on a symbol.
   *
   * <p>Epsilon transitions are not followed, neither before nor after the
   * symbol. Moving on epsilon itself yields the empty set.
   *
   * @param automaton automaton whose transitions are followed
   * @param fromStates source states
   * @param symbol symbol to consume
   * @return target states, in canonical order
   */
  public static StateSet move(Automaton automaton, Iterable<String> fromStates, char symbol) {
    if (Symbols.isEpsilon(symbol)) {
      return StateSet.EMPTY;
    }
    final var targets = new HashSet<String>();
    for (String from : fromStates) {
      targets.addAll(automaton.targets(from, symbol));
    }
    return new StateSet(targets);
  }

  /**
   * States reachable from the initial state, following every transition
   * (epsilon included) breadth first.
   *
   * @param automaton automaton to explore
   * @return reachable states in discovery order, or nothing if there is no
   *         initial state
   */
  public static Set<String> reachable(Automaton automaton) {
    final Set<String> seen = new LinkedHashSet<>();
    final Deque<String> toVisit = new ArrayDeque<>();

    automaton.initialState().ifPresent(initial -> {
      seen.add(initial);
      toVisit.add(initial);
    });

    while (!toVisit.isEmpty()) {
      for (Set<String> targets : automaton.outgoing(toVisit.poll()).values()) {
        for (String target : targets) {
          if (seen.add(target)) {
            toVisit.add(target);
          }
        }
      }
    }

    return seen;
  }
}
