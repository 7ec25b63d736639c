package fsa;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Automata and inputs shared by tests.
 */
public final class SampleAutomata {

  private SampleAutomata() { }

  /**
   * DFA over {@code {a,b}} accepting {@code b*a+b}. The accepting state has
   * no outgoing transitions.
   */
  public static Automaton endsWithAb() {
    final var dfa = Automaton.dfa();
    dfa.addState("q0");
    dfa.addState("q1");
    dfa.addState("q2");
    dfa.setInitialState("q0");
    dfa.toggleFinalState("q2", true);
    dfa.addTransition("q0", 'a', "q1");
    dfa.addTransition("q0", 'b', "q0");
    dfa.addTransition("q1", 'a', "q1");
    dfa.addTransition("q1", 'b', "q2");
    return dfa;
  }

  /**
   * NFA {@code q0 -ε-> q1 -a-> q2} accepting exactly {@code a}.
   */
  public static Automaton epsilonA() {
    final var nfa = Automaton.nfa();
    nfa.addState("q0");
    nfa.addState("q1");
    nfa.addState("q2");
    nfa.setInitialState("q0");
    nfa.toggleFinalState("q2", true);
    nfa.addTransition("q0", Symbols.EPSILON, "q1");
    nfa.addTransition("q1", 'a', "q2");
    return nfa;
  }

  /**
   * NFA over {@code {a,b}} accepting strings ending in {@code ab}.
   */
  public static Automaton guessAb() {
    final var nfa = Automaton.nfa();
    nfa.addState("q0");
    nfa.addState("q1");
    nfa.addState("q2");
    nfa.setInitialState("q0");
    nfa.toggleFinalState("q2", true);
    nfa.addTransition("q0", 'a', "q0");
    nfa.addTransition("q0", 'a', "q1");
    nfa.addTransition("q0", 'b', "q0");
    nfa.addTransition("q1", 'b', "q2");
    return nfa;
  }

  /**
   * DFA over {@code {a,b}} accepting every non-empty string, with two
   * indistinguishable accepting states.
   */
  public static Automaton nonEmpty() {
    final var dfa = Automaton.dfa();
    dfa.addState("q0");
    dfa.addState("q1");
    dfa.addState("q2");
    dfa.setInitialState("q0");
    dfa.toggleFinalState("q1", true);
    dfa.toggleFinalState("q2", true);
    dfa.addTransition("q0", 'a', "q1");
    dfa.addTransition("q0", 'b', "q2");
    dfa.addTransition("q1", 'a', "q1");
    dfa.addTransition("q1", 'b', "q1");
    dfa.addTransition("q2", 'a', "q2");
    dfa.addTransition("q2", 'b', "q2");
    return dfa;
  }

  /**
   * Random automaton over {@code {a,b}} with states {@code q0, q1, ...} and
   * initial state {@code q0}.
   *
   * @param random source of randomness
   * @param kind kind of automaton (NFAs also get epsilon transitions)
   * @param stateCount number of states
   * @return new automaton
   */
  public static Automaton random(Random random, AutomatonKind kind, int stateCount) {
    final var automaton = new Automaton(kind);
    for (int i = 0; i < stateCount; i++) {
      automaton.addState("q" + i);
      if (random.nextInt(3) == 0) {
        automaton.toggleFinalState("q" + i, true);
      }
    }
    automaton.setInitialState("q0");

    for (int from = 0; from < stateCount; from++) {
      for (char symbol : new char[] { 'a', 'b' }) {
        if (kind == AutomatonKind.DFA) {
          if (random.nextInt(4) != 0) {
            automaton.addTransition("q" + from, symbol, "q" + random.nextInt(stateCount));
          }
        } else {
          for (int to = 0; to < stateCount; to++) {
            if (random.nextInt(3) == 0) {
              automaton.addTransition("q" + from, symbol, "q" + to);
            }
          }
        }
      }
      if (kind == AutomatonKind.NFA) {
        for (int to = 0; to < stateCount; to++) {
          if (to != from && random.nextInt(6) == 0) {
            automaton.addTransition("q" + from, Symbols.EPSILON, "q" + to);
          }
        }
      }
    }

    automaton.setAlphabet(List.of('a', 'b'));
    return automaton;
  }

  /**
   * Every string over an alphabet up to some length, shortest first.
   *
   * @param alphabet symbols to use
   * @param maxLength maximum length (inclusive)
   * @return strings, starting with the empty string
   */
  public static List<String> strings(String alphabet, int maxLength) {
    final List<String> strings = new ArrayList<>();
    strings.add("");
    int start = 0;
    for (int length = 1; length <= maxLength; length++) {
      final int end = strings.size();
      for (int i = start; i < end; i++) {
        for (char symbol : alphabet.toCharArray()) {
          strings.add(strings.get(i) + symbol);
        }
      }
      start = end;
    }
    return strings;
  }
}
