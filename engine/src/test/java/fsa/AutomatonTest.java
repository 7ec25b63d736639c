package fsa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class AutomatonTest {

  @Test
  public void addState() {
    final var dfa = Automaton.dfa();
    assertTrue(dfa.addState("q0"));
    assertFalse(dfa.addState("q0"));
    assertEquals(Set.of("q0"), dfa.states());
    assertThrows(IllegalArgumentException.class, () -> dfa.addState(""));
    assertThrows(NullPointerException.class, () -> dfa.addState(null));
  }

  @Test
  public void invalidStateReferencesAreRejected() {
    final Automaton dfa = SampleAutomata.endsWithAb();
    final Automaton before = dfa.copy();

    assertFalse(dfa.setInitialState("missing"));
    assertFalse(dfa.toggleFinalState("missing", true));
    assertFalse(dfa.toggleFinalState("missing"));
    assertFalse(dfa.addTransition("q0", 'a', "missing"));
    assertFalse(dfa.addTransition("missing", 'a', "q0"));
    assertFalse(dfa.removeTransition("q0", 'a', "missing"));
    assertFalse(dfa.removeState("missing"));

    assertEquals(before, dfa);
  }

  @Test
  public void dfaTransitions() {
    final Automaton dfa = SampleAutomata.endsWithAb();

    // Epsilon is refused, and replacing keeps a single target
    assertFalse(dfa.addTransition("q0", Symbols.EPSILON, "q1"));
    assertTrue(dfa.addTransition("q0", 'a', "q2"));
    assertEquals(Set.of("q2"), dfa.targets("q0", 'a'));

    // Removal requires the matching target
    assertFalse(dfa.removeTransition("q0", 'a', "q1"));
    assertTrue(dfa.removeTransition("q0", 'a', "q2"));
    assertEquals(Set.of(), dfa.targets("q0", 'a'));
    assertEquals(3, dfa.transitionCount());
  }

  @Test
  public void nfaTransitions() {
    final Automaton nfa = SampleAutomata.guessAb();
    assertEquals(Set.of("q0", "q1"), nfa.targets("q0", 'a'));
    assertTrue(nfa.addTransition("q2", Symbols.EPSILON, "q0"));
    assertEquals(Set.of("q0"), nfa.targets("q2", Symbols.EPSILON));
    assertEquals(Set.of('a', 'b'), nfa.alphabet());
    assertEquals(5, nfa.transitionCount());
  }

  @Test
  public void alphabetFollowsTransitions() {
    final var nfa = Automaton.nfa();
    nfa.addState("q0");
    nfa.addState("q1");

    nfa.addTransition("q0", 'x', "q1");
    nfa.addTransition("q1", 'x', "q0");
    nfa.addTransition("q0", Symbols.EPSILON, "q1");
    assertEquals(Set.of('x'), nfa.alphabet());

    // A symbol leaves the alphabet with its last transition
    nfa.removeTransition("q0", 'x', "q1");
    assertEquals(Set.of('x'), nfa.alphabet());
    nfa.removeTransition("q1", 'x', "q0");
    assertEquals(Set.of(), nfa.alphabet());
  }

  @Test
  public void setAlphabet() {
    final Automaton dfa = SampleAutomata.endsWithAb();
    dfa.setAlphabet(List.of('c', Symbols.EPSILON));
    assertEquals(Set.of('a', 'b', 'c'), dfa.alphabet());

    // Passing the alphabet itself keeps it
    dfa.setAlphabet(dfa.alphabet());
    assertEquals(Set.of('a', 'b', 'c'), dfa.alphabet());
  }

  @Test
  public void removeStateCascades() {
    final Automaton dfa = SampleAutomata.endsWithAb();
    assertTrue(dfa.removeState("q1"));

    assertEquals(Set.of("q0", "q2"), dfa.states());
    assertEquals(Set.of(), dfa.targets("q0", 'a'));
    assertEquals(1, dfa.transitionCount());

    // The alphabet is left alone
    assertEquals(Set.of('a', 'b'), dfa.alphabet());

    assertTrue(dfa.removeState("q0"));
    assertEquals(Optional.empty(), dfa.initialState());
    assertTrue(dfa.removeState("q2"));
    assertEquals(Set.of(), dfa.finalStates());
  }

  @Test
  public void toggleFinalState() {
    final Automaton dfa = SampleAutomata.endsWithAb();
    assertTrue(dfa.toggleFinalState("q0"));
    assertTrue(dfa.isFinal("q0"));
    assertTrue(dfa.toggleFinalState("q0"));
    assertFalse(dfa.isFinal("q0"));
    assertTrue(dfa.toggleFinalState("q2", true));
    assertTrue(dfa.isFinal("q2"));
  }

  @Test
  public void copyIsIndependent() {
    final Automaton original = SampleAutomata.guessAb();
    final Automaton copy = original.copy();
    assertEquals(original, copy);
    assertEquals(original.hashCode(), copy.hashCode());

    copy.addTransition("q2", 'a', "q2");
    copy.removeState("q1");
    assertNotEquals(original, copy);
    assertEquals(Set.of("q0", "q1"), original.targets("q0", 'a'));
    assertEquals(Set.of(), original.targets("q2", 'a'));
  }

  @Test
  public void normalize() {
    final var dfa = Automaton.dfa();
    dfa.addState("s");
    dfa.addState("t");
    dfa.addState("u");
    dfa.setInitialState("u");
    dfa.toggleFinalState("t", true);
    dfa.addTransition("u", 'a', "s");
    dfa.addTransition("s", 'b', "t");

    final Automaton normalized = dfa.normalize();
    assertEquals(Set.of("q0", "q1", "q2"), normalized.states());
    assertEquals(Optional.of("q0"), normalized.initialState());
    assertEquals(Set.of("q1"), normalized.finalStates());
    assertEquals(Set.of("q2"), normalized.targets("q0", 'a'));
    assertEquals(Set.of("q1"), normalized.targets("q2", 'b'));

    // The original is untouched
    assertEquals(Set.of("s", "t", "u"), dfa.states());
  }

  @Test
  public void equalityIsStructural() {
    final var left = Automaton.nfa();
    left.addState("q0");
    left.addState("q1");
    left.addTransition("q0", 'a', "q1");
    left.addTransition("q0", 'b', "q0");

    final var right = Automaton.nfa();
    right.addState("q0");
    right.addState("q1");
    right.addTransition("q0", 'b', "q0");
    right.addTransition("q0", 'a', "q1");

    assertEquals(left, right);

    final var dfa = Automaton.dfa();
    dfa.addState("q0");
    dfa.addState("q1");
    dfa.addTransition("q0", 'a', "q1");
    dfa.addTransition("q0", 'b', "q0");
    assertNotEquals(left, dfa);
  }
}
