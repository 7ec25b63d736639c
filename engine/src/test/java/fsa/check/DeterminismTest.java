package fsa.check;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fsa.Automaton;
import fsa.SampleAutomata;
import fsa.Symbols;

import org.junit.jupiter.api.Test;

public class DeterminismTest {

  @Test
  public void emptyAutomataAreDeterministic() {
    assertTrue(Automaton.nfa().isDeterministic());

    final Automaton noAlphabet = Automaton.nfa();
    noAlphabet.addState("q0");
    assertTrue(noAlphabet.isDeterministic());
  }

  @Test
  public void dfas() {
    assertTrue(SampleAutomata.endsWithAb().isDeterministic());
  }

  @Test
  public void nfas() {
    assertFalse(SampleAutomata.guessAb().isDeterministic());
    assertFalse(SampleAutomata.epsilonA().isDeterministic());

    final Automaton single = Automaton.nfa();
    single.addState("q0");
    single.addState("q1");
    single.addTransition("q0", 'a', "q1");
    single.addTransition("q1", 'b', "q0");
    assertTrue(single.isDeterministic());

    single.addTransition("q1", Symbols.EPSILON, "q0");
    assertFalse(single.isDeterministic());
  }

  @Test
  public void kindIsUnchanged() {
    final Automaton nfa = Automaton.nfa();
    nfa.addState("q0");
    nfa.addTransition("q0", 'a', "q0");
    assertTrue(Determinism.isDeterministic(nfa));
    assertFalse(nfa.isDfa());
  }
}
