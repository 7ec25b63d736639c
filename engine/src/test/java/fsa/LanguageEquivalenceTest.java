package fsa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fsa.codegen.AcceptorCompiler;
import fsa.codegen.CompiledAcceptor;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Every way of running an automaton accepts the same strings.
 */
public class LanguageEquivalenceTest {

  private static final List<String> INPUTS = SampleAutomata.strings("ab", 6);

  private static void checkEquivalent(Automaton automaton) {
    final Automaton dfa = automaton.convertToDFA();
    final Automaton minimal = automaton.minimize();
    final Automaton normalized = automaton.normalize();
    final Automaton reread = Automaton.fromJson(automaton.toJson());
    final CompiledAcceptor compiled = AcceptorCompiler.compile(automaton);

    assertTrue(dfa.isDfa());
    assertTrue(minimal.states().size() <= Closures.reachable(dfa).size(), automaton.toString());

    for (String input : INPUTS) {
      final boolean expected = automaton.simulate(input).accepted();
      final String context = input + " on " + automaton;
      assertEquals(expected, dfa.simulate(input).accepted(), context);
      assertEquals(expected, minimal.simulate(input).accepted(), context);
      assertEquals(expected, normalized.simulate(input).accepted(), context);
      assertEquals(expected, reread.simulate(input).accepted(), context);
      assertEquals(expected, compiled.accepts(input), context);
    }
  }

  @Test
  public void sampleAutomata() {
    checkEquivalent(SampleAutomata.endsWithAb());
    checkEquivalent(SampleAutomata.epsilonA());
    checkEquivalent(SampleAutomata.guessAb());
    checkEquivalent(SampleAutomata.nonEmpty());
  }

  @Test
  public void randomDfas() {
    final var random = new Random(1234);
    for (int i = 0; i < 40; i++) {
      checkEquivalent(SampleAutomata.random(random, AutomatonKind.DFA, 1 + random.nextInt(6)));
    }
  }

  @Test
  public void randomNfas() {
    final var random = new Random(5678);
    for (int i = 0; i < 40; i++) {
      checkEquivalent(SampleAutomata.random(random, AutomatonKind.NFA, 1 + random.nextInt(6)));
    }
  }
}
