package fsa.tester;

import fsa.Automaton;
import fsa.codegen.AcceptorCompiler;
import fsa.codegen.CompiledAcceptor;
import fsa.json.AutomatonJson;
import fsa.sim.SimulationResult;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Charged with running test cases.
 *
 * <p>Besides comparing the simulation output with the expected output, every
 * test also checks that the subset-constructed DFA, the minimized DFA and the
 * compiled acceptor agree with the simulation on acceptance.
 */
public class TestRunner implements Consumer<TestCase> {

  private static final Logger LOG = LoggerFactory.getLogger(TestRunner.class);

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  /**
   * Automata already loaded (many tests share the same automaton file).
   */
  private final Map<Path, LoadedAutomaton> loaded = new HashMap<>();

  public TestRunner(TestReporter reporter) {
    this.reporter = reporter;
  }

  /**
   * Automaton along with its derived forms.
   *
   * @param automaton automaton as read from the file
   * @param derived acceptance checks of the derived forms, by name (empty
   *                if the automaton has no initial state)
   */
  private record LoadedAutomaton(Automaton automaton, Map<String, Predicate<String>> derived) {

    static LoadedAutomaton load(Path path) throws Exception {
      final Automaton automaton = AutomatonJson.read(path);
      final var derived = new LinkedHashMap<String, Predicate<String>>();
      if (automaton.initialState().isPresent()) {
        final Automaton dfa = automaton.convertToDFA();
        final Automaton minimal = automaton.minimize();
        final CompiledAcceptor acceptor = AcceptorCompiler.compile(automaton);
        derived.put("subset construction", input -> dfa.simulate(input).accepted());
        derived.put("minimization", input -> minimal.simulate(input).accepted());
        derived.put("compiled acceptor", acceptor::accepts);
      }
      LOG.debug("loaded {} with derived forms {}", path, derived.keySet());
      return new LoadedAutomaton(automaton, derived);
    }
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {

    // Load the automaton
    final LoadedAutomaton subject;
    try {
      subject = load(testCase.automatonPath);
    } catch (Exception error) {
      if (testCase.output.startsWith("error")) {
        reporter.onSuccess(testCase, true);
      } else {
        reporter.onAutomatonError(testCase, error);
      }
      return;
    }

    // Run it
    final SimulationResult result = subject.automaton().simulate(testCase.input);

    // Cross-check the derived forms
    for (Map.Entry<String, Predicate<String>> engine : subject.derived().entrySet()) {
      if (engine.getValue().test(testCase.input) != result.accepted()) {
        reporter.onInconsistentEngine(testCase, engine.getKey(), result.accepted());
        return;
      }
    }

    // Compare the outputs
    final String foundOutput = TestCase.createOutput(result);
    if (testCase.output.equals(foundOutput)) {
      reporter.onSuccess(testCase, false);
    } else {
      reporter.onUnexpectedOutput(testCase, foundOutput);
    }
  }

  private LoadedAutomaton load(Path path) throws Exception {
    final LoadedAutomaton cached = loaded.get(path);
    if (cached != null) {
      return cached;
    }
    final LoadedAutomaton fresh = LoadedAutomaton.load(path);
    loaded.put(path, fresh);
    return fresh;
  }
}
