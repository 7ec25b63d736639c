package fsa.tester;

import fsa.StateSet;
import fsa.sim.SimulationFailure;
import fsa.sim.SimulationResult;

import java.nio.file.Path;

/**
 * Test case in a test file.
 */
public class TestCase {

  /**
   * Path of the JSON file holding the automaton under test.
   */
  public final Path automatonPath;

  /**
   * Input string to feed to the automaton.
   */
  public final String input;

  /**
   * Expected output.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    Path automatonPath,
    String input,
    String output,
    String filePath,
    int lineNumber
  ) {
    this.automatonPath = automatonPath;
    this.input = input;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Construct an output string from a simulation result.
   *
   * <p>The output is the acceptance, the name of the last set of states
   * reached and, if the run failed, the kind of failure. For example:
   * {@code true {q2}} or {@code false {q0} UNKNOWN_SYMBOL}.
   *
   * @param result outcome of the run
   * @return output string
   */
  public static String createOutput(SimulationResult result) {
    final var outputBuilder = new StringBuilder();
    outputBuilder.append(result.accepted() ? "true " : "false ");

    final StateSet last = result
      .lastStep()
      .map(step -> step.states())
      .orElse(StateSet.EMPTY);
    outputBuilder.append(last.name());

    result.error()
      .map(SimulationFailure::kind)
      .ifPresent(kind -> outputBuilder.append(" " + kind));

    return outputBuilder.toString();
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return automatonPath.getFileName() + " on \"" + input + "\" (at " + filePath + ":" + lineNumber + ")";
  }
}
