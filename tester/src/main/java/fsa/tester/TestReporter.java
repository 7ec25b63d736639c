package fsa.tester;

interface TestReporter {

  /**
   * Handler for when an automaton (unexpectedly) fails to load.
   *
   * @param testCase test which failed
   * @param error exception that was thrown
   */
  public void onAutomatonError(TestCase testCase, Exception error);

  /**
   * Handler for when the simulation output does not match the expected output.
   *
   * @param testCase test which failed
   * @param foundOutput output which was found
   */
  public void onUnexpectedOutput(TestCase testCase, String foundOutput);

  /**
   * Handler for when a derived form of the automaton disagrees with the
   * simulation about acceptance.
   *
   * @param testCase test which failed
   * @param engine name of the disagreeing form
   * @param expected acceptance found by simulating the automaton
   */
  public void onInconsistentEngine(TestCase testCase, String engine, boolean expected);

  /**
   * Handler for a test passing.
   *
   * @param testCase test which passed
   * @param expectedFailure the successful behaviour was an error
   */
  public void onSuccess(TestCase testCase, boolean expectedFailure);
}
