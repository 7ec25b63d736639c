package fsa.tester;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;

/** Processes `.txt` files that encode test cases.
  *
  * Each case names an automaton JSON file, an input and the expected outcome
  * of running the automaton on the input (see {@link TestFileReader}).
  */
class FileTesterMain {

  static int successes = 0;
  static int failures = 0;
  static int skipped = 0;

  public static void main(String[] testFiles) throws IOException {

    // Console reporter - writes its output straight to console
    final var consoleReporter = new TestReporter() {
      @Override
      public void onAutomatonError(TestCase testCase, Exception error) {
        if (error instanceof NoSuchFileException) {
          FileTesterMain.skipped++;
        } else {
          System.err.println("Unexpected error loading " + testCase.getSummary() + ": " + error.getMessage());
          FileTesterMain.failures++;
        }
      }

      @Override
      public void onUnexpectedOutput(TestCase testCase, String foundOutput) {
        System.err.println("Unexpected output running " + testCase.getSummary() + ": expected '" + testCase.output + "' but got '" + foundOutput + "'");
        FileTesterMain.failures++;
      }

      @Override
      public void onInconsistentEngine(TestCase testCase, String engine, boolean expected) {
        System.err.println("Inconsistent " + engine + " running " + testCase.getSummary() + ": expected acceptance " + expected);
        FileTesterMain.failures++;
      }

      @Override
      public void onSuccess(TestCase testCase, boolean expectedFailure) {
        FileTesterMain.successes++;
      }
    };

    final var runner = new TestRunner(consoleReporter);
    for (String testFile : testFiles) {
      processFileOfTests(runner, testFile);
    }

    System.err.println();
    System.err.println("PASSED: " + successes + ", FAILED: " + failures + ", SKIPPED: " + skipped);
    if (failures > 0) {
      System.exit(1);
    }
  }

  /**
   * Process all of the tests inside a test file.
   *
   * @param runner test runner
   * @param testFile filepath to the tests
   */
  public static void processFileOfTests(TestRunner runner, String testFile) throws IOException {
    final TestFileReader reader;
    try {
      reader = new TestFileReader(testFile);
    } catch (FileNotFoundException err) {
      System.err.println("Failed to open file " + testFile + ": " + err.getMessage());
      return;
    }

    try (reader) {
      reader.forEachTestCase(runner);
    }
  }
}
