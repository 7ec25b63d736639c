package fsa.tester;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TestRunnerTest {

  /**
   * Reporter remembering every outcome.
   */
  static class RecordingReporter implements TestReporter {
    final List<String> passed = new ArrayList<>();
    final List<String> failed = new ArrayList<>();
    final List<Exception> errors = new ArrayList<>();
    int expectedFailures = 0;

    @Override
    public void onAutomatonError(TestCase testCase, Exception error) {
      errors.add(error);
      failed.add(testCase.getSummary());
    }

    @Override
    public void onUnexpectedOutput(TestCase testCase, String foundOutput) {
      failed.add(testCase.getSummary() + " -> " + foundOutput);
    }

    @Override
    public void onInconsistentEngine(TestCase testCase, String engine, boolean expected) {
      failed.add(testCase.getSummary() + " -> " + engine);
    }

    @Override
    public void onSuccess(TestCase testCase, boolean expectedFailure) {
      passed.add(testCase.getSummary());
      if (expectedFailure) {
        expectedFailures++;
      }
    }
  }

  private static String casesFile(String name) throws URISyntaxException {
    return Path.of(TestRunnerTest.class.getResource("/cases/" + name).toURI()).toString();
  }

  @Test
  public void passingCases() throws Exception {
    final var reporter = new RecordingReporter();
    FileTesterMain.processFileOfTests(new TestRunner(reporter), casesFile("basic.txt"));

    assertEquals(List.of(), reporter.failed);
    assertEquals(10, reporter.passed.size());
    assertEquals(1, reporter.expectedFailures);
  }

  @Test
  public void failingCases() throws Exception {
    final var reporter = new RecordingReporter();
    FileTesterMain.processFileOfTests(new TestRunner(reporter), casesFile("failing.txt"));

    assertEquals(0, reporter.passed.size());
    assertEquals(2, reporter.failed.size());
    assertTrue(reporter.failed.get(0).endsWith("-> true {q2}"), reporter.failed.get(0));
    assertEquals(1, reporter.errors.size());
    assertInstanceOf(NoSuchFileException.class, reporter.errors.get(0));
  }

  @Test
  public void readsEscapesAndResolvesPaths() throws IOException, URISyntaxException {
    final String file = casesFile("basic.txt");
    final List<TestCase> cases = new ArrayList<>();
    try (var reader = new TestFileReader(file)) {
      reader.forEachTestCase(cases::add);
    }

    assertEquals(10, cases.size());

    final TestCase first = cases.get(0);
    assertEquals(Path.of(file).getParent().resolve("ends-with-ab.json"), first.automatonPath);
    assertEquals("bab", first.input);
    assertEquals("true {q2}", first.output);
    assertEquals(5, first.lineNumber);

    assertEquals("", cases.get(2).input);
    assertEquals("ab", cases.get(5).input);
  }
}
