package fsa.tester;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Skips over comment lines, processes escape sequences.
 *
 * <p>Every test case spans three (non-comment, non-blank) lines:
 *
 * <ol>
 *   <li>path of the automaton JSON, relative to the test file
 *   <li>input, in double quotes
 *   <li>expected output (see {@link TestCase#createOutput})
 * </ol>
 */
public class TestFileReader implements AutoCloseable {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader reader;

  private final String filePath;

  /**
   * Directory against which automaton paths are resolved.
   */
  private final Path baseDirectory;

  private int lineNumber = 0;

  public TestFileReader(String filePath) throws FileNotFoundException {
    this.reader = new BufferedReader(new FileReader(filePath));
    this.filePath = filePath;
    final Path parent = Path.of(filePath).toAbsolutePath().getParent();
    this.baseDirectory = parent == null ? Path.of("") : parent;
  }

  /**
   * Read the next processed line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      } else if (line.startsWith("//") || line.isBlank()) {
        continue; // Not a valid line
      }

      line = processLineEscapes(line);
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   *
   * @return next test case, or {@code null} at the end of the file
   * @throws IOException if the file ends in the middle of a test case
   */
  public TestCase readTestCase() throws IOException {

    // Test data
    final String automatonLine = readLine();
    if (automatonLine == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String inputLine = readLine();
    final String outputData = readLine();
    if (inputLine == null || outputData == null) {
      throw new IOException("Truncated test case at " + filePath + ":" + lineNumber);
    }

    return new TestCase(
      baseDirectory.resolve(automatonLine.strip()),
      unquote(inputLine.strip()),
      outputData.strip(),
      filePath,
      lineNumber
    );
  }

  /**
   * Run an action for every remaining test case in the file.
   *
   * @param action action to run on each test case
   */
  public void forEachTestCase(Consumer<? super TestCase> action) throws IOException {
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      action.accept(testCase);
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  private String unquote(String line) throws IOException {
    if (line.length() < 2 || line.charAt(0) != '"' || line.charAt(line.length() - 1) != '"') {
      throw new IOException("Expected a quoted input at " + filePath + ":" + lineNumber);
    }
    return line.substring(1, line.length() - 1);
  }

  /**
   * Process a line to replace some escape sequences with the actual characters
   *
   * @param line line to escape
   * @return escaped line
   */
  private static String processLineEscapes(String line) {

    // process newline escapes
    line = line.replaceAll("\\\\n", "\n");

    // process unicode escapes
    line = UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Character.toString((char) Integer.parseInt(result.group(1), 16))
    );

    return line;
  }
}
