package fsa.json;

/**
 * Serialized automaton that cannot be turned back into an automaton, either
 * because it is not valid JSON or because it describes an inconsistent
 * automaton (references to undeclared states, multi-character symbols, ...).
 */
public class AutomatonFormatException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public AutomatonFormatException(String message) {
    super(message);
  }

  public AutomatonFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
