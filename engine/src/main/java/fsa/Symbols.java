package fsa;

/**
 * Input symbols.
 *
 * <p>A symbol is a single {@code char}. The symbol {@link #EPSILON} is
 * reserved for spontaneous transitions and is never part of an alphabet.
 */
public final class Symbols {

  /**
   * The empty (spontaneous) transition symbol.
   */
  public static final char EPSILON = 'ε';

  private Symbols() { }

  public static boolean isEpsilon(char symbol) {
    return symbol == EPSILON;
  }

  /**
   * Parse a symbol from its string form (as found in serialized automata).
   *
   * @param text string which must contain exactly one character
   * @return the symbol
   * @throws IllegalArgumentException if the string is not a single character
   */
  public static char parse(String text) {
    if (text == null || text.length() != 1) {
      throw new IllegalArgumentException("symbol must be exactly one character: " + text);
    }
    return text.charAt(0);
  }
}
