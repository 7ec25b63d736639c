package fsa;

/**
 * Single edge in an automaton.
 *
 * @param from source state
 * @param symbol symbol consumed (possibly {@link Symbols#EPSILON})
 * @param to target state
 */
public record Transition(String from, char symbol, String to) {

  public boolean isEpsilon() {
    return Symbols.isEpsilon(symbol);
  }

  @Override
  public String toString() {
    return from + " -" + symbol + "-> " + to;
  }
}
