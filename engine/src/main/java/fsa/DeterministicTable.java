package fsa;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transition table with a single target per {@code (state, symbol)} pair.
 *
 * <p>Epsilon transitions are refused. Adding a transition for a pair that
 * already has a target replaces that target.
 */
final class DeterministicTable implements TransitionTable {

  private final Map<String, Map<Character, String>> rows = new LinkedHashMap<>();

  @Override
  public Set<String> targets(String from, char symbol) {
    final Map<Character, String> row = rows.get(from);
    if (row == null) {
      return Collections.emptySet();
    }
    final String to = row.get(symbol);
    return to == null ? Collections.emptySet() : Collections.singleton(to);
  }

  @Override
  public Map<Character, Set<String>> outgoing(String from) {
    final Map<Character, String> row = rows.getOrDefault(from, Collections.emptyMap());
    return Collections.unmodifiableMap(
      row
        .entrySet()
        .stream()
        .collect(Collectors.toMap(
          Map.Entry::getKey,
          e -> Collections.singleton(e.getValue()),
          (a, b) -> a,
          LinkedHashMap::new
        ))
    );
  }

  @Override
  public boolean add(String from, char symbol, String to) {
    if (Symbols.isEpsilon(symbol)) {
      return false;
    }
    rows.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(symbol, to);
    return true;
  }

  @Override
  public boolean remove(String from, char symbol, String to) {
    final Map<Character, String> row = rows.get(from);
    if (row == null || !to.equals(row.get(symbol))) {
      return false;
    }
    row.remove(symbol);
    if (row.isEmpty()) {
      rows.remove(from);
    }
    return true;
  }

  @Override
  public void removeState(String state) {
    rows.remove(state);
    final Iterator<Map<Character, String>> rowIterator = rows.values().iterator();
    while (rowIterator.hasNext()) {
      final Map<Character, String> row = rowIterator.next();
      row.values().removeIf(state::equals);
      if (row.isEmpty()) {
        rowIterator.remove();
      }
    }
  }

  @Override
  public boolean uses(char symbol) {
    return rows.values().stream().anyMatch(row -> row.containsKey(symbol));
  }

  @Override
  public Stream<Transition> stream() {
    return rows
      .entrySet()
      .stream()
      .flatMap(row ->
        row
          .getValue()
          .entrySet()
          .stream()
          .map(e -> new Transition(row.getKey(), e.getKey(), e.getValue()))
      );
  }

  @Override
  public DeterministicTable copy() {
    final var copy = new DeterministicTable();
    rows.forEach((from, row) -> copy.rows.put(from, new LinkedHashMap<>(row)));
    return copy;
  }
}
