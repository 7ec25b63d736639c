package fsa;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transition table mapping each {@code (state, symbol)} pair to a set of
 * targets. Epsilon transitions are allowed.
 */
final class NondeterministicTable implements TransitionTable {

  private final Map<String, Map<Character, Set<String>>> rows = new LinkedHashMap<>();

  @Override
  public Set<String> targets(String from, char symbol) {
    final Map<Character, Set<String>> row = rows.get(from);
    if (row == null) {
      return Collections.emptySet();
    }
    final Set<String> to = row.get(symbol);
    return to == null ? Collections.emptySet() : Collections.unmodifiableSet(to);
  }

  @Override
  public Map<Character, Set<String>> outgoing(String from) {
    final Map<Character, Set<String>> row = rows.getOrDefault(from, Collections.emptyMap());
    return Collections.unmodifiableMap(
      row
        .entrySet()
        .stream()
        .collect(Collectors.toMap(
          Map.Entry::getKey,
          e -> Collections.unmodifiableSet(e.getValue()),
          (a, b) -> a,
          LinkedHashMap::new
        ))
    );
  }

  @Override
  public boolean add(String from, char symbol, String to) {
    rows
      .computeIfAbsent(from, k -> new LinkedHashMap<>())
      .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
      .add(to);
    return true;
  }

  @Override
  public boolean remove(String from, char symbol, String to) {
    final Map<Character, Set<String>> row = rows.get(from);
    if (row == null) {
      return false;
    }
    final Set<String> targets = row.get(symbol);
    if (targets == null || !targets.remove(to)) {
      return false;
    }
    if (targets.isEmpty()) {
      row.remove(symbol);
      if (row.isEmpty()) {
        rows.remove(from);
      }
    }
    return true;
  }

  @Override
  public void removeState(String state) {
    rows.remove(state);
    final Iterator<Map<Character, Set<String>>> rowIterator = rows.values().iterator();
    while (rowIterator.hasNext()) {
      final Map<Character, Set<String>> row = rowIterator.next();
      final Iterator<Set<String>> targetsIterator = row.values().iterator();
      while (targetsIterator.hasNext()) {
        final Set<String> targets = targetsIterator.next();
        targets.remove(state);
        if (targets.isEmpty()) {
          targetsIterator.remove();
        }
      }
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
          .flatMap(e ->
            e.getValue().stream().map(to -> new Transition(row.getKey(), e.getKey(), to))
          )
      );
  }

  @Override
  public NondeterministicTable copy() {
    final var copy = new NondeterministicTable();
    rows.forEach((from, row) -> {
      final Map<Character, Set<String>> rowCopy = new LinkedHashMap<>();
      row.forEach((symbol, targets) -> rowCopy.put(symbol, new LinkedHashSet<>(targets)));
      copy.rows.put(from, rowCopy);
    });
    return copy;
  }
}
