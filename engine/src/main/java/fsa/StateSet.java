package fsa;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of state labels, kept in canonical (lexicographic) order.
 *
 * <p>Two state sets with the same members are equal and have the same
 * {@link #name()}, so a state set can be used directly as the identity of a
 * powerset state.
 */
public final class StateSet implements Iterable<String> {

  /**
   * Name of the empty set.
   */
  public static final String EMPTY_NAME = "Ø";

  public static final StateSet EMPTY = new StateSet(Collections.emptyList());

  // Sorted and distinct elements
  private final String[] elements;

  public static StateSet of(String... elems) {
    return new StateSet(Arrays.asList(elems));
  }

  public StateSet(Collection<String> elems) {
    this.elements = new TreeSet<String>(elems).toArray(new String[0]);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(String state) {
    return Arrays.binarySearch(elements, state) >= 0;
  }

  /**
   * Does this set share at least one state with another collection?
   *
   * @param states states to look for
   * @return whether any member of this set is in {@code states}
   */
  public boolean intersects(Set<String> states) {
    for (String element : elements) {
      if (states.contains(element)) {
        return true;
      }
    }
    return false;
  }

  public Stream<String> stream() {
    return Arrays.stream(elements);
  }

  public List<String> toList() {
    return List.of(elements);
  }

  @Override
  public Iterator<String> iterator() {
    return toList().iterator();
  }

  /**
   * Canonical name: {@code {s1,s2,...}} for a non-empty set, {@code Ø} for
   * the empty set.
   *
   * <p>Backslashes, commas and braces inside a label are preceded by a
   * backslash, so distinct sets always get distinct names.
   *
   * @return name used for the set when it becomes a state of its own
   */
  public String name() {
    if (elements.length == 0) {
      return EMPTY_NAME;
    }
    return Arrays
      .stream(elements)
      .map(StateSet::escape)
      .collect(Collectors.joining(",", "{", "}"));
  }

  private static String escape(String label) {
    final var escaped = new StringBuilder(label.length());
    for (char c : label.toCharArray()) {
      if (c == '\\' || c == ',' || c == '{' || c == '}') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof StateSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((StateSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return name();
  }
}
