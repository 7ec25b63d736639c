package fsa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class StateSetTest {

  @Test
  public void canonicalName() {
    assertEquals("{a,b}", StateSet.of("b", "a", "b").name());
    assertEquals("{q0}", StateSet.of("q0").name());
    assertEquals("Ø", StateSet.EMPTY.name());
    assertEquals(StateSet.EMPTY_NAME, new StateSet(List.of()).name());
  }

  @Test
  public void separatorsInLabelsAreEscaped() {
    assertEquals("{a\\,b,c}", StateSet.of("a,b", "c").name());
    assertEquals("{a,b\\,c}", StateSet.of("a", "b,c").name());
    assertEquals("{\\\\,\\{q0\\}}", StateSet.of("{q0}", "\\").name());
  }

  @Test
  public void equalityIgnoresOrderAndDuplicates() {
    final StateSet left = StateSet.of("q2", "q0", "q1");
    final StateSet right = new StateSet(List.of("q0", "q1", "q2", "q0"));
    assertEquals(left, right);
    assertEquals(left.hashCode(), right.hashCode());
    assertEquals(3, right.size());
    assertNotEquals(left, StateSet.of("q0", "q1"));
  }

  @Test
  public void membership() {
    final StateSet set = StateSet.of("q3", "q1");
    assertTrue(set.contains("q1"));
    assertFalse(set.contains("q2"));
    assertTrue(set.intersects(Set.of("q2", "q3")));
    assertFalse(set.intersects(Set.of("q0", "q2")));
    assertFalse(StateSet.EMPTY.intersects(Set.of("q0")));
    assertEquals(List.of("q1", "q3"), set.toList());
  }
}
