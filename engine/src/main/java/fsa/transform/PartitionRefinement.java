package fsa.transform;

import fsa.Automaton;
import fsa.AutomatonKind;
import fsa.Closures;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by (Moore-style) partition refinement.
 *
 * <p>Starting from the split between accepting and non-accepting reachable
 * states, blocks are repeatedly split according to the blocks their members
 * transition into, until a whole round over all blocks splits nothing. Each
 * round builds a new list of blocks instead of editing the current one.
 *
 * <p>At the fixpoint every member of a block moves, on any symbol, into the
 * same block (or has no transition on that symbol, like every other member).
 * The minimized DFA relies on this: a block's transitions are read off any
 * one of its members.
 */
public final class PartitionRefinement {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionRefinement.class);

  /**
   * Block index standing for "no transition on this symbol".
   */
  private static final int NO_TARGET = -1;

  private PartitionRefinement() { }

  /**
   * Minimal DFA accepting the same language as an automaton.
   *
   * <p>NFAs are converted with {@link SubsetConstruction} first. Unreachable
   * states are dropped. States of the result are named {@code q0, q1, ...}
   * following the order of the blocks in {@link #partition(Automaton)}.
   *
   * @param automaton automaton to minimize
   * @return minimized DFA
   * @throws IllegalStateException if the automaton has no initial state
   */
  public static Automaton minimize(Automaton automaton) {
    final Automaton dfa = automaton.isDfa() ? automaton : SubsetConstruction.convert(automaton);
    final String initial = requireInitial(dfa);
    final List<Set<String>> blocks = partition(dfa);

    // Mapping from original states to the name of their block
    final Map<String, String> blockNames = new HashMap<>();
    for (int i = 0; i < blocks.size(); i++) {
      for (String state : blocks.get(i)) {
        blockNames.put(state, "q" + i);
      }
    }

    final var minimized = new Automaton(AutomatonKind.DFA);
    for (int i = 0; i < blocks.size(); i++) {
      final Set<String> block = blocks.get(i);
      final String name = "q" + i;
      minimized.addState(name);
      if (block.contains(initial)) {
        minimized.setInitialState(name);
      }
      if (block.stream().anyMatch(dfa::isFinal)) {
        minimized.toggleFinalState(name, true);
      }
    }

    // Transitions out of a block are those of any of its members
    for (int i = 0; i < blocks.size(); i++) {
      final String representative = blocks.get(i).iterator().next();
      for (char symbol : dfa.alphabet()) {
        for (String target : dfa.targets(representative, symbol)) {
          minimized.addTransition("q" + i, symbol, blockNames.get(target));
        }
      }
    }
    minimized.setAlphabet(dfa.alphabet());

    LOG.debug("minimization: {} DFA states -> {} states", dfa.states().size(), minimized.states().size());
    return minimized;
  }

  /**
   * Coarsest partition of the reachable states of a DFA into blocks of
   * indistinguishable states.
   *
   * <p>Blocks are listed in discovery order: the accepting block (if any),
   * then the non-accepting block (if any), with every split block replaced in
   * place by its parts.
   *
   * @param dfa deterministic automaton
   * @return unmodifiable list of non-empty, disjoint blocks
   * @throws IllegalArgumentException if the automaton is not a DFA
   * @throws IllegalStateException if the automaton has no initial state
   */
  public static List<Set<String>> partition(Automaton dfa) {
    if (!dfa.isDfa()) {
      throw new IllegalArgumentException("partition refinement requires a DFA");
    }
    requireInitial(dfa);

    final Set<String> reachable = Closures.reachable(dfa);

    // Initial partition: accepting and non-accepting reachable states
    final Set<String> accepting = new LinkedHashSet<>();
    final Set<String> rejecting = new LinkedHashSet<>();
    for (String state : reachable) {
      (dfa.isFinal(state) ? accepting : rejecting).add(state);
    }
    List<Set<String>> blocks = new ArrayList<>();
    if (!accepting.isEmpty()) {
      blocks.add(Collections.unmodifiableSet(accepting));
    }
    if (!rejecting.isEmpty()) {
      blocks.add(Collections.unmodifiableSet(rejecting));
    }
    blocks = Collections.unmodifiableList(blocks);

    // Refine until a round changes nothing
    int rounds = 0;
    boolean changed = true;
    while (changed) {
      changed = false;
      rounds++;

      final Map<String, Integer> blockOf = blockIndex(blocks);
      final List<Set<String>> refined = new ArrayList<>();
      for (Set<String> block : blocks) {
        final List<Set<String>> parts = split(dfa, block, blockOf);
        changed |= parts.size() > 1;
        refined.addAll(parts);
      }
      blocks = Collections.unmodifiableList(refined);
    }

    LOG.trace("partition refinement converged after {} rounds: {}", rounds, blocks);
    return blocks;
  }

  /**
   * Split a block on the first symbol that distinguishes its members.
   *
   * @param dfa automaton being minimized
   * @param block block to split
   * @param blockOf index of the block containing each reachable state
   * @return the parts of the block, in order of first member (just the block
   *         itself if no symbol distinguishes its members)
   */
  private static List<Set<String>> split(Automaton dfa, Set<String> block, Map<String, Integer> blockOf) {
    if (block.size() <= 1) {
      return List.of(block);
    }

    for (char symbol : dfa.alphabet()) {
      final Map<Integer, Set<String>> groups = new LinkedHashMap<>();
      for (String state : block) {
        final int targetBlock = target(dfa, state, symbol)
          .map(blockOf::get)
          .orElse(NO_TARGET);
        groups.computeIfAbsent(targetBlock, k -> new LinkedHashSet<>()).add(state);
      }

      if (groups.size() > 1) {
        final List<Set<String>> parts = new ArrayList<>();
        for (Set<String> group : groups.values()) {
          parts.add(Collections.unmodifiableSet(group));
        }
        return parts;
      }
    }

    return List.of(block);
  }

  private static Optional<String> target(Automaton dfa, String state, char symbol) {
    final Collection<String> targets = dfa.targets(state, symbol);
    return targets.isEmpty() ? Optional.empty() : Optional.of(targets.iterator().next());
  }

  private static Map<String, Integer> blockIndex(List<Set<String>> blocks) {
    final Map<String, Integer> blockOf = new HashMap<>();
    for (int i = 0; i < blocks.size(); i++) {
      for (String state : blocks.get(i)) {
        blockOf.put(state, i);
      }
    }
    return blockOf;
  }

  private static String requireInitial(Automaton automaton) {
    return automaton
      .initialState()
      .orElseThrow(() -> new IllegalStateException("cannot minimize an automaton without initial state"));
  }
}
