package fsa;

import fsa.check.Determinism;
import fsa.check.ValidationResult;
import fsa.check.Validator;
import fsa.json.AutomatonJson;
import fsa.sim.SimulationResult;
import fsa.sim.SimulationState;
import fsa.sim.Simulator;
import fsa.transform.PartitionRefinement;
import fsa.transform.SubsetConstruction;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finite automaton, either deterministic or non-deterministic.
 *
 * <p>The automaton owns its states, alphabet and transitions. Mutations which
 * refer to a state that is not part of the automaton are rejected: they
 * return {@code false} and leave the automaton unchanged. Transformations
 * ({@link #copy()}, {@link #normalize()}, {@link #convertToDFA()},
 * {@link #minimize()}) never modify the receiver and return a new automaton.
 *
 * <p>Instances are not thread-safe, but distinct instances share no state.
 */
public final class Automaton {

  private final AutomatonKind kind;

  /**
   * All states, in insertion order.
   */
  private final Set<String> states = new LinkedHashSet<>();

  /**
   * Alphabet, in insertion order. Never contains {@link Symbols#EPSILON}.
   */
  private final Set<Character> alphabet = new LinkedHashSet<>();

  private final TransitionTable transitions;

  /**
   * Initial state, or {@code null} if there is none.
   */
  private String initialState = null;

  /**
   * Accepting states, in insertion order.
   */
  private final Set<String> finalStates = new LinkedHashSet<>();

  public Automaton(AutomatonKind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.transitions = kind.newTable();
  }

  private Automaton(Automaton other) {
    this.kind = other.kind;
    this.states.addAll(other.states);
    this.alphabet.addAll(other.alphabet);
    this.transitions = other.transitions.copy();
    this.initialState = other.initialState;
    this.finalStates.addAll(other.finalStates);
  }

  public static Automaton dfa() {
    return new Automaton(AutomatonKind.DFA);
  }

  public static Automaton nfa() {
    return new Automaton(AutomatonKind.NFA);
  }

  // Mutation

  /**
   * Add a state.
   *
   * @param state label of the new state
   * @return whether the state was added (it was not already present)
   */
  public boolean addState(String state) {
    Objects.requireNonNull(state, "state");
    if (state.isEmpty()) {
      throw new IllegalArgumentException("state labels must not be empty");
    }
    return states.add(state);
  }

  /**
   * Remove a state, along with its initial/final status and every transition
   * into or out of it.
   *
   * @param state state to remove
   * @return whether the state was present
   */
  public boolean removeState(String state) {
    if (!states.remove(state)) {
      return false;
    }
    if (state.equals(initialState)) {
      initialState = null;
    }
    finalStates.remove(state);
    transitions.removeState(state);
    return true;
  }

  /**
   * Replace the alphabet.
   *
   * <p>Epsilon is never part of the alphabet and is dropped. Symbols still
   * used by some transition stay in the alphabet.
   *
   * @param symbols new alphabet
   */
  public void setAlphabet(Collection<Character> symbols) {
    final List<Character> requested = List.copyOf(symbols);
    alphabet.clear();
    for (Character symbol : requested) {
      if (!Symbols.isEpsilon(symbol)) {
        alphabet.add(symbol);
      }
    }
    transitions
      .stream()
      .filter(t -> !t.isEpsilon())
      .forEach(t -> alphabet.add(t.symbol()));
  }

  /**
   * Set the initial state.
   *
   * @param state new initial state
   * @return whether the state exists (otherwise nothing changes)
   */
  public boolean setInitialState(String state) {
    if (!states.contains(state)) {
      return false;
    }
    initialState = state;
    return true;
  }

  /**
   * Mark or unmark a state as accepting.
   *
   * @param state state to update
   * @param isFinal whether the state should be accepting
   * @return whether the state exists (otherwise nothing changes)
   */
  public boolean toggleFinalState(String state, boolean isFinal) {
    if (!states.contains(state)) {
      return false;
    }
    if (isFinal) {
      finalStates.add(state);
    } else {
      finalStates.remove(state);
    }
    return true;
  }

  /**
   * Flip whether a state is accepting.
   *
   * @param state state to update
   * @return whether the state exists (otherwise nothing changes)
   */
  public boolean toggleFinalState(String state) {
    return toggleFinalState(state, !finalStates.contains(state));
  }

  /**
   * Add a transition. A non-epsilon symbol is added to the alphabet.
   *
   * <p>On a DFA, an existing transition for the same state and symbol is
   * replaced and epsilon transitions are refused.
   *
   * @param from source state
   * @param symbol symbol on the transition
   * @param to target state
   * @return whether the transition was added
   */
  public boolean addTransition(String from, char symbol, String to) {
    if (!states.contains(from) || !states.contains(to)) {
      return false;
    }
    if (!transitions.add(from, symbol, to)) {
      return false;
    }
    if (!Symbols.isEpsilon(symbol)) {
      alphabet.add(symbol);
    }
    return true;
  }

  /**
   * Remove a transition. If no other transition uses its symbol, the symbol
   * is removed from the alphabet too.
   *
   * @param from source state
   * @param symbol symbol on the transition
   * @param to target state
   * @return whether the transition existed
   */
  public boolean removeTransition(String from, char symbol, String to) {
    if (!transitions.remove(from, symbol, to)) {
      return false;
    }
    if (!Symbols.isEpsilon(symbol) && !transitions.uses(symbol)) {
      alphabet.remove(symbol);
    }
    return true;
  }

  // Queries

  public AutomatonKind kind() {
    return kind;
  }

  public boolean isDfa() {
    return kind == AutomatonKind.DFA;
  }

  /**
   * All states.
   *
   * @return unmodifiable view, in insertion order
   */
  public Set<String> states() {
    return Collections.unmodifiableSet(states);
  }

  public boolean hasState(String state) {
    return states.contains(state);
  }

  /**
   * Alphabet (epsilon excluded).
   *
   * @return unmodifiable view, in insertion order
   */
  public Set<Character> alphabet() {
    return Collections.unmodifiableSet(alphabet);
  }

  public Optional<String> initialState() {
    return Optional.ofNullable(initialState);
  }

  /**
   * Accepting states.
   *
   * @return unmodifiable view, in insertion order
   */
  public Set<String> finalStates() {
    return Collections.unmodifiableSet(finalStates);
  }

  public boolean isFinal(String state) {
    return finalStates.contains(state);
  }

  /**
   * Targets of a state on a symbol.
   *
   * @param from source state
   * @param symbol symbol, possibly epsilon
   * @return unmodifiable set of targets (at most one for a DFA)
   */
  public Set<String> targets(String from, char symbol) {
    return transitions.targets(from, symbol);
  }

  /**
   * Outgoing transitions of a state.
   *
   * @param from source state
   * @return unmodifiable mapping from symbols to target sets
   */
  public Map<Character, Set<String>> outgoing(String from) {
    return transitions.outgoing(from);
  }

  /**
   * All transitions, grouped by source state.
   */
  public Stream<Transition> transitions() {
    return transitions.stream();
  }

  public int transitionCount() {
    return (int) transitions.stream().count();
  }

  // Transformations

  /**
   * Fully independent deep copy.
   */
  public Automaton copy() {
    return new Automaton(this);
  }

  /**
   * Rename states to {@code q0, q1, ...}.
   *
   * <p>The initial state is named first, then final states and then all
   * remaining states (each group in iteration order).
   *
   * @return renamed automaton
   */
  public Automaton normalize() {
    final Map<String, String> renaming = new LinkedHashMap<>();
    if (initialState != null) {
      renaming.put(initialState, "q" + renaming.size());
    }
    for (String state : finalStates) {
      renaming.putIfAbsent(state, "q" + renaming.size());
    }
    for (String state : states) {
      renaming.putIfAbsent(state, "q" + renaming.size());
    }
    return renamed(renaming);
  }

  /**
   * Copy of this automaton with states renamed.
   *
   * @param renaming mapping from every current state to its new (distinct) name
   * @return renamed automaton
   */
  private Automaton renamed(Map<String, String> renaming) {
    final var renamed = new Automaton(kind);
    for (String state : renaming.values()) {
      renamed.addState(state);
    }
    if (initialState != null) {
      renamed.setInitialState(renaming.get(initialState));
    }
    for (String state : finalStates) {
      renamed.toggleFinalState(renaming.get(state), true);
    }
    renamed.setAlphabet(alphabet);
    transitions.stream().forEach(t ->
      renamed.addTransition(renaming.get(t.from()), t.symbol(), renaming.get(t.to()))
    );
    return renamed;
  }

  /**
   * Equivalent DFA, by subset construction.
   *
   * @see SubsetConstruction#convert(Automaton)
   */
  public Automaton convertToDFA() {
    return SubsetConstruction.convert(this);
  }

  /**
   * Equivalent minimal DFA, by partition refinement.
   *
   * @see PartitionRefinement#minimize(Automaton)
   */
  public Automaton minimize() {
    return PartitionRefinement.minimize(this);
  }

  // Simulation, validation and serialization

  /**
   * Run the automaton over a whole input.
   *
   * @see Simulator#simulate(String)
   */
  public SimulationResult simulate(String input) {
    return new Simulator(this).simulate(input);
  }

  /**
   * Snapshot of a run after some number of input symbols.
   *
   * @see Simulator#simulateStep(String, int)
   */
  public SimulationState simulateStep(String input, int step) {
    return new Simulator(this).simulateStep(input, step);
  }

  public ValidationResult validate() {
    return Validator.validate(this);
  }

  public boolean isDeterministic() {
    return Determinism.isDeterministic(this);
  }

  public String toJson() {
    return AutomatonJson.write(this);
  }

  public static Automaton fromJson(String json) {
    return AutomatonJson.read(json);
  }

  // Structural equality

  private Set<Transition> transitionSet() {
    return transitions.stream().collect(Collectors.toSet());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Automaton)) {
      return false;
    }
    final Automaton other = (Automaton) obj;
    return kind == other.kind
      && states.equals(other.states)
      && alphabet.equals(other.alphabet)
      && Objects.equals(initialState, other.initialState)
      && finalStates.equals(other.finalStates)
      && transitionSet().equals(other.transitionSet());
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, states, alphabet, initialState, finalStates, transitionSet());
  }

  @Override
  public String toString() {
    final List<String> edges = transitions
      .stream()
      .map(Transition::toString)
      .collect(Collectors.toList());
    return kind + "(states=" + states
      + ", alphabet=" + alphabet
      + ", initial=" + initialState
      + ", final=" + finalStates
      + ", transitions=" + edges + ")";
  }
}
