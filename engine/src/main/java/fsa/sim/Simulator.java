package fsa.sim;

import fsa.Automaton;
import fsa.Closures;
import fsa.StateSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an automaton over input strings.
 *
 * <p>The simulator never modifies the automaton and keeps no state between
 * calls: every query replays the input from the start. Failures (unknown
 * symbols, missing transitions, empty active sets) are reported inside the
 * returned values rather than thrown.
 *
 * <p>A DFA run follows one transition per symbol. An NFA run starts from the
 * epsilon-closure of the initial state and alternates {@link Closures#move}
 * and {@link Closures#epsilonClosure} for every symbol.
 */
public final class Simulator {

  private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

  private final Automaton automaton;

  public Simulator(Automaton automaton) {
    this.automaton = automaton;
  }

  /**
   * Outcome of consuming one symbol.
   *
   * @param states active states afterwards (or where the run got stuck)
   * @param failure why the symbol could not be consumed
   */
  private record Advance(StateSet states, Optional<SimulationFailure> failure) {

    static Advance to(StateSet states) {
      return new Advance(states, Optional.empty());
    }

    static Advance stuck(StateSet states, SimulationFailure failure) {
      return new Advance(states, Optional.of(failure));
    }
  }

  /**
   * Active states before consuming any input.
   *
   * @return initial state (DFA) or its epsilon-closure (NFA), or nothing if
   *         there is no initial state
   */
  private Optional<StateSet> start() {
    return automaton.initialState().map((String initial) -> automaton.isDfa()
      ? StateSet.of(initial)
      : Closures.epsilonClosure(automaton, List.of(initial))
    );
  }

  private Advance advance(StateSet current, char symbol) {
    if (!automaton.alphabet().contains(symbol)) {
      return Advance.stuck(current, SimulationFailure.unknownSymbol(symbol));
    }

    if (automaton.isDfa()) {
      final String state = current.iterator().next();
      final Set<String> targets = automaton.targets(state, symbol);
      if (targets.isEmpty()) {
        return Advance.stuck(current, SimulationFailure.missingTransition(state, symbol));
      }
      return Advance.to(new StateSet(targets));
    }

    final StateSet next = Closures.epsilonClosure(automaton, Closures.move(automaton, current, symbol));
    if (next.isEmpty()) {
      return Advance.stuck(next, SimulationFailure.noReachableStates(symbol));
    }
    return Advance.to(next);
  }

  private boolean accepting(StateSet states) {
    return states.intersects(automaton.finalStates());
  }

  /**
   * Run the automaton over a whole input.
   *
   * <p>The path starts at the initial state (or closure) and has one more
   * entry for every symbol consumed. If the run fails, the path ends at the
   * last point reached and the input is rejected.
   *
   * @param input input string
   * @return acceptance, path and failure (if any)
   */
  public SimulationResult simulate(String input) {
    final Optional<StateSet> initial = start();
    if (initial.isEmpty()) {
      LOG.debug("cannot run on '{}': no initial state", input);
      return new SimulationResult(false, List.of(), Optional.of(SimulationFailure.missingInitialState()));
    }

    LOG.debug("[{}] starting run on: '{}'", automaton.kind(), input);
    StateSet current = initial.get();
    final List<PathStep> path = new ArrayList<>();
    path.add(new PathStep(current, input));

    for (int i = 0; i < input.length(); i++) {
      final Advance advance = advance(current, input.charAt(i));
      if (advance.failure().isPresent()) {
        LOG.debug("[{}] ending run at {}: {}", automaton.kind(), current, advance.failure().get().message());
        return new SimulationResult(false, path, advance.failure());
      }
      current = advance.states();
      LOG.trace("[{}] entering {}", automaton.kind(), current);
      path.add(new PathStep(current, input.substring(i + 1)));
    }

    final boolean accepted = accepting(current);
    LOG.debug("[{}] ending run at {} ({})", automaton.kind(), current, accepted ? "accepted" : "rejected");
    return new SimulationResult(accepted, path, Optional.empty());
  }

  /**
   * Snapshot of a run after consuming the first {@code step} symbols.
   *
   * <p>This replays the input from the start on every call, so snapshots can
   * be requested in any order. Step {@code 0} is the initial state (or
   * closure). A step past the end of the input is the same as the step at
   * the end of the input.
   *
   * @param input whole input string
   * @param step number of symbols to consume
   * @return snapshot of the run
   */
  public SimulationState simulateStep(String input, int step) {
    if (step < 0) {
      throw new IllegalArgumentException("step must not be negative: " + step);
    }

    final int consumed = Math.min(step, input.length());
    final String remaining = input.substring(consumed);

    final Optional<StateSet> initial = start();
    if (initial.isEmpty()) {
      return failed(StateSet.EMPTY, remaining, SimulationFailure.missingInitialState());
    }

    StateSet current = initial.get();
    for (int i = 0; i < consumed; i++) {
      final Advance advance = advance(current, input.charAt(i));
      if (advance.failure().isPresent()) {
        return failed(advance.states(), remaining, advance.failure().get());
      }
      current = advance.states();
    }

    return running(current, remaining);
  }

  /**
   * Snapshots of a run, step by step.
   *
   * <p>Element {@code k} is equal to {@code simulateStep(input, k)}. The list
   * ends at the first complete snapshot: either the input is exhausted or the
   * run failed. Unlike repeated calls to {@link #simulateStep}, this only
   * walks the input once.
   *
   * @param input whole input string
   * @return snapshots from step {@code 0} to the end of the run
   */
  public List<SimulationState> trace(String input) {
    final List<SimulationState> trace = new ArrayList<>();

    final Optional<StateSet> initial = start();
    if (initial.isEmpty()) {
      trace.add(failed(StateSet.EMPTY, input, SimulationFailure.missingInitialState()));
      return trace;
    }

    StateSet current = initial.get();
    trace.add(running(current, input));

    for (int i = 0; i < input.length(); i++) {
      final String remaining = input.substring(i + 1);
      final Advance advance = advance(current, input.charAt(i));
      if (advance.failure().isPresent()) {
        trace.add(failed(advance.states(), remaining, advance.failure().get()));
        return trace;
      }
      current = advance.states();
      trace.add(running(current, remaining));
    }

    return trace;
  }

  private SimulationState running(StateSet states, String remaining) {
    return new SimulationState(
      automaton.kind(),
      states,
      remaining,
      accepting(states),
      remaining.isEmpty(),
      Optional.empty()
    );
  }

  private SimulationState failed(StateSet states, String remaining, SimulationFailure failure) {
    return new SimulationState(
      automaton.kind(),
      states,
      remaining,
      false,
      true,
      Optional.of(failure)
    );
  }
}
