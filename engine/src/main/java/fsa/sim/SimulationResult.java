package fsa.sim;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of running an automaton over a whole input.
 *
 * @param accepted whether the input is accepted
 * @param path states visited, starting with the initial state (or closure)
 *             and ending at the last point the run reached
 * @param error why the run stopped early, if it did
 */
public record SimulationResult(
  boolean accepted,
  List<PathStep> path,
  Optional<SimulationFailure> error
) {

  public SimulationResult {
    path = List.copyOf(path);
  }

  /**
   * Last point reached by the run.
   *
   * @return last path entry, empty if the run never started
   */
  public Optional<PathStep> lastStep() {
    return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
  }

  public boolean hasError() {
    return error.isPresent();
  }
}
