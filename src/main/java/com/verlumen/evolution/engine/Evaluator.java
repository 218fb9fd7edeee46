package com.verlumen.evolution.engine;

import com.verlumen.evolution.EvolutionState;

/**
 * Assigns fitness values to the individuals of a population.
 *
 * <p>The returned population holds the same individuals in the same order, each with a fitness
 * that is not {@link Double#NaN}.
 */
public interface Evaluator<T> {
  /**
   * Evaluates the state's population.
   *
   * @param force re-evaluate individuals that already carry a fitness value
   */
  EvolutionState<T> evaluate(EvolutionState<T> state, boolean force);

  /** Evaluates only the individuals that have not been evaluated yet. */
  default EvolutionState<T> evaluate(EvolutionState<T> state) {
    return evaluate(state, false);
  }
}
