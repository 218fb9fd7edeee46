package com.verlumen.evolution.engine;

import com.verlumen.evolution.EvolutionState;

/** Runs generations over an {@link EvolutionState} until a termination limit is satisfied. */
public interface EvolutionEngine<T> {
  /** Evolves from an empty state and returns the state of the last generation. */
  EvolutionState<T> evolve();

  /** Evolves from {@code start}, which may hold a population to resume from. */
  EvolutionState<T> evolve(EvolutionState<T> start);

  /** Computes the next generation of {@code state}. */
  EvolutionState<T> iterate(EvolutionState<T> state);
}
