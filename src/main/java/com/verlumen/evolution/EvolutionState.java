package com.verlumen.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.ranking.Ranker;

/**
 * Immutable snapshot of an evolution: the generation counter, the ranker in use and the current
 * population. Every transition produces a new state.
 */
@AutoValue
public abstract class EvolutionState<T> {
  /** Returns the state an evolution starts from: generation zero with no population. */
  public static <T> EvolutionState<T> empty(Ranker ranker) {
    return of(0, ranker, Population.empty());
  }

  public static <T> EvolutionState<T> of(int generation, Ranker ranker, Population<T> population) {
    checkArgument(generation >= 0, "Generation (%s) must not be negative", generation);
    return new AutoValue_EvolutionState<T>(generation, ranker, population);
  }

  public abstract int generation();

  public abstract Ranker ranker();

  public abstract Population<T> population();

  public boolean isEmpty() {
    return population().isEmpty();
  }

  public EvolutionState<T> withPopulation(Population<T> population) {
    return of(generation(), ranker(), population);
  }

  public EvolutionState<T> withGeneration(int generation) {
    return of(generation, ranker(), population());
  }
}
