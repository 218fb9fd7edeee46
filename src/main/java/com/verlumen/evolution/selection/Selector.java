package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.ranking.Ranker;
import java.util.Random;

/**
 * Strategy producing a sub-population of a requested size from a population. Selected individuals
 * may repeat.
 */
public interface Selector {
  /**
   * Selects {@code count} individuals from {@code population}.
   *
   * @param population the non-empty population to select from
   * @param count the number of individuals to select
   * @param ranker the ranker deciding which individuals are better
   * @param random the random source for the draws
   * @return a population of exactly {@code count} individuals
   */
  <T> Population<T> select(Population<T> population, int count, Ranker ranker, Random random);

  /**
   * Validates the request, selects from the state's population with the state's ranker and returns
   * a state holding the selection.
   *
   * @throws IllegalArgumentException if {@code count} is negative, or the population is empty
   *     while {@code count} is positive
   * @throws IllegalStateException if the selection does not hold exactly {@code count} individuals
   */
  default <T> EvolutionState<T> apply(EvolutionState<T> state, int count, Random random) {
    checkArgument(count >= 0, "Selection count (%s) must not be negative", count);
    checkArgument(
        count == 0 || !state.population().isEmpty(),
        "Cannot select %s individuals from an empty population",
        count);
    Population<T> selected =
        count == 0 ? Population.empty() : select(state.population(), count, state.ranker(), random);
    checkState(
        selected.size() == count,
        "Expected %s selected individuals but %s selected %s",
        count,
        this,
        selected.size());
    return state.withPopulation(selected);
  }
}
