package com.verlumen.evolution.ranking;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import java.util.Comparator;
import java.util.List;

/**
 * Policy deciding which of two fitness values is better, and how raw fitness values map to a scale
 * where larger is always better for fitness-proportionate selection.
 *
 * <p>Rankers are stateless.
 */
public interface Ranker {
  /**
   * Compares two fitness values.
   *
   * @return 1 if {@code first} is better, -1 if {@code second} is better, 0 otherwise
   */
  int compareFitness(double first, double second);

  /**
   * Maps raw fitness values to values whose order agrees with this ranker and where larger means
   * better.
   */
  ImmutableList<Double> fitnessTransform(List<Double> fitness);

  default int compare(Individual<?> first, Individual<?> second) {
    return compareFitness(first.fitness(), second.fitness());
  }

  default <T> Comparator<Individual<T>> comparator() {
    return this::compare;
  }

  /** Returns the population sorted from best to worst. The sort is stable. */
  default <T> Population<T> sort(Population<T> population) {
    return Population.of(
        population.stream()
            .sorted(this.<T>comparator().reversed())
            .collect(toImmutableList()));
  }

  /** Returns the best individual of a non-empty population; ties go to the first encountered. */
  default <T> Individual<T> best(Population<T> population) {
    checkArgument(!population.isEmpty(), "Cannot pick the best individual of an empty population");
    Individual<T> best = population.get(0);
    for (Individual<T> individual : population) {
      if (compare(individual, best) > 0) {
        best = individual;
      }
    }
    return best;
  }
}
