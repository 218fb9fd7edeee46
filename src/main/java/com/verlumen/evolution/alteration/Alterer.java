package com.verlumen.evolution.alteration;

import com.verlumen.evolution.EvolutionState;
import java.util.Random;

/**
 * Genetic operator transforming a population, such as mutation or crossover. Alterers compose by
 * folding left to right, each consuming the previous one's output.
 *
 * @param <T> the type of value held by the genes
 */
@FunctionalInterface
public interface Alterer<T> {
  /**
   * Applies this operator to the state's population.
   *
   * @param state the state holding the population to alter
   * @param outputSize the number of individuals the resulting population must hold
   * @param random the random source for every draw made by the operator
   * @return a new state holding the altered population
   */
  EvolutionState<T> apply(EvolutionState<T> state, int outputSize, Random random);
}
