package com.verlumen.evolution.engine;

/** Creates genetic algorithms wired to the process-wide random source and evaluator settings. */
public interface GeneticAlgorithmFactory {
  /**
   * Completes {@code builder} with the shared random source and, unless one is set, an evaluator
   * for its fitness function, then creates the algorithm.
   */
  <T> GeneticAlgorithm<T> create(EngineConfig.Builder<T> builder);
}
