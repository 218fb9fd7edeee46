package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Process-level settings for engines created through {@link EvolutionModule}.
 *
 * @param seed seed of the shared random source
 * @param evaluatorThreads number of threads evaluating fitness; 1 evaluates on the calling thread
 */
public record EvolutionSettings(long seed, int evaluatorThreads) {
  public EvolutionSettings {
    checkArgument(
        evaluatorThreads > 0, "Evaluator thread count (%s) must be positive", evaluatorThreads);
  }

  public static EvolutionSettings create(long seed, int evaluatorThreads) {
    return new EvolutionSettings(seed, evaluatorThreads);
  }

  public static EvolutionSettings sequential(long seed) {
    return create(seed, 1);
  }
}
