package com.verlumen.evolution.limits;

import com.verlumen.evolution.EvolutionState;

/**
 * Termination predicate for the generational loop. The engine stops as soon as any of its limits
 * is satisfied.
 */
@FunctionalInterface
public interface Limit {
  /**
   * Returns whether evolution should stop.
   *
   * @param state the state produced by the most recent generation
   * @param history read-only record of the generations completed so far, including {@code state}'s
   */
  boolean shouldTerminate(EvolutionState<?> state, EvolutionHistory history);
}
