package com.verlumen.evolution.limits;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.EvolutionState;

/**
 * Stops evolution once the best fitness has not improved for a number of consecutive generations.
 */
public final class SteadyGenerationsLimit implements Limit {
  private final int generations;

  public SteadyGenerationsLimit(int generations) {
    checkArgument(
        generations > 0, "Number of steady generations (%s) must be positive", generations);
    this.generations = generations;
  }

  public int generations() {
    return generations;
  }

  @Override
  public boolean shouldTerminate(EvolutionState<?> state, EvolutionHistory history) {
    return history.steadyGenerations() >= generations;
  }

  @Override
  public String toString() {
    return "SteadyGenerationsLimit(generations=" + generations + ")";
  }
}
