package com.verlumen.evolution.limits;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.EvolutionState;

/** Stops evolution once the generation counter reaches a fixed count. */
public final class GenerationLimit implements Limit {
  private final int generations;

  public GenerationLimit(int generations) {
    checkArgument(generations > 0, "Generation limit (%s) must be positive", generations);
    this.generations = generations;
  }

  public int generations() {
    return generations;
  }

  @Override
  public boolean shouldTerminate(EvolutionState<?> state, EvolutionHistory history) {
    return state.generation() >= generations;
  }

  @Override
  public String toString() {
    return "GenerationLimit(generations=" + generations + ")";
  }
}
