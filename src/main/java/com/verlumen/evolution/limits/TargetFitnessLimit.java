package com.verlumen.evolution.limits;

import com.verlumen.evolution.EvolutionState;
import java.util.function.DoublePredicate;

/**
 * Stops evolution once the raw fitness of the best individual, as ranked by the state's ranker,
 * satisfies a predicate.
 */
public final class TargetFitnessLimit implements Limit {
  private final DoublePredicate predicate;
  private final String description;

  private TargetFitnessLimit(DoublePredicate predicate, String description) {
    this.predicate = predicate;
    this.description = description;
  }

  public static TargetFitnessLimit of(DoublePredicate predicate) {
    return new TargetFitnessLimit(predicate, "predicate");
  }

  public static TargetFitnessLimit atLeast(double target) {
    return new TargetFitnessLimit(fitness -> fitness >= target, ">= " + target);
  }

  public static TargetFitnessLimit atMost(double target) {
    return new TargetFitnessLimit(fitness -> fitness <= target, "<= " + target);
  }

  public static TargetFitnessLimit equalTo(double target) {
    return new TargetFitnessLimit(fitness -> fitness == target, "== " + target);
  }

  @Override
  public boolean shouldTerminate(EvolutionState<?> state, EvolutionHistory history) {
    return !state.isEmpty()
        && predicate.test(state.ranker().best(state.population()).fitness());
  }

  @Override
  public String toString() {
    return "TargetFitnessLimit(" + description + ")";
  }
}
