package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.Population;
import java.util.function.Function;

/** Evaluates individuals one after another on the calling thread. */
public final class SequentialEvaluator<T> implements Evaluator<T> {
  private final Function<Genotype<T>, Double> fitnessFunction;

  public SequentialEvaluator(Function<Genotype<T>, Double> fitnessFunction) {
    this.fitnessFunction = fitnessFunction;
  }

  @Override
  public EvolutionState<T> evaluate(EvolutionState<T> state, boolean force) {
    return state.withPopulation(
        Population.of(
            state.population().stream()
                .map(
                    individual ->
                        force || !individual.isEvaluated()
                            ? individual.withFitness(score(individual.genotype()))
                            : individual)
                .collect(toImmutableList())));
  }

  private double score(Genotype<T> genotype) {
    Double fitness = fitnessFunction.apply(genotype);
    checkState(fitness != null, "Fitness function returned null for %s", genotype);
    return fitness;
  }
}
