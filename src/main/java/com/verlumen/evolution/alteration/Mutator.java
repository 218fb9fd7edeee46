package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import java.util.Random;

/**
 * Base class for mutation operators.
 *
 * <p>Each individual is considered for mutation with probability {@code individualRate}; each
 * chromosome of a considered individual is mutated with probability {@code chromosomeRate}.
 * Individuals and chromosomes that are not mutated pass through unchanged. Mutated individuals lose
 * their fitness and must be evaluated again.
 */
public abstract class Mutator<T> implements Alterer<T> {
  private final double individualRate;
  private final double chromosomeRate;

  protected Mutator(double individualRate, double chromosomeRate) {
    checkRate("individual", individualRate);
    checkRate("chromosome", chromosomeRate);
    this.individualRate = individualRate;
    this.chromosomeRate = chromosomeRate;
  }

  public final double individualRate() {
    return individualRate;
  }

  public final double chromosomeRate() {
    return chromosomeRate;
  }

  @Override
  public final EvolutionState<T> apply(EvolutionState<T> state, int outputSize, Random random) {
    checkArgument(
        outputSize == state.population().size(),
        "Mutation preserves the population size (%s) but %s individuals were requested",
        state.population().size(),
        outputSize);
    if (individualRate == 0.0) {
      return state;
    }
    ImmutableList.Builder<Individual<T>> mutated =
        ImmutableList.builderWithExpectedSize(outputSize);
    for (Individual<T> individual : state.population()) {
      mutated.add(
          random.nextDouble() < individualRate ? mutateIndividual(individual, random) : individual);
    }
    Population<T> result = Population.of(mutated.build());
    checkState(
        result.size() == outputSize,
        "Population size after mutation (%s) must equal the output size (%s)",
        result.size(),
        outputSize);
    return state.withPopulation(result);
  }

  /**
   * Mutates each chromosome with probability {@code chromosomeRate}. Returns {@code individual}
   * itself when no chromosome changed.
   */
  Individual<T> mutateIndividual(Individual<T> individual, Random random) {
    Genotype<T> genotype = individual.genotype();
    ImmutableList.Builder<Chromosome<T>> chromosomes =
        ImmutableList.builderWithExpectedSize(genotype.size());
    boolean changed = false;
    for (Chromosome<T> chromosome : genotype.chromosomes()) {
      Chromosome<T> result =
          random.nextDouble() < chromosomeRate ? mutateChromosome(chromosome, random) : chromosome;
      changed |= result != chromosome;
      chromosomes.add(result);
    }
    return changed ? Individual.unevaluated(Genotype.of(chromosomes.build())) : individual;
  }

  /**
   * Mutates a single chromosome. Implementations return {@code chromosome} itself when nothing
   * changed.
   */
  protected abstract Chromosome<T> mutateChromosome(Chromosome<T> chromosome, Random random);

  static void checkRate(String name, double rate) {
    checkArgument(rate >= 0.0 && rate <= 1.0, "The %s rate (%s) must be in [0, 1]", name, rate);
  }
}
