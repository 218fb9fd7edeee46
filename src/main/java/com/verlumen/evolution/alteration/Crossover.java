package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Base class for recombination operators.
 *
 * <p>Offspring are produced in groups: {@code numParents} parents are drawn uniformly from the
 * input population (distinct ones when {@code exclusivity} is set), each chromosome position is
 * recombined with probability {@code chromosomeRate}, and the resulting {@code numOffspring}
 * genotypes become unevaluated individuals. Groups are produced until {@code outputSize} offspring
 * exist; the surplus of the last group is dropped.
 */
public abstract class Crossover<T> implements Alterer<T> {
  private final int numParents;
  private final int numOffspring;
  private final double chromosomeRate;
  private final boolean exclusivity;

  protected Crossover(
      int numParents, int numOffspring, double chromosomeRate, boolean exclusivity) {
    checkArgument(numParents >= 2, "Number of parents (%s) must be at least 2", numParents);
    checkArgument(numOffspring >= 1, "Number of offspring (%s) must be positive", numOffspring);
    Mutator.checkRate("chromosome", chromosomeRate);
    this.numParents = numParents;
    this.numOffspring = numOffspring;
    this.chromosomeRate = chromosomeRate;
    this.exclusivity = exclusivity;
  }

  public final int numParents() {
    return numParents;
  }

  public final int numOffspring() {
    return numOffspring;
  }

  public final double chromosomeRate() {
    return chromosomeRate;
  }

  public final boolean exclusivity() {
    return exclusivity;
  }

  @Override
  public final EvolutionState<T> apply(EvolutionState<T> state, int outputSize, Random random) {
    checkArgument(outputSize >= 0, "Output size (%s) must not be negative", outputSize);
    if (outputSize == 0) {
      return state.withPopulation(Population.empty());
    }
    Population<T> population = state.population();
    checkArgument(!population.isEmpty(), "Cannot recombine an empty population");
    checkArgument(
        !exclusivity || population.size() >= numParents,
        "Exclusive crossover needs at least %s individuals but the population has %s",
        numParents,
        population.size());

    List<Individual<T>> offspring = new ArrayList<>(outputSize + numOffspring);
    while (offspring.size() < outputSize) {
      for (Genotype<T> genotype : crossover(drawParents(population, random), random)) {
        offspring.add(Individual.unevaluated(genotype));
      }
    }
    return state.withPopulation(Population.of(offspring.subList(0, outputSize)));
  }

  /**
   * Recombines the genotypes of a group of parents.
   *
   * <p>Offspring {@code i} starts as a copy of parent {@code i % numParents}; chromosome positions
   * picked with probability {@code chromosomeRate} are replaced by the recombined chromosomes.
   *
   * @throws IllegalArgumentException if the number of parents is not {@code numParents}, or the
   *     parents do not hold the same number of chromosomes
   */
  public final ImmutableList<Genotype<T>> crossover(List<Genotype<T>> parents, Random random) {
    checkArgument(
        parents.size() == numParents,
        "Expected %s parents but got %s",
        numParents,
        parents.size());
    int chromosomeCount = parents.get(0).size();
    checkArgument(
        parents.stream().allMatch(parent -> parent.size() == chromosomeCount),
        "Parents must hold the same number of chromosomes");

    List<List<Chromosome<T>>> offspring = new ArrayList<>(numOffspring);
    for (int i = 0; i < numOffspring; i++) {
      offspring.add(new ArrayList<>(parents.get(i % numParents).chromosomes()));
    }
    for (int index = 0; index < chromosomeCount; index++) {
      if (random.nextDouble() >= chromosomeRate) {
        continue;
      }
      int position = index;
      ImmutableList<Chromosome<T>> aligned =
          parents.stream().map(parent -> parent.chromosome(position)).collect(toImmutableList());
      ImmutableList<Chromosome<T>> recombined = crossoverChromosomes(aligned, random);
      checkState(
          recombined.size() == numOffspring,
          "%s produced %s chromosomes instead of %s",
          this,
          recombined.size(),
          numOffspring);
      for (int i = 0; i < numOffspring; i++) {
        offspring.get(i).set(index, recombined.get(i));
      }
    }
    return offspring.stream()
        .map(chromosomes -> Genotype.<T>of(chromosomes))
        .collect(toImmutableList());
  }

  /**
   * Recombines the chromosomes found at one position of every parent.
   *
   * @param chromosomes one chromosome per parent, in parent order
   * @return exactly {@code numOffspring} chromosomes
   */
  protected abstract ImmutableList<Chromosome<T>> crossoverChromosomes(
      List<Chromosome<T>> chromosomes, Random random);

  private ImmutableList<Genotype<T>> drawParents(Population<T> population, Random random) {
    ImmutableList.Builder<Genotype<T>> parents = ImmutableList.builderWithExpectedSize(numParents);
    if (exclusivity) {
      List<Integer> indices = new ArrayList<>(population.size());
      for (int i = 0; i < population.size(); i++) {
        indices.add(i);
      }
      for (int i = 0; i < numParents; i++) {
        int pick = i + random.nextInt(indices.size() - i);
        Collections.swap(indices, i, pick);
        parents.add(population.get(indices.get(i)).genotype());
      }
    } else {
      for (int i = 0; i < numParents; i++) {
        parents.add(population.get(random.nextInt(population.size())).genotype());
      }
    }
    return parents.build();
  }
}
