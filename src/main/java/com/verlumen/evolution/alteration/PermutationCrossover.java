package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.List;
import java.util.Random;

/**
 * Base class for two-parent crossovers over permutation chromosomes, where every gene value occurs
 * exactly once. Both offspring are permutations of the same values as their parents.
 */
public abstract class PermutationCrossover<T> extends Crossover<T> {
  protected PermutationCrossover(double chromosomeRate, boolean exclusivity) {
    super(2, 2, chromosomeRate, exclusivity);
  }

  @Override
  protected final ImmutableList<Chromosome<T>> crossoverChromosomes(
      List<Chromosome<T>> chromosomes, Random random) {
    SinglePointCrossover.checkParents(chromosomes);
    Chromosome<T> first = chromosomes.get(0);
    Chromosome<T> second = chromosomes.get(1);
    ImmutableSet<T> values = values(first.genes());
    checkArgument(
        values.size() == first.size(), "%s requires permutation chromosomes", getClass().getName());
    checkArgument(
        values.equals(values(second.genes())),
        "Parents of %s must permute the same values",
        getClass().getName());
    if (first.size() < 2) {
      return ImmutableList.of(first, second);
    }
    ImmutableList<ImmutableList<Gene<T>>> offspring =
        permute(first.genes(), second.genes(), random);
    return ImmutableList.of(
        first.duplicateWithGenes(offspring.get(0)), second.duplicateWithGenes(offspring.get(1)));
  }

  /**
   * Recombines two permutations of the same values, each holding at least two genes.
   *
   * @return the gene lists of the two offspring
   */
  protected abstract ImmutableList<ImmutableList<Gene<T>>> permute(
      List<Gene<T>> first, List<Gene<T>> second, Random random);

  static <T> ImmutableSet<T> values(List<? extends Gene<T>> genes) {
    return genes.stream().map(Gene::value).collect(toImmutableSet());
  }

  /** Draws two distinct indices in {@code [0, bound)}, smaller first. */
  static int[] distinctSortedPair(int bound, Random random) {
    int first = random.nextInt(bound);
    int second = random.nextInt(bound - 1);
    if (second >= first) {
      second++;
    }
    return new int[] {Math.min(first, second), Math.max(first, second)};
  }
}
