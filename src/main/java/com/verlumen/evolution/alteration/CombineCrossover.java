package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

/**
 * Produces a single offspring whose genes are combined position-wise across all parents. Each
 * position is combined with probability {@code geneRate}; otherwise the first parent's gene is
 * kept.
 */
public final class CombineCrossover<T> extends Crossover<T> {
  private final Function<List<Gene<T>>, Gene<T>> combiner;
  private final double geneRate;

  public CombineCrossover(Function<List<Gene<T>>, Gene<T>> combiner) {
    this(combiner, 1.0, 1.0, 2, false);
  }

  public CombineCrossover(
      Function<List<Gene<T>>, Gene<T>> combiner,
      double chromosomeRate,
      double geneRate,
      int numParents,
      boolean exclusivity) {
    super(numParents, 1, chromosomeRate, exclusivity);
    Mutator.checkRate("gene", geneRate);
    this.combiner = combiner;
    this.geneRate = geneRate;
  }

  /** Combines double genes into a gene holding their arithmetic mean. */
  public static CombineCrossover<Double> mean() {
    return new CombineCrossover<Double>(
        genes ->
            genes.get(0).duplicateWithValue(
                genes.stream().mapToDouble(Gene::value).average().orElseThrow()));
  }

  public double geneRate() {
    return geneRate;
  }

  @Override
  protected ImmutableList<Chromosome<T>> crossoverChromosomes(
      List<Chromosome<T>> chromosomes, Random random) {
    checkArgument(
        chromosomes.size() == numParents(),
        "Expected %s parent chromosomes but got %s",
        numParents(),
        chromosomes.size());
    int length = chromosomes.get(0).size();
    checkArgument(
        chromosomes.stream().allMatch(chromosome -> chromosome.size() == length),
        "Parent chromosomes must have the same length");
    ImmutableList.Builder<Gene<T>> genes = ImmutableList.builderWithExpectedSize(length);
    for (int i = 0; i < length; i++) {
      int position = i;
      genes.add(
          random.nextDouble() < geneRate
              ? combiner.apply(
                  chromosomes.stream()
                      .map(chromosome -> chromosome.gene(position))
                      .collect(toImmutableList()))
              : chromosomes.get(0).gene(i));
    }
    return ImmutableList.of(chromosomes.get(0).duplicateWithGenes(genes.build()));
  }

  @Override
  public String toString() {
    return String.format(
        "CombineCrossover(chromosomeRate=%s, geneRate=%s, numParents=%s, exclusivity=%s)",
        chromosomeRate(), geneRate, numParents(), exclusivity());
  }
}
