package com.verlumen.evolution.genetic.specs;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.LinearChromosome;
import com.verlumen.evolution.genetic.genes.BooleanGene;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Specification for bit-string chromosomes.
 */
final class BitChromosomeSpec implements ChromosomeSpec<Boolean> {
  private final int size;
  private final double trueRate;

  BitChromosomeSpec(int size, double trueRate) {
    checkArgument(size > 0, "Chromosome size (%s) must be positive", size);
    checkArgument(
        trueRate >= 0.0 && trueRate <= 1.0, "True rate (%s) must be in [0, 1]", trueRate);
    this.size = size;
    this.trueRate = trueRate;
  }

  double getTrueRate() {
    return trueRate;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public Chromosome<Boolean> createChromosome(Random random) {
    return LinearChromosome.of(
        Stream.generate(() -> BooleanGene.of(random.nextDouble() < trueRate))
            .limit(size)
            .collect(ImmutableList.toImmutableList()));
  }
}
