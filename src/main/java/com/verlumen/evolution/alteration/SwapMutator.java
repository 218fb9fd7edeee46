package com.verlumen.evolution.alteration;

import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Within a mutated chromosome, swaps each gene with probability {@code swapRate} with a gene at a
 * uniformly drawn position. Preserves the chromosome's gene multiset, which makes it suitable for
 * permutation encodings.
 */
public final class SwapMutator<T> extends Mutator<T> {
  private final double swapRate;

  public SwapMutator(double individualRate, double chromosomeRate, double swapRate) {
    super(individualRate, chromosomeRate);
    checkRate("swap", swapRate);
    this.swapRate = swapRate;
  }

  public double swapRate() {
    return swapRate;
  }

  @Override
  protected Chromosome<T> mutateChromosome(Chromosome<T> chromosome, Random random) {
    List<Gene<T>> genes = new ArrayList<>(chromosome.genes());
    boolean changed = false;
    for (int i = 0; i < genes.size(); i++) {
      if (random.nextDouble() < swapRate) {
        int other = random.nextInt(genes.size());
        if (other != i) {
          Collections.swap(genes, i, other);
          changed = true;
        }
      }
    }
    return changed ? chromosome.duplicateWithGenes(genes) : chromosome;
  }

  @Override
  public String toString() {
    return String.format(
        "SwapMutator(individualRate=%s, chromosomeRate=%s, swapRate=%s)",
        individualRate(), chromosomeRate(), swapRate);
  }
}
