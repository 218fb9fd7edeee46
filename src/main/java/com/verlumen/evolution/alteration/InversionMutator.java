package com.verlumen.evolution.alteration;

import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Reverses the order of the genes between two uniformly drawn positions (inclusive) of a mutated
 * chromosome.
 */
public final class InversionMutator<T> extends Mutator<T> {
  public InversionMutator(double individualRate, double chromosomeRate) {
    super(individualRate, chromosomeRate);
  }

  @Override
  protected Chromosome<T> mutateChromosome(Chromosome<T> chromosome, Random random) {
    if (chromosome.size() < 2) {
      return chromosome;
    }
    int first = random.nextInt(chromosome.size());
    int second = random.nextInt(chromosome.size());
    int start = Math.min(first, second);
    int end = Math.max(first, second);
    if (start == end) {
      return chromosome;
    }
    List<Gene<T>> genes = new ArrayList<>(chromosome.genes());
    Collections.reverse(genes.subList(start, end + 1));
    return chromosome.duplicateWithGenes(genes);
  }

  @Override
  public String toString() {
    return String.format(
        "InversionMutator(individualRate=%s, chromosomeRate=%s)",
        individualRate(), chromosomeRate());
  }
}
