package com.verlumen.evolution.alteration;

import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffles a contiguous segment of a mutated chromosome. The segment starts at the first position
 * whose draw falls below {@code boundaryProbability} (the first gene if none does) and ends at the
 * first later position whose draw exceeds it (the last gene if none does). Preserves the gene
 * multiset, so permutation chromosomes stay permutations.
 */
public final class PartialShuffleMutator<T> extends Mutator<T> {
  private final double boundaryProbability;

  public PartialShuffleMutator() {
    this(1.0, 1.0, 0.5);
  }

  public PartialShuffleMutator(
      double individualRate, double chromosomeRate, double boundaryProbability) {
    super(individualRate, chromosomeRate);
    checkRate("shuffle boundary", boundaryProbability);
    this.boundaryProbability = boundaryProbability;
  }

  public double boundaryProbability() {
    return boundaryProbability;
  }

  @Override
  protected Chromosome<T> mutateChromosome(Chromosome<T> chromosome, Random random) {
    if (boundaryProbability == 0.0 || chromosome.size() < 2) {
      return chromosome;
    }
    int size = chromosome.size();
    int start = 0;
    for (int i = 0; i < size; i++) {
      if (random.nextDouble() < boundaryProbability) {
        start = i;
        break;
      }
    }
    int end = size - 1;
    for (int i = start; i < size; i++) {
      if (random.nextDouble() > boundaryProbability) {
        end = i;
        break;
      }
    }
    if (end <= start) {
      return chromosome;
    }
    List<Gene<T>> genes = new ArrayList<>(chromosome.genes());
    Collections.shuffle(genes.subList(start, end + 1), random);
    return chromosome.duplicateWithGenes(genes);
  }

  @Override
  public String toString() {
    return String.format(
        "PartialShuffleMutator(individualRate=%s, chromosomeRate=%s, boundaryProbability=%s)",
        individualRate(), chromosomeRate(), boundaryProbability);
  }
}
