package com.verlumen.evolution.alteration;

import com.verlumen.evolution.genetic.Gene;
import java.util.Random;

/** Replaces picked genes with random genes of the same kind. */
public final class RandomMutator<T> extends GeneMutator<T> {
  public RandomMutator(double individualRate, double chromosomeRate, double geneRate) {
    super(individualRate, chromosomeRate, geneRate);
  }

  @Override
  protected Gene<T> mutateGene(Gene<T> gene, Random random) {
    return gene.mutate(random);
  }

  @Override
  public String toString() {
    return String.format(
        "RandomMutator(individualRate=%s, chromosomeRate=%s, geneRate=%s)",
        individualRate(), chromosomeRate(), geneRate());
  }
}
