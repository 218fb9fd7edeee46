package com.verlumen.evolution.alteration;

import com.verlumen.evolution.genetic.Gene;
import java.util.Random;

/** Negates the value of picked boolean genes. */
public final class BitFlipMutator extends GeneMutator<Boolean> {
  public BitFlipMutator(double individualRate, double chromosomeRate, double geneRate) {
    super(individualRate, chromosomeRate, geneRate);
  }

  @Override
  protected Gene<Boolean> mutateGene(Gene<Boolean> gene, Random random) {
    return gene.duplicateWithValue(!gene.value());
  }

  @Override
  public String toString() {
    return String.format(
        "BitFlipMutator(individualRate=%s, chromosomeRate=%s, geneRate=%s)",
        individualRate(), chromosomeRate(), geneRate());
  }
}
