package com.verlumen.evolution.alteration;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.Random;

/**
 * Mutator acting on individual genes: within a mutated chromosome, each gene is replaced with
 * probability {@code geneRate}.
 */
public abstract class GeneMutator<T> extends Mutator<T> {
  private final double geneRate;

  protected GeneMutator(double individualRate, double chromosomeRate, double geneRate) {
    super(individualRate, chromosomeRate);
    checkRate("gene", geneRate);
    this.geneRate = geneRate;
  }

  public final double geneRate() {
    return geneRate;
  }

  @Override
  protected final Chromosome<T> mutateChromosome(Chromosome<T> chromosome, Random random) {
    ImmutableList.Builder<Gene<T>> genes = ImmutableList.builderWithExpectedSize(chromosome.size());
    boolean changed = false;
    for (Gene<T> gene : chromosome.genes()) {
      if (random.nextDouble() < geneRate) {
        genes.add(mutateGene(gene, random));
        changed = true;
      } else {
        genes.add(gene);
      }
    }
    return changed ? chromosome.duplicateWithGenes(genes.build()) : chromosome;
  }

  /** Produces the replacement for a gene picked for mutation. */
  protected abstract Gene<T> mutateGene(Gene<T> gene, Random random);
}
