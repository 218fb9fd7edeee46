package com.verlumen.evolution.genetic;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ordered, fixed-arity sequence of genes of the same kind.
 *
 * @param <T> the type of value held by the genes
 */
public interface Chromosome<T> {
  /** Returns the genes of this chromosome, in order. */
  ImmutableList<Gene<T>> genes();

  /**
   * Creates a chromosome of the same kind holding the given genes.
   *
   * @param genes the genes of the new chromosome
   * @return a new chromosome
   */
  Chromosome<T> duplicateWithGenes(List<? extends Gene<T>> genes);

  default int size() {
    return genes().size();
  }

  default Gene<T> gene(int index) {
    return genes().get(index);
  }

  /** Returns true only if every gene verifies. */
  default boolean verify() {
    return genes().stream().allMatch(Gene::verify);
  }
}
