package com.verlumen.evolution.genetic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A chromosome backed by an immutable list of genes. */
@AutoValue
public abstract class LinearChromosome<T> implements Chromosome<T> {
  public static <T> LinearChromosome<T> of(List<? extends Gene<T>> genes) {
    checkArgument(!genes.isEmpty(), "A chromosome must hold at least one gene");
    return new AutoValue_LinearChromosome<T>(ImmutableList.<Gene<T>>copyOf(genes));
  }

  @SafeVarargs
  public static <T> LinearChromosome<T> of(Gene<T>... genes) {
    return of(ImmutableList.<Gene<T>>copyOf(genes));
  }

  @Override
  public abstract ImmutableList<Gene<T>> genes();

  @Override
  public LinearChromosome<T> duplicateWithGenes(List<? extends Gene<T>> genes) {
    checkArgument(
        genes.size() == size(),
        "Expected %s genes but got %s; chromosomes have a fixed size",
        size(),
        genes.size());
    return of(genes);
  }
}
