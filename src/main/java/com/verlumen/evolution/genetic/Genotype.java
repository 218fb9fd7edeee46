package com.verlumen.evolution.genetic;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ordered sequence of chromosomes forming one complete encoded solution.
 *
 * @param <T> the type of value held by the genes
 */
@AutoValue
public abstract class Genotype<T> {
  public static <T> Genotype<T> of(List<? extends Chromosome<T>> chromosomes) {
    checkArgument(!chromosomes.isEmpty(), "A genotype must hold at least one chromosome");
    return new AutoValue_Genotype<T>(ImmutableList.<Chromosome<T>>copyOf(chromosomes));
  }

  @SafeVarargs
  public static <T> Genotype<T> of(Chromosome<T>... chromosomes) {
    return of(ImmutableList.<Chromosome<T>>copyOf(chromosomes));
  }

  public abstract ImmutableList<Chromosome<T>> chromosomes();

  public int size() {
    return chromosomes().size();
  }

  public Chromosome<T> chromosome(int index) {
    return chromosomes().get(index);
  }

  /** Concatenates the values of every gene of every chromosome, in order. */
  public ImmutableList<T> flatten() {
    return chromosomes().stream()
        .flatMap(chromosome -> chromosome.genes().stream())
        .map(Gene::value)
        .collect(toImmutableList());
  }

  public boolean verify() {
    return chromosomes().stream().allMatch(Chromosome::verify);
  }
}
