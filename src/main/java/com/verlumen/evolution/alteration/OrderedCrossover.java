package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.evolution.genetic.Gene;
import java.util.List;
import java.util.Random;

/**
 * Ordered crossover (OX). Each offspring keeps a segment of one parent at its original positions
 * and fills the remaining positions with the other parent's genes in the order they appear there.
 */
public final class OrderedCrossover<T> extends PermutationCrossover<T> {
  public OrderedCrossover() {
    this(1.0, false);
  }

  public OrderedCrossover(double chromosomeRate, boolean exclusivity) {
    super(chromosomeRate, exclusivity);
  }

  @Override
  protected ImmutableList<ImmutableList<Gene<T>>> permute(
      List<Gene<T>> first, List<Gene<T>> second, Random random) {
    int[] region = distinctSortedPair(first.size(), random);
    return ImmutableList.of(
        exchange(first, second, region[0], region[1]),
        exchange(second, first, region[0], region[1]));
  }

  /**
   * Keeps {@code donor[start..end]} (inclusive) in place and fills the other positions with the
   * genes of {@code filler} that are not in that segment, in {@code filler}'s order.
   */
  static <T> ImmutableList<Gene<T>> exchange(
      List<Gene<T>> donor, List<Gene<T>> filler, int start, int end) {
    checkArgument(
        start >= 0 && start <= end && end < donor.size(),
        "Crossover region [%s, %s] must lie within [0, %s)",
        start,
        end,
        donor.size());
    List<Gene<T>> segment = donor.subList(start, end + 1);
    ImmutableSet<T> kept = values(segment);
    ImmutableList<Gene<T>> remaining =
        filler.stream()
            .filter(gene -> !kept.contains(gene.value()))
            .collect(ImmutableList.toImmutableList());
    return ImmutableList.<Gene<T>>builder()
        .addAll(remaining.subList(0, start))
        .addAll(segment)
        .addAll(remaining.subList(start, remaining.size()))
        .build();
  }

  @Override
  public String toString() {
    return String.format(
        "OrderedCrossover(chromosomeRate=%s, exclusivity=%s)", chromosomeRate(), exclusivity());
  }
}
