package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Gene;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Partially mapped crossover (PMX). The parents exchange a segment; genes outside the segment that
 * would then occur twice are replaced through the mapping the exchanged segments define.
 */
public final class PartiallyMappedCrossover<T> extends PermutationCrossover<T> {
  public PartiallyMappedCrossover() {
    this(1.0, false);
  }

  public PartiallyMappedCrossover(double chromosomeRate, boolean exclusivity) {
    super(chromosomeRate, exclusivity);
  }

  @Override
  protected ImmutableList<ImmutableList<Gene<T>>> permute(
      List<Gene<T>> first, List<Gene<T>> second, Random random) {
    // Two distinct cut points in [0, size] bound a non-empty segment.
    int[] cuts = distinctSortedPair(first.size() + 1, random);
    return ImmutableList.of(
        crossoverAt(first, second, cuts[0], cuts[1]),
        crossoverAt(second, first, cuts[0], cuts[1]));
  }

  /**
   * Builds the offspring that takes {@code segmentDonor[lo, hi)} and keeps {@code base} elsewhere,
   * resolving duplicates through the segment mapping.
   */
  static <T> ImmutableList<Gene<T>> crossoverAt(
      List<Gene<T>> base, List<Gene<T>> segmentDonor, int lo, int hi) {
    checkArgument(
        lo >= 0 && lo < hi && hi <= base.size(),
        "Crossover segment [%s, %s) must be a non-empty part of [0, %s)",
        lo,
        hi,
        base.size());
    Map<T, Gene<T>> mapping = new HashMap<>();
    for (int i = lo; i < hi; i++) {
      mapping.put(segmentDonor.get(i).value(), base.get(i));
    }
    List<Gene<T>> offspring = new ArrayList<>(base.size());
    for (int i = 0; i < base.size(); i++) {
      if (i >= lo && i < hi) {
        offspring.add(segmentDonor.get(i));
        continue;
      }
      Gene<T> gene = base.get(i);
      while (mapping.containsKey(gene.value())) {
        gene = mapping.get(gene.value());
      }
      offspring.add(gene);
    }
    return ImmutableList.copyOf(offspring);
  }

  @Override
  public String toString() {
    return String.format(
        "PartiallyMappedCrossover(chromosomeRate=%s, exclusivity=%s)",
        chromosomeRate(), exclusivity());
  }
}
