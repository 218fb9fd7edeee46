package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.evolution.genetic.Gene;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * Position-based crossover (PBX). A random set of positions is drawn, each position with
 * probability {@code positionRate}. Each offspring keeps one parent's genes at those positions and
 * takes the remaining genes from the other parent in order.
 */
public final class PositionBasedCrossover<T> extends PermutationCrossover<T> {
  private final double positionRate;

  public PositionBasedCrossover() {
    this(1.0, false, 0.5);
  }

  public PositionBasedCrossover(double chromosomeRate, boolean exclusivity, double positionRate) {
    super(chromosomeRate, exclusivity);
    Mutator.checkRate("position", positionRate);
    this.positionRate = positionRate;
  }

  public double positionRate() {
    return positionRate;
  }

  @Override
  protected ImmutableList<ImmutableList<Gene<T>>> permute(
      List<Gene<T>> first, List<Gene<T>> second, Random random) {
    boolean[] fixed = new boolean[first.size()];
    for (int i = 0; i < fixed.length; i++) {
      fixed[i] = random.nextDouble() < positionRate;
    }
    return ImmutableList.of(crossoverAt(first, second, fixed), crossoverAt(second, first, fixed));
  }

  /**
   * Keeps {@code base} at the positions flagged in {@code fixed} and fills the others with the
   * genes of {@code filler} that are not kept, in {@code filler}'s order.
   */
  static <T> ImmutableList<Gene<T>> crossoverAt(
      List<Gene<T>> base, List<Gene<T>> filler, boolean[] fixed) {
    checkArgument(
        fixed.length == base.size(),
        "Expected %s position flags but got %s",
        base.size(),
        fixed.length);
    List<Gene<T>> keptGenes = new ArrayList<>();
    for (int i = 0; i < fixed.length; i++) {
      if (fixed[i]) {
        keptGenes.add(base.get(i));
      }
    }
    ImmutableSet<T> kept = values(keptGenes);
    Iterator<Gene<T>> fill =
        filler.stream().filter(gene -> !kept.contains(gene.value())).iterator();
    ImmutableList.Builder<Gene<T>> offspring = ImmutableList.builderWithExpectedSize(base.size());
    for (int i = 0; i < fixed.length; i++) {
      offspring.add(fixed[i] ? base.get(i) : fill.next());
    }
    return offspring.build();
  }

  @Override
  public String toString() {
    return String.format(
        "PositionBasedCrossover(chromosomeRate=%s, exclusivity=%s, positionRate=%s)",
        chromosomeRate(), exclusivity(), positionRate);
  }
}
