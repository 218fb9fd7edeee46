package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Cuts two equal-length parent chromosomes at {@code points} distinct indices and builds two
 * offspring by alternating the segments between cuts. Chromosomes shorter than {@code points} are
 * cut at every index.
 */
public final class MultiPointCrossover<T> extends Crossover<T> {
  private final int points;

  public MultiPointCrossover(int points) {
    this(points, 1.0, false);
  }

  public MultiPointCrossover(int points, double chromosomeRate, boolean exclusivity) {
    super(2, 2, chromosomeRate, exclusivity);
    checkArgument(points >= 1, "Number of crossover points (%s) must be positive", points);
    this.points = points;
  }

  public int points() {
    return points;
  }

  @Override
  protected ImmutableList<Chromosome<T>> crossoverChromosomes(
      List<Chromosome<T>> chromosomes, Random random) {
    SinglePointCrossover.checkParents(chromosomes);
    int length = chromosomes.get(0).size();
    List<Integer> indices = IntStream.range(0, length).boxed().collect(Collectors.toList());
    Collections.shuffle(indices, random);
    return crossoverAt(
        ImmutableSortedSet.copyOf(indices.subList(0, Math.min(points, length))),
        chromosomes.get(0),
        chromosomes.get(1));
  }

  /**
   * Builds the two offspring of cutting both parents at every index in {@code cuts}. Genes before
   * the first cut come from their own parent; each cut switches the source parent.
   */
  ImmutableList<Chromosome<T>> crossoverAt(
      ImmutableSortedSet<Integer> cuts, Chromosome<T> first, Chromosome<T> second) {
    int length = first.size();
    checkArgument(
        cuts.isEmpty() || (cuts.first() >= 0 && cuts.last() <= length),
        "Crossover points %s must be in [0, %s]",
        cuts,
        length);
    List<Gene<T>> firstGenes = new ArrayList<>(length);
    List<Gene<T>> secondGenes = new ArrayList<>(length);
    boolean swapped = false;
    for (int i = 0; i < length; i++) {
      if (cuts.contains(i)) {
        swapped = !swapped;
      }
      firstGenes.add(swapped ? second.gene(i) : first.gene(i));
      secondGenes.add(swapped ? first.gene(i) : second.gene(i));
    }
    return ImmutableList.of(
        first.duplicateWithGenes(firstGenes), second.duplicateWithGenes(secondGenes));
  }

  @Override
  public String toString() {
    return String.format(
        "MultiPointCrossover(points=%s, chromosomeRate=%s, exclusivity=%s)",
        points, chromosomeRate(), exclusivity());
  }
}
