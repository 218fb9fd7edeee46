package com.verlumen.evolution.alteration;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Chromosome;
import com.verlumen.evolution.genetic.Gene;
import java.util.List;
import java.util.Random;

/**
 * Cuts two equal-length parent chromosomes at one uniformly drawn index and swaps their tails.
 */
public final class SinglePointCrossover<T> extends Crossover<T> {
  public SinglePointCrossover() {
    this(1.0, false);
  }

  public SinglePointCrossover(double chromosomeRate, boolean exclusivity) {
    super(2, 2, chromosomeRate, exclusivity);
  }

  @Override
  protected ImmutableList<Chromosome<T>> crossoverChromosomes(
      List<Chromosome<T>> chromosomes, Random random) {
    checkParents(chromosomes);
    Chromosome<T> first = chromosomes.get(0);
    Chromosome<T> second = chromosomes.get(1);
    int cut = random.nextInt(Math.min(first.size(), second.size()));
    return crossoverAt(cut, first, second);
  }

  /**
   * Builds the two offspring of cutting both parents at {@code cut}: the first takes the genes of
   * {@code first} before the cut and the genes of {@code second} from the cut on, the second the
   * other way around.
   */
  ImmutableList<Chromosome<T>> crossoverAt(int cut, Chromosome<T> first, Chromosome<T> second) {
    checkParents(ImmutableList.of(first, second));
    int length = first.size();
    checkArgument(
        cut >= 0 && cut <= length, "The crossover point (%s) must be in [0, %s]", cut, length);
    ImmutableList<Gene<T>> firstGenes =
        ImmutableList.<Gene<T>>builder()
            .addAll(first.genes().subList(0, cut))
            .addAll(second.genes().subList(cut, length))
            .build();
    ImmutableList<Gene<T>> secondGenes =
        ImmutableList.<Gene<T>>builder()
            .addAll(second.genes().subList(0, cut))
            .addAll(first.genes().subList(cut, length))
            .build();
    return ImmutableList.of(
        first.duplicateWithGenes(firstGenes), second.duplicateWithGenes(secondGenes));
  }

  static <T> void checkParents(List<Chromosome<T>> chromosomes) {
    checkArgument(
        chromosomes.size() == 2, "Expected 2 parent chromosomes but got %s", chromosomes.size());
    checkArgument(
        chromosomes.get(0).size() == chromosomes.get(1).size(),
        "Parent chromosomes must have the same length (%s != %s)",
        chromosomes.get(0).size(),
        chromosomes.get(1).size());
  }

  @Override
  public String toString() {
    return String.format(
        "SinglePointCrossover(chromosomeRate=%s, exclusivity=%s)", chromosomeRate(), exclusivity());
  }
}
