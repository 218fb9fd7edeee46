package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.ranking.Ranker;
import java.util.Random;

/**
 * Fills each output slot with the best of {@code sampleSize} individuals drawn uniformly with
 * replacement. Ties go to the first individual drawn.
 */
public final class TournamentSelector implements Selector {
  private final int sampleSize;

  public TournamentSelector(int sampleSize) {
    checkArgument(sampleSize >= 1, "Tournament size (%s) must be positive", sampleSize);
    this.sampleSize = sampleSize;
  }

  public int sampleSize() {
    return sampleSize;
  }

  @Override
  public <T> Population<T> select(
      Population<T> population, int count, Ranker ranker, Random random) {
    ImmutableList.Builder<Individual<T>> selected = ImmutableList.builderWithExpectedSize(count);
    for (int slot = 0; slot < count; slot++) {
      selected.add(runTournament(population, ranker, random));
    }
    return Population.of(selected.build());
  }

  private <T> Individual<T> runTournament(Population<T> population, Ranker ranker, Random random) {
    Individual<T> winner = population.get(random.nextInt(population.size()));
    for (int draw = 1; draw < sampleSize; draw++) {
      Individual<T> contender = population.get(random.nextInt(population.size()));
      if (ranker.compare(contender, winner) > 0) {
        winner = contender;
      }
    }
    return winner;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof TournamentSelector
        && ((TournamentSelector) other).sampleSize == sampleSize;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(sampleSize);
  }

  @Override
  public String toString() {
    return "TournamentSelector(sampleSize=" + sampleSize + ")";
  }
}
