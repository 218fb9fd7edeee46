package com.verlumen.evolution.selection;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.ranking.Ranker;
import java.util.Random;

/** Selects individuals uniformly at random, with replacement, ignoring fitness. */
public final class RandomSelector implements Selector {
  @Override
  public <T> Population<T> select(
      Population<T> population, int count, Ranker ranker, Random random) {
    ImmutableList.Builder<Individual<T>> selected = ImmutableList.builderWithExpectedSize(count);
    for (int slot = 0; slot < count; slot++) {
      selected.add(population.get(random.nextInt(population.size())));
    }
    return Population.of(selected.build());
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RandomSelector;
  }

  @Override
  public int hashCode() {
    return RandomSelector.class.hashCode();
  }

  @Override
  public String toString() {
    return "RandomSelector";
  }
}
