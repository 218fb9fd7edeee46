package com.verlumen.evolution.selection;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Doubles;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.ranking.Ranker;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Fitness-proportionate selection. Each individual is selected with probability proportional to
 * its transformed fitness, shifted so that no value is negative. When the shifted values sum to
 * zero, NaN or infinity, every individual gets the same probability.
 */
public final class RouletteWheelSelector implements Selector {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double PROBABILITY_TOLERANCE = 1e-6;

  /** Populations up to this size are searched linearly; larger ones use binary search. */
  static final int SERIAL_INDEX_THRESHOLD = 35;

  private final boolean sorted;

  public RouletteWheelSelector() {
    this(false);
  }

  /**
   * @param sorted whether to sort the population by the ranker before associating probabilities
   *     with individuals
   */
  public RouletteWheelSelector(boolean sorted) {
    this.sorted = sorted;
  }

  public boolean sorted() {
    return sorted;
  }

  @Override
  public <T> Population<T> select(
      Population<T> population, int count, Ranker ranker, Random random) {
    Population<T> ordered = sorted ? ranker.sort(population) : population;
    double[] cumulative = cumulative(probabilities(ordered, ranker));
    ImmutableList.Builder<Individual<T>> selected = ImmutableList.builderWithExpectedSize(count);
    for (int slot = 0; slot < count; slot++) {
      selected.add(ordered.get(indexOf(cumulative, random.nextDouble())));
    }
    return Population.of(selected.build());
  }

  /**
   * Computes the selection probability of every individual, in population order.
   *
   * @throws IllegalStateException if the probabilities do not sum to 1
   */
  public ImmutableList<Double> probabilities(Population<?> population, Ranker ranker) {
    List<Double> transformed = ranker.fitnessTransform(population.fitnessValues());
    double shift = -Math.min(0.0, Collections.min(transformed));
    double[] shifted = transformed.stream().mapToDouble(value -> value + shift).toArray();
    double sum = Arrays.stream(shifted).sum();

    double[] probabilities = new double[shifted.length];
    if (sum == 0.0 || !Double.isFinite(sum)) {
      logger.atFine().log("Degenerate fitness sum %s, using uniform probabilities", sum);
      Arrays.fill(probabilities, 1.0 / shifted.length);
    } else {
      for (int i = 0; i < shifted.length; i++) {
        probabilities[i] = shifted[i] / sum;
      }
    }

    double total = Arrays.stream(probabilities).sum();
    checkState(
        Math.abs(total - 1.0) <= PROBABILITY_TOLERANCE,
        "Probabilities must sum to 1 but sum to %s",
        total);
    return ImmutableList.copyOf(Doubles.asList(probabilities));
  }

  /**
   * Returns the prefix sums of {@code probabilities}, rescaled so that the last entry is exactly 1.
   */
  @VisibleForTesting
  static double[] cumulative(List<Double> probabilities) {
    double[] cumulative = new double[probabilities.size()];
    double running = 0.0;
    for (int i = 0; i < cumulative.length; i++) {
      running += probabilities.get(i);
      cumulative[i] = running;
    }
    for (int i = 0; i < cumulative.length; i++) {
      cumulative[i] /= running;
    }
    return cumulative;
  }

  /** Returns the first index whose cumulative probability is at least {@code draw}. */
  @VisibleForTesting
  static int indexOf(double[] cumulative, double draw) {
    return cumulative.length <= SERIAL_INDEX_THRESHOLD
        ? serialSearchIndex(cumulative, draw)
        : binarySearchIndex(cumulative, draw);
  }

  @VisibleForTesting
  static int serialSearchIndex(double[] cumulative, double draw) {
    for (int i = 0; i < cumulative.length; i++) {
      if (cumulative[i] >= draw) {
        return i;
      }
    }
    return cumulative.length - 1;
  }

  @VisibleForTesting
  static int binarySearchIndex(double[] cumulative, double draw) {
    int lo = 0;
    int hi = cumulative.length - 1;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (cumulative[mid] >= draw) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return lo;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RouletteWheelSelector
        && ((RouletteWheelSelector) other).sorted == sorted;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(sorted);
  }

  @Override
  public String toString() {
    return "RouletteWheelSelector(sorted=" + sorted + ")";
  }
}
