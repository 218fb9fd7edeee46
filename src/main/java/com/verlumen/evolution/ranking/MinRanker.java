package com.verlumen.evolution.ranking;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ranks lower fitness values as better.
 *
 * <p>The fitness transform maps each value {@code v} to {@code sum - v}, so that the smallest raw
 * values become the largest transformed ones.
 */
public final class MinRanker implements Ranker {
  @Override
  public int compareFitness(double first, double second) {
    return Integer.signum(Double.compare(second, first));
  }

  @Override
  public ImmutableList<Double> fitnessTransform(List<Double> fitness) {
    double sum = fitness.stream().mapToDouble(Double::doubleValue).sum();
    return fitness.stream().map(value -> sum - value).collect(toImmutableList());
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MinRanker;
  }

  @Override
  public int hashCode() {
    return MinRanker.class.hashCode();
  }

  @Override
  public String toString() {
    return "MinRanker";
  }
}
