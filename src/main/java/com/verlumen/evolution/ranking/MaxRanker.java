package com.verlumen.evolution.ranking;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Ranks higher fitness values as better. */
public final class MaxRanker implements Ranker {
  @Override
  public int compareFitness(double first, double second) {
    return Integer.signum(Double.compare(first, second));
  }

  @Override
  public ImmutableList<Double> fitnessTransform(List<Double> fitness) {
    return ImmutableList.copyOf(fitness);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MaxRanker;
  }

  @Override
  public int hashCode() {
    return MaxRanker.class.hashCode();
  }

  @Override
  public String toString() {
    return "MaxRanker";
  }
}
