package com.verlumen.evolution.genetic.genes;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.Range;
import com.verlumen.evolution.genetic.Gene;
import java.util.Random;

/** Double-valued gene constrained to a half-open range {@code [min, max)}. */
@AutoValue
public abstract class DoubleGene implements Gene<Double> {
  public static DoubleGene create(double value, double min, double max) {
    checkArgument(min < max, "Lower bound (%s) must be less than upper bound (%s)", min, max);
    checkArgument(
        Double.isFinite(max - min), "Range [%s, %s) must have a finite width", min, max);
    return new AutoValue_DoubleGene(value, Range.closedOpen(min, max));
  }

  /** Creates a gene holding a uniformly drawn value in {@code [min, max)}. */
  public static DoubleGene random(double min, double max, Random random) {
    double value = min + random.nextDouble() * (max - min);
    // Rounding can land on the excluded upper bound.
    return create(value < max ? value : Math.nextDown(max), min, max);
  }

  @Override
  public abstract Double value();

  public abstract Range<Double> range();

  public double min() {
    return range().lowerEndpoint();
  }

  public double max() {
    return range().upperEndpoint();
  }

  @Override
  public DoubleGene duplicateWithValue(Double value) {
    return create(value, min(), max());
  }

  @Override
  public DoubleGene mutate(Random random) {
    return random(min(), max(), random);
  }

  @Override
  public boolean verify() {
    return range().contains(value());
  }
}
