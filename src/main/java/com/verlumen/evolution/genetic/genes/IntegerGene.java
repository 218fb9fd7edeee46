package com.verlumen.evolution.genetic.genes;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import com.verlumen.evolution.genetic.Gene;
import java.util.Random;

/** Integer-valued gene constrained to a closed range. */
@AutoValue
public abstract class IntegerGene implements Gene<Integer> {
  public static IntegerGene create(int value, Range<Integer> range) {
    checkArgument(
        range.hasLowerBound()
            && range.hasUpperBound()
            && range.lowerBoundType() == BoundType.CLOSED
            && range.upperBoundType() == BoundType.CLOSED,
        "Integer genes require a closed range, got %s",
        range);
    return new AutoValue_IntegerGene(value, range);
  }

  public static IntegerGene create(int value, int min, int max) {
    return create(value, Range.closed(min, max));
  }

  /** Creates a gene holding a uniformly drawn value in {@code range}. */
  public static IntegerGene random(Range<Integer> range, Random random) {
    return create(draw(range, random), range);
  }

  @Override
  public abstract Integer value();

  public abstract Range<Integer> range();

  @Override
  public IntegerGene duplicateWithValue(Integer value) {
    return create(value, range());
  }

  @Override
  public IntegerGene mutate(Random random) {
    return random(range(), random);
  }

  @Override
  public boolean verify() {
    return range().contains(value());
  }

  private static int draw(Range<Integer> range, Random random) {
    long span = (long) range.upperEndpoint() - range.lowerEndpoint() + 1;
    return (int) (range.lowerEndpoint() + (long) (random.nextDouble() * span));
  }
}
