package com.verlumen.evolution.genetic.genes;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.genetic.Gene;
import java.util.Random;

/** A single bit. */
@AutoValue
public abstract class BooleanGene implements Gene<Boolean> {
  public static final BooleanGene TRUE = new AutoValue_BooleanGene(true);
  public static final BooleanGene FALSE = new AutoValue_BooleanGene(false);

  public static BooleanGene of(boolean value) {
    return value ? TRUE : FALSE;
  }

  @Override
  public abstract Boolean value();

  @Override
  public BooleanGene duplicateWithValue(Boolean value) {
    return of(value);
  }

  @Override
  public BooleanGene mutate(Random random) {
    return of(random.nextBoolean());
  }
}
