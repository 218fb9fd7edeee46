package com.verlumen.evolution.limits;

import com.google.auto.value.AutoValue;

/** Summary of one completed generation. */
@AutoValue
public abstract class GenerationRecord {
  public static GenerationRecord create(int generation, double bestFitness, int steady) {
    return new AutoValue_GenerationRecord(generation, bestFitness, steady);
  }

  public abstract int generation();

  /** Raw fitness of the best individual of the generation. */
  public abstract double bestFitness();

  /** Number of consecutive generations, ending with this one, without improvement of the best. */
  public abstract int steady();
}
