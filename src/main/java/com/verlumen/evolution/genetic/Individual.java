package com.verlumen.evolution.genetic;

import com.google.auto.value.AutoValue;

/**
 * A genotype paired with its fitness score. A fitness of {@link Double#NaN} marks an individual
 * that has not been evaluated yet.
 */
@AutoValue
public abstract class Individual<T> {
  public static <T> Individual<T> unevaluated(Genotype<T> genotype) {
    return of(genotype, Double.NaN);
  }

  public static <T> Individual<T> of(Genotype<T> genotype, double fitness) {
    return new AutoValue_Individual<T>(genotype, fitness);
  }

  public abstract Genotype<T> genotype();

  public abstract double fitness();

  public Individual<T> withFitness(double fitness) {
    return of(genotype(), fitness);
  }

  public boolean isEvaluated() {
    return !Double.isNaN(fitness());
  }

  /** Returns true if the genotype verifies and the individual has been evaluated. */
  public boolean verify() {
    return isEvaluated() && genotype().verify();
  }
}
