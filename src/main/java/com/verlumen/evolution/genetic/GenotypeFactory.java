package com.verlumen.evolution.genetic;

/** Produces fresh, internally valid genotypes when a population is initialized. */
@FunctionalInterface
public interface GenotypeFactory<T> {
  Genotype<T> create();
}
