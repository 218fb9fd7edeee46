package com.verlumen.evolution.genetic;

import java.util.Random;

/**
 * Smallest unit of encoded information. Genes are immutable; every change produces a new gene of
 * the same kind.
 *
 * @param <T> the type of value held by the gene
 */
public interface Gene<T> {
  /** Returns the value held by this gene. */
  T value();

  /**
   * Creates a gene of the same kind, with the same constraints, holding a different value.
   *
   * @param value the value of the new gene
   * @return a new gene holding {@code value}
   */
  Gene<T> duplicateWithValue(T value);

  /**
   * Creates a gene of the same kind holding a randomly drawn value that satisfies this gene's
   * constraints.
   */
  Gene<T> mutate(Random random);

  /** Returns whether the value satisfies the gene's domain constraints. */
  default boolean verify() {
    return true;
  }
}
