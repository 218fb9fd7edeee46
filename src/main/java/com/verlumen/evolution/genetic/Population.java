package com.verlumen.evolution.genetic;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/** Ordered collection of individuals. Order is insertion order unless explicitly sorted. */
@AutoValue
public abstract class Population<T> implements Iterable<Individual<T>> {
  public static <T> Population<T> of(List<Individual<T>> individuals) {
    return new AutoValue_Population<T>(ImmutableList.copyOf(individuals));
  }

  @SafeVarargs
  public static <T> Population<T> of(Individual<T>... individuals) {
    return of(ImmutableList.copyOf(individuals));
  }

  public static <T> Population<T> empty() {
    return of(ImmutableList.of());
  }

  public abstract ImmutableList<Individual<T>> individuals();

  public int size() {
    return individuals().size();
  }

  public boolean isEmpty() {
    return individuals().isEmpty();
  }

  public Individual<T> get(int index) {
    return individuals().get(index);
  }

  public ImmutableList<Double> fitnessValues() {
    return stream().map(Individual::fitness).collect(toImmutableList());
  }

  public boolean allEvaluated() {
    return stream().allMatch(Individual::isEvaluated);
  }

  /** Returns a population holding this population's individuals followed by {@code other}'s. */
  public Population<T> concat(Population<T> other) {
    return of(
        ImmutableList.<Individual<T>>builderWithExpectedSize(size() + other.size())
            .addAll(individuals())
            .addAll(other.individuals())
            .build());
  }

  public Stream<Individual<T>> stream() {
    return individuals().stream();
  }

  @Override
  public Iterator<Individual<T>> iterator() {
    return individuals().iterator();
  }
}
