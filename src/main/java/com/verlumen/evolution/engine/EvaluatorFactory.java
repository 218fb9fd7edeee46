package com.verlumen.evolution.engine;

import com.verlumen.evolution.genetic.Genotype;
import java.util.function.Function;

/** Creates the evaluator matching the process settings for a fitness function. */
public interface EvaluatorFactory {
  <T> Evaluator<T> create(Function<Genotype<T>, Double> fitnessFunction);
}
