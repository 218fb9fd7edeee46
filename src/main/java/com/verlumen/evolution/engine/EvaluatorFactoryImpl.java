package com.verlumen.evolution.engine;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.verlumen.evolution.genetic.Genotype;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

final class EvaluatorFactoryImpl implements EvaluatorFactory {
  private final EvolutionSettings settings;
  private final Provider<ExecutorService> executor;

  @Inject
  EvaluatorFactoryImpl(EvolutionSettings settings, Provider<ExecutorService> executor) {
    this.settings = settings;
    this.executor = executor;
  }

  @Override
  public <T> Evaluator<T> create(Function<Genotype<T>, Double> fitnessFunction) {
    if (settings.evaluatorThreads() == 1) {
      return new SequentialEvaluator<T>(fitnessFunction);
    }
    return new ConcurrentEvaluator<T>(
        fitnessFunction, executor.get(), settings.evaluatorThreads());
  }
}
