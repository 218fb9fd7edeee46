package com.verlumen.evolution.engine;

import com.google.inject.Inject;
import java.util.Random;

final class GeneticAlgorithmFactoryImpl implements GeneticAlgorithmFactory {
  private final Random random;
  private final EvaluatorFactory evaluatorFactory;

  @Inject
  GeneticAlgorithmFactoryImpl(Random random, EvaluatorFactory evaluatorFactory) {
    this.random = random;
    this.evaluatorFactory = evaluatorFactory;
  }

  @Override
  public <T> GeneticAlgorithm<T> create(EngineConfig.Builder<T> builder) {
    builder.setRandom(random);
    if (!builder.evaluator().isPresent()) {
      builder
          .fitnessFunction()
          .ifPresent(fitness -> builder.setEvaluator(evaluatorFactory.create(fitness)));
    }
    return GeneticAlgorithm.create(builder.build());
  }
}
