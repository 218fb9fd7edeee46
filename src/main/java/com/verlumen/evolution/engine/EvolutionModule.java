package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Binds the engine factories for the given process settings. */
@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  public static EvolutionModule create(EvolutionSettings settings) {
    return new AutoValue_EvolutionModule(settings);
  }

  abstract EvolutionSettings settings();

  @Override
  protected void configure() {
    bind(EvaluatorFactory.class).to(EvaluatorFactoryImpl.class);
    bind(GeneticAlgorithmFactory.class).to(GeneticAlgorithmFactoryImpl.class);
  }

  @Provides
  EvolutionSettings provideSettings() {
    return settings();
  }

  @Provides
  @Singleton
  Random provideRandom() {
    return new Random(settings().seed());
  }

  /** Each evaluator gets its own pool and shuts it down when closed. */
  @Provides
  ExecutorService provideEvaluatorExecutor() {
    return Executors.newFixedThreadPool(
        settings().evaluatorThreads(),
        new ThreadFactoryBuilder().setNameFormat("evaluator-%d").setDaemon(true).build());
  }
}
