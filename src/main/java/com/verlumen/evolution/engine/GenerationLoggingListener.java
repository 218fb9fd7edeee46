package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.verlumen.evolution.EvolutionState;

/** Logs the best fitness of every n-th generation. */
public final class GenerationLoggingListener<T> implements EvolutionListener<T> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int interval;

  public GenerationLoggingListener() {
    this(1);
  }

  public GenerationLoggingListener(int interval) {
    checkArgument(interval > 0, "Logging interval (%s) must be positive", interval);
    this.interval = interval;
  }

  @Override
  public void onGenerationEnd(EvolutionState<T> state) {
    if (state.isEmpty() || state.generation() % interval != 0) {
      return;
    }
    logger.atInfo().log(
        "Generation %d: best fitness %s",
        state.generation(), state.ranker().best(state.population()).fitness());
  }

  @Override
  public void onEvolutionEnd(EvolutionState<T> state) {
    logger.atInfo().log("Evolution finished after %d generations", state.generation());
  }
}
