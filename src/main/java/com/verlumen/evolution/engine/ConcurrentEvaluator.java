package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.IntMath;
import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * Evaluates individuals in chunks on an {@link ExecutorService}. The fitness function must be safe
 * to call from several threads at once.
 *
 * <p>The evaluator owns its executor: closing the evaluator shuts the executor down, so an executor
 * must not be shared between evaluators.
 */
public final class ConcurrentEvaluator<T> implements Evaluator<T>, AutoCloseable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final Function<Genotype<T>, Double> fitnessFunction;
  private final ExecutorService executor;
  private final int chunks;

  public ConcurrentEvaluator(
      Function<Genotype<T>, Double> fitnessFunction, ExecutorService executor, int chunks) {
    checkArgument(chunks > 0, "Chunk count (%s) must be positive", chunks);
    this.fitnessFunction = fitnessFunction;
    this.executor = executor;
    this.chunks = chunks;
  }

  @Override
  public EvolutionState<T> evaluate(EvolutionState<T> state, boolean force) {
    Population<T> population = state.population();
    ImmutableList<Integer> pending =
        IntStream.range(0, population.size())
            .filter(i -> force || !population.get(i).isEvaluated())
            .boxed()
            .collect(toImmutableList());
    if (pending.isEmpty()) {
      return state;
    }

    int chunkSize = IntMath.divide(pending.size(), chunks, RoundingMode.CEILING);
    List<List<Integer>> partitions = Lists.partition(pending, chunkSize);
    List<Future<ImmutableList<Double>>> futures = new ArrayList<>(partitions.size());
    for (List<Integer> partition : partitions) {
      futures.add(
          executor.submit(
              () ->
                  partition.stream()
                      .map(i -> score(population.get(i).genotype()))
                      .collect(toImmutableList())));
    }
    logger.atFine().log(
        "Evaluating %d individuals in %d chunks", pending.size(), partitions.size());

    List<Individual<T>> evaluated = new ArrayList<>(population.individuals());
    for (int chunk = 0; chunk < partitions.size(); chunk++) {
      ImmutableList<Double> fitness = await(futures, chunk);
      List<Integer> indices = partitions.get(chunk);
      for (int j = 0; j < indices.size(); j++) {
        int index = indices.get(j);
        evaluated.set(index, evaluated.get(index).withFitness(fitness.get(j)));
      }
    }
    return state.withPopulation(Population.of(evaluated));
  }

  private double score(Genotype<T> genotype) {
    Double fitness = fitnessFunction.apply(genotype);
    checkState(fitness != null, "Fitness function returned null for %s", genotype);
    return fitness;
  }

  private static ImmutableList<Double> await(
      List<Future<ImmutableList<Double>>> futures, int chunk) {
    try {
      return futures.get(chunk).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(future -> future.cancel(true));
      throw new IllegalStateException("Interrupted while evaluating fitness", e);
    } catch (ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Fitness evaluation failed", cause);
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.atWarning().log("Evaluator executor did not terminate in time");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atWarning().withCause(e).log("Interrupted while waiting for evaluator shutdown");
      executor.shutdownNow();
    }
  }
}
