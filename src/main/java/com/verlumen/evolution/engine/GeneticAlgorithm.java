package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.flogger.FluentLogger;
import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.alteration.Alterer;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.limits.EvolutionHistory;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Generational genetic algorithm.
 *
 * <p>Each generation evaluates the population, selects {@code floor((1 - r) * N)} parents and
 * {@code ceil(r * N)} survivors from it, alters the parents into offspring and merges survivors
 * with offspring, so every generation holds exactly {@code N} individuals.
 */
public final class GeneticAlgorithm<T> implements EvolutionEngine<T> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EngineConfig<T> config;
  private final int parentCount;
  private final int survivorCount;

  private GeneticAlgorithm(EngineConfig<T> config) {
    this.config = config;
    this.parentCount = parentCount(config.populationSize(), config.survivalRate());
    this.survivorCount = survivorCount(config.populationSize(), config.survivalRate());
  }

  public static <T> GeneticAlgorithm<T> create(EngineConfig<T> config) {
    return new GeneticAlgorithm<T>(config);
  }

  public EngineConfig<T> config() {
    return config;
  }

  @Override
  public EvolutionState<T> evolve() {
    return evolve(EvolutionState.empty(config.ranker()));
  }

  /**
   * Runs at least one generation, then keeps iterating until any configured limit is satisfied.
   *
   * @throws IllegalArgumentException if no limit is configured
   */
  @Override
  public EvolutionState<T> evolve(EvolutionState<T> start) {
    checkArgument(!config.limits().isEmpty(), "At least one limit is required to stop evolution");
    logger.atInfo().log(
        "Starting evolution at generation %d: population size %d, survival rate %s, limits %s",
        start.generation(), config.populationSize(), config.survivalRate(), config.limits());
    notifyListeners(listener -> listener.onEvolutionStart(start));

    Stopwatch stopwatch = Stopwatch.createStarted(config.ticker());
    EvolutionHistory history = EvolutionHistory.empty();
    EvolutionState<T> state = start;
    do {
      state = iterate(state);
      double bestFitness = state.ranker().best(state.population()).fitness();
      history =
          history.append(state.generation(), bestFitness, state.ranker(), stopwatch.elapsed());
    } while (!shouldTerminate(state, history));

    EvolutionState<T> result = state;
    logger.atInfo().log(
        "Evolution stopped at generation %d after %s with best fitness %s",
        result.generation(),
        history.elapsed(),
        history.last().get().bestFitness());
    notifyListeners(listener -> listener.onEvolutionEnd(result));
    return result;
  }

  @Override
  public EvolutionState<T> iterate(EvolutionState<T> state) {
    notifyListeners(listener -> listener.onGenerationStart(state));
    EvolutionState<T> intercepted = config.interceptor().applyBefore(state);
    EvolutionState<T> evaluated = evaluate(startOrContinue(intercepted));
    EvolutionState<T> parents = selectParents(evaluated);
    EvolutionState<T> survivors = selectSurvivors(evaluated);
    EvolutionState<T> offspring = alter(parents);

    Population<T> merged = survivors.population().concat(offspring.population());
    checkState(
        merged.size() == config.populationSize(),
        "Merged population holds %s individuals instead of %s",
        merged.size(),
        config.populationSize());
    EvolutionState<T> next =
        config.interceptor().applyAfter(evaluate(evaluated.withPopulation(merged)));
    EvolutionState<T> advanced = next.withGeneration(next.generation() + 1);
    logger.atFine().log(
        "Completed generation %d: %d survivors, %d offspring",
        advanced.generation(), survivors.population().size(), offspring.population().size());
    notifyListeners(listener -> listener.onGenerationEnd(advanced));
    return advanced;
  }

  private EvolutionState<T> startOrContinue(EvolutionState<T> state) {
    if (!state.isEmpty()) {
      return state;
    }
    notifyListeners(listener -> listener.onInitializationStart(state));
    EvolutionState<T> initialized =
        state.withPopulation(
            Population.of(
                Stream.generate(() -> Individual.unevaluated(config.genotypeFactory().create()))
                    .limit(config.populationSize())
                    .collect(toImmutableList())));
    logger.atFine().log("Initialized a population of %d", config.populationSize());
    notifyListeners(listener -> listener.onInitializationEnd(initialized));
    return initialized;
  }

  private EvolutionState<T> evaluate(EvolutionState<T> state) {
    checkState(
        state.population().size() == config.populationSize(),
        "Population holds %s individuals before evaluation instead of %s",
        state.population().size(),
        config.populationSize());
    notifyListeners(listener -> listener.onEvaluationStart(state));
    EvolutionState<T> evaluated = config.evaluator().evaluate(state);
    checkState(
        evaluated.population().size() == config.populationSize(),
        "Population holds %s individuals after evaluation instead of %s",
        evaluated.population().size(),
        config.populationSize());
    checkState(
        evaluated.population().allEvaluated(),
        "Evaluation left individuals without a fitness value");
    notifyListeners(listener -> listener.onEvaluationEnd(evaluated));
    return evaluated;
  }

  private EvolutionState<T> selectParents(EvolutionState<T> state) {
    notifyListeners(listener -> listener.onParentSelectionStart(state));
    EvolutionState<T> parents = config.parentSelector().apply(state, parentCount, config.random());
    notifyListeners(listener -> listener.onParentSelectionEnd(parents));
    return parents;
  }

  private EvolutionState<T> selectSurvivors(EvolutionState<T> state) {
    notifyListeners(listener -> listener.onSurvivorSelectionStart(state));
    EvolutionState<T> survivors =
        config.survivorSelector().apply(state, survivorCount, config.random());
    notifyListeners(listener -> listener.onSurvivorSelectionEnd(survivors));
    return survivors;
  }

  private EvolutionState<T> alter(EvolutionState<T> parents) {
    notifyListeners(listener -> listener.onAlterationStart(parents));
    EvolutionState<T> altered = parents;
    for (Alterer<T> alterer : config.alterers()) {
      altered = alterer.apply(altered, parentCount, config.random());
      checkState(
          altered.population().size() == parentCount,
          "%s produced %s offspring instead of %s",
          alterer,
          altered.population().size(),
          parentCount);
    }
    EvolutionState<T> offspring = altered;
    notifyListeners(listener -> listener.onAlterationEnd(offspring));
    return offspring;
  }

  private boolean shouldTerminate(EvolutionState<T> state, EvolutionHistory history) {
    return config.limits().stream().anyMatch(limit -> limit.shouldTerminate(state, history));
  }

  private void notifyListeners(Consumer<EvolutionListener<T>> event) {
    config.listeners().forEach(event);
  }

  /** Number of parents altered into offspring each generation: {@code floor((1 - r) * N)}. */
  @VisibleForTesting
  static int parentCount(int populationSize, double survivalRate) {
    return (int) Math.floor(snap((1 - survivalRate) * populationSize));
  }

  /** Number of individuals surviving unaltered each generation: {@code ceil(r * N)}. */
  @VisibleForTesting
  static int survivorCount(int populationSize, double survivalRate) {
    return (int) Math.ceil(snap(survivalRate * populationSize));
  }

  private static double snap(double value) {
    double rounded = Math.rint(value);
    return Math.abs(value - rounded) < GAConstants.GROUP_SIZE_TOLERANCE ? rounded : value;
  }
}
