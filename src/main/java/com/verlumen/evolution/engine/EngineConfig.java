package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.alteration.Alterer;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.GenotypeFactory;
import com.verlumen.evolution.limits.Limit;
import com.verlumen.evolution.ranking.MaxRanker;
import com.verlumen.evolution.ranking.Ranker;
import com.verlumen.evolution.selection.Selector;
import com.verlumen.evolution.selection.TournamentSelector;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

/**
 * Immutable configuration of a {@link GeneticAlgorithm}.
 *
 * <p>Unless set explicitly, a configuration uses a population of 50, a survival rate of 0.4,
 * tournament selection of size 3 for parents and survivors, no alterers, a {@link MaxRanker}, a
 * {@link SequentialEvaluator} over the fitness function and an unseeded random source.
 */
@AutoValue
public abstract class EngineConfig<T> {
  public static <T> Builder<T> builder() {
    return new AutoValue_EngineConfig.Builder<T>()
        .setPopulationSize(GAConstants.DEFAULT_POPULATION_SIZE)
        .setSurvivalRate(GAConstants.DEFAULT_SURVIVAL_RATE)
        .setParentSelector(new TournamentSelector(GAConstants.TOURNAMENT_SIZE))
        .setSurvivorSelector(new TournamentSelector(GAConstants.TOURNAMENT_SIZE))
        .setRanker(new MaxRanker())
        .setInterceptor(EvolutionInterceptor.identity())
        .setRandom(new Random())
        .setTicker(Ticker.systemTicker());
  }

  public abstract GenotypeFactory<T> genotypeFactory();

  public abstract Function<Genotype<T>, Double> fitnessFunction();

  public abstract int populationSize();

  /** Share of the next generation taken from the current one without alteration. */
  public abstract double survivalRate();

  public abstract Selector parentSelector();

  public abstract Selector survivorSelector();

  /** Alterers applied to the parents, in order. */
  public abstract ImmutableList<Alterer<T>> alterers();

  /** Evolution stops as soon as any of these limits is satisfied. */
  public abstract ImmutableList<Limit> limits();

  public abstract Ranker ranker();

  public abstract ImmutableList<EvolutionListener<T>> listeners();

  public abstract Evaluator<T> evaluator();

  public abstract EvolutionInterceptor<T> interceptor();

  public abstract Random random();

  /** Time source for the elapsed time reported to limits. */
  public abstract Ticker ticker();

  public abstract Builder<T> toBuilder();

  /** Builder for {@link EngineConfig}. */
  @AutoValue.Builder
  public abstract static class Builder<T> {
    public abstract Builder<T> setGenotypeFactory(GenotypeFactory<T> genotypeFactory);

    public abstract Builder<T> setFitnessFunction(Function<Genotype<T>, Double> fitnessFunction);

    public abstract Builder<T> setPopulationSize(int populationSize);

    public abstract Builder<T> setSurvivalRate(double survivalRate);

    public abstract Builder<T> setParentSelector(Selector parentSelector);

    public abstract Builder<T> setSurvivorSelector(Selector survivorSelector);

    public abstract Builder<T> setRanker(Ranker ranker);

    public abstract Builder<T> setEvaluator(Evaluator<T> evaluator);

    public abstract Builder<T> setInterceptor(EvolutionInterceptor<T> interceptor);

    public abstract Builder<T> setRandom(Random random);

    public abstract Builder<T> setTicker(Ticker ticker);

    abstract ImmutableList.Builder<Alterer<T>> alterersBuilder();

    abstract ImmutableList.Builder<Limit> limitsBuilder();

    abstract ImmutableList.Builder<EvolutionListener<T>> listenersBuilder();

    abstract Optional<Function<Genotype<T>, Double>> fitnessFunction();

    abstract Optional<Evaluator<T>> evaluator();

    public Builder<T> addAlterer(Alterer<T> alterer) {
      alterersBuilder().add(alterer);
      return this;
    }

    public Builder<T> addLimit(Limit limit) {
      limitsBuilder().add(limit);
      return this;
    }

    public Builder<T> addListener(EvolutionListener<T> listener) {
      listenersBuilder().add(listener);
      return this;
    }

    abstract EngineConfig<T> autoBuild();

    /**
     * Builds the configuration, defaulting the evaluator to a {@link SequentialEvaluator} over the
     * fitness function.
     *
     * @throws IllegalArgumentException if the population size is not positive or the survival
     *     rate is outside [0, 1]
     * @throws IllegalStateException if the genotype factory or fitness function is missing
     */
    public EngineConfig<T> build() {
      if (!evaluator().isPresent()) {
        fitnessFunction().ifPresent(fitness -> setEvaluator(new SequentialEvaluator<T>(fitness)));
      }
      EngineConfig<T> config = autoBuild();
      checkArgument(
          config.populationSize() > 0,
          "Population size (%s) must be positive",
          config.populationSize());
      checkArgument(
          config.survivalRate() >= 0 && config.survivalRate() <= 1,
          "Survival rate (%s) must be within [0, 1]",
          config.survivalRate());
      return config;
    }
  }
}
