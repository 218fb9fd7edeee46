package com.verlumen.evolution.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.PopulationFixtures;
import com.verlumen.evolution.alteration.RandomMutator;
import com.verlumen.evolution.alteration.SinglePointCrossover;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.LinearChromosome;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.genetic.genes.IntegerGene;
import com.verlumen.evolution.genetic.specs.ChromosomeSpec;
import com.verlumen.evolution.genetic.specs.SpecGenotypeFactory;
import com.verlumen.evolution.limits.GenerationLimit;
import com.verlumen.evolution.limits.SteadyGenerationsLimit;
import com.verlumen.evolution.limits.TargetFitnessLimit;
import com.verlumen.evolution.limits.WallClockLimit;
import com.verlumen.evolution.ranking.MaxRanker;
import com.verlumen.evolution.ranking.MinRanker;
import com.verlumen.evolution.selection.RouletteWheelSelector;
import com.verlumen.evolution.selection.TournamentSelector;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class GeneticAlgorithmTest {
  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  @Mock private EvolutionListener<Integer> mockListener;

  /** Creates genotypes holding 0, 1, 2, ... 9, 0, 1, ... in turn. */
  private static EngineConfig.Builder<Integer> digitsConfig() {
    AtomicInteger next = new AtomicInteger();
    return EngineConfig.<Integer>builder()
        .setGenotypeFactory(
            () ->
                Genotype.<Integer>of(
                    LinearChromosome.<Integer>of(
                        IntegerGene.create(next.getAndIncrement() % 10, 0, 9))))
        .setFitnessFunction(PopulationFixtures::firstGene)
        .setPopulationSize(10)
        .setSurvivalRate(0.4)
        .setParentSelector(new TournamentSelector(2))
        .setSurvivorSelector(new TournamentSelector(2))
        .setRanker(new MaxRanker())
        .setRandom(new Random(42));
  }

  private static EngineConfig.Builder<Integer> specConfig(long seed) {
    Random random = new Random(seed);
    return EngineConfig.<Integer>builder()
        .setGenotypeFactory(
            SpecGenotypeFactory.create(
                ImmutableList.of(ChromosomeSpec.ofInteger(0, 50, 6)), random))
        .setFitnessFunction(
            genotype -> genotype.flatten().stream().mapToDouble(Integer::doubleValue).sum())
        .setPopulationSize(20)
        .addAlterer(new RandomMutator<>(0.3, 1.0, 0.2))
        .addAlterer(new SinglePointCrossover<>())
        .setRandom(random);
  }

  @Test
  public void iterate_fromEmptyState_keepsSizeAndFitnessWithinDigits() {
    GeneticAlgorithm<Integer> algorithm = GeneticAlgorithm.create(digitsConfig().build());

    EvolutionState<Integer> next = algorithm.iterate(EvolutionState.empty(new MaxRanker()));

    assertThat(next.generation()).isEqualTo(1);
    assertThat(next.population().size()).isEqualTo(10);
    for (Individual<Integer> individual : next.population()) {
      assertThat(individual.fitness()).isIn(Range.closed(0.0, 9.0));
      assertThat(individual.fitness() % 1).isEqualTo(0.0);
    }
  }

  @Test
  public void iterate_keepsPopulationSizeForManyConfigurations() {
    for (long seed = 0; seed < 20; seed++) {
      double survivalRate = new Random(seed).nextDouble();
      GeneticAlgorithm<Integer> algorithm =
          GeneticAlgorithm.create(
              specConfig(seed)
                  .setSurvivalRate(survivalRate)
                  .setParentSelector(new RouletteWheelSelector())
                  .build());

      EvolutionState<Integer> state = EvolutionState.empty(new MaxRanker());
      for (int generation = 0; generation < 5; generation++) {
        state = algorithm.iterate(state);
        assertThat(state.population().size()).isEqualTo(20);
        assertThat(state.population().allEvaluated()).isTrue();
      }
    }
  }

  @Test
  public void iterate_resumesFromGivenPopulationWithoutInitializing() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            digitsConfig().setPopulationSize(3).addListener(mockListener).build());
    EvolutionState<Integer> start =
        EvolutionState.of(7, new MaxRanker(), PopulationFixtures.unevaluated(4, 5, 6));

    EvolutionState<Integer> next = algorithm.iterate(start);

    assertThat(next.generation()).isEqualTo(8);
    verify(mockListener, times(0)).onInitializationStart(any());
    verify(mockListener, times(0)).onInitializationEnd(any());
  }

  @Test
  public void iterate_withWrongSizedStartingPopulation_throwsIllegalStateException() {
    GeneticAlgorithm<Integer> algorithm = GeneticAlgorithm.create(digitsConfig().build());
    EvolutionState<Integer> start =
        EvolutionState.of(0, new MaxRanker(), PopulationFixtures.unevaluated(1, 2));

    assertThrows(IllegalStateException.class, () -> algorithm.iterate(start));
  }

  @Test
  public void iterate_evaluatorDroppingIndividuals_throwsIllegalStateException() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            digitsConfig()
                .setEvaluator(
                    (state, force) ->
                        state.withPopulation(
                            Population.of(state.population().individuals().subList(0, 5))))
                .build());

    assertThrows(
        IllegalStateException.class,
        () -> algorithm.iterate(EvolutionState.empty(new MaxRanker())));
  }

  @Test
  public void iterate_fitnessFunctionReturningNaN_throwsIllegalStateException() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(digitsConfig().setFitnessFunction(genotype -> Double.NaN).build());

    assertThrows(
        IllegalStateException.class,
        () -> algorithm.iterate(EvolutionState.empty(new MaxRanker())));
  }

  @Test
  public void iterate_altererChangingSize_throwsIllegalStateException() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            digitsConfig()
                .addAlterer(
                    (state, outputSize, random) ->
                        state.withPopulation(state.population().concat(state.population())))
                .build());

    assertThrows(
        IllegalStateException.class,
        () -> algorithm.iterate(EvolutionState.empty(new MaxRanker())));
  }

  @Test
  public void iterate_appliesInterceptorsAroundTheGeneration() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            digitsConfig()
                .setInterceptor(
                    EvolutionInterceptor.of(
                        state -> state.withGeneration(100),
                        state -> state.withGeneration(state.generation() * 2)))
                .build());

    EvolutionState<Integer> next = algorithm.iterate(EvolutionState.empty(new MaxRanker()));

    assertThat(next.generation()).isEqualTo(201);
  }

  @Test
  public void iterate_notifiesListenersInPipelineOrder() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(digitsConfig().addListener(mockListener).build());

    algorithm.iterate(EvolutionState.empty(new MaxRanker()));

    InOrder inOrder = inOrder(mockListener);
    inOrder.verify(mockListener).onGenerationStart(any());
    inOrder.verify(mockListener).onInitializationStart(any());
    inOrder.verify(mockListener).onInitializationEnd(any());
    inOrder.verify(mockListener).onEvaluationStart(any());
    inOrder.verify(mockListener).onEvaluationEnd(any());
    inOrder.verify(mockListener).onParentSelectionStart(any());
    inOrder.verify(mockListener).onParentSelectionEnd(any());
    inOrder.verify(mockListener).onSurvivorSelectionStart(any());
    inOrder.verify(mockListener).onSurvivorSelectionEnd(any());
    inOrder.verify(mockListener).onAlterationStart(any());
    inOrder.verify(mockListener).onAlterationEnd(any());
    inOrder.verify(mockListener).onEvaluationStart(any());
    inOrder.verify(mockListener).onEvaluationEnd(any());
    inOrder.verify(mockListener).onGenerationEnd(any());
    verifyNoMoreInteractions(mockListener);
  }

  @Test
  public void evolve_withoutLimits_throwsIllegalArgumentException() {
    GeneticAlgorithm<Integer> algorithm = GeneticAlgorithm.create(digitsConfig().build());

    assertThrows(IllegalArgumentException.class, algorithm::evolve);
  }

  @Test
  public void evolve_stopsAtGenerationLimit() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            specConfig(5).addLimit(new GenerationLimit(12)).addListener(mockListener).build());

    EvolutionState<Integer> result = algorithm.evolve();

    assertThat(result.generation()).isEqualTo(12);
    assertThat(result.population().size()).isEqualTo(20);
    verify(mockListener).onEvolutionStart(any());
    verify(mockListener).onEvolutionEnd(result);
    verify(mockListener, times(12)).onGenerationEnd(any());
  }

  @Test
  public void evolve_runsAtLeastOneGeneration() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(specConfig(5).addLimit((state, history) -> true).build());

    assertThat(algorithm.evolve().generation()).isEqualTo(1);
  }

  @Test
  public void evolve_resumesFromGivenState() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(specConfig(9).addLimit(new GenerationLimit(8)).build());
    EvolutionState<Integer> halfway =
        GeneticAlgorithm.create(specConfig(9).addLimit(new GenerationLimit(4)).build()).evolve();

    EvolutionState<Integer> result = algorithm.evolve(halfway);

    assertThat(result.generation()).isEqualTo(8);
  }

  @Test
  public void evolve_improvesTowardsTargetFitness() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            specConfig(3)
                .addLimit(TargetFitnessLimit.atLeast(270))
                .addLimit(new GenerationLimit(500))
                .build());

    EvolutionState<Integer> result = algorithm.evolve();

    assertThat(new MaxRanker().best(result.population()).fitness()).isAtLeast(270.0);
    assertThat(result.generation()).isLessThan(500);
  }

  @Test
  public void evolve_withMinRanker_minimizes() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            specConfig(4)
                .setRanker(new MinRanker())
                .addLimit(TargetFitnessLimit.atMost(30))
                .addLimit(new GenerationLimit(500))
                .build());

    EvolutionState<Integer> result = algorithm.evolve();

    assertThat(new MinRanker().best(result.population()).fitness()).isAtMost(30.0);
  }

  @Test
  public void evolve_stopsAfterSteadyGenerations() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            digitsConfig()
                .addLimit(new SteadyGenerationsLimit(3))
                .addLimit(new GenerationLimit(1_000))
                .build());

    EvolutionState<Integer> result = algorithm.evolve();

    assertThat(result.generation()).isLessThan(1_000);
  }

  @Test
  public void evolve_stopsAtWallClockLimit() {
    GeneticAlgorithm<Integer> algorithm =
        GeneticAlgorithm.create(
            specConfig(1)
                .setTicker(new SteppingTicker(TimeUnit.SECONDS.toNanos(1)))
                .addLimit(new WallClockLimit(Duration.ofSeconds(5)))
                .build());

    EvolutionState<Integer> result = algorithm.evolve();

    assertThat(result.generation()).isEqualTo(5);
  }

  /** Advances by a fixed step every time it is read. */
  private static final class SteppingTicker extends Ticker {
    private final long stepNanos;
    private long nanos;

    SteppingTicker(long stepNanos) {
      this.stepNanos = stepNanos;
    }

    @Override
    public long read() {
      long current = nanos;
      nanos += stepNanos;
      return current;
    }
  }
}
