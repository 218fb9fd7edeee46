package com.verlumen.evolution.alteration;

import static com.google.common.truth.Truth.assertThat;
import static com.verlumen.evolution.PopulationFixtures.genotype;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.EvolutionState;
import com.verlumen.evolution.genetic.Genotype;
import com.verlumen.evolution.genetic.Individual;
import com.verlumen.evolution.genetic.LinearChromosome;
import com.verlumen.evolution.genetic.Population;
import com.verlumen.evolution.genetic.genes.BooleanGene;
import com.verlumen.evolution.ranking.MaxRanker;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MutatorTest {
  @SafeVarargs
  private static EvolutionState<Integer> evaluatedState(Genotype<Integer>... genotypes) {
    ImmutableList.Builder<Individual<Integer>> individuals = ImmutableList.builder();
    for (Genotype<Integer> genotype : genotypes) {
      individuals.add(Individual.of(genotype, 1.0));
    }
    return EvolutionState.of(3, new MaxRanker(), Population.of(individuals.build()));
  }

  @Test
  public void constructor_withRateOutsideUnitInterval_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> new RandomMutator<Integer>(1.5, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> new RandomMutator<Integer>(1, -0.1, 1));
    assertThrows(IllegalArgumentException.class, () -> new RandomMutator<Integer>(1, 1, 2));
  }

  @Test
  public void apply_withDifferentOutputSize_throwsIllegalArgumentException() {
    EvolutionState<Integer> state = evaluatedState(genotype(1), genotype(2));

    assertThrows(
        IllegalArgumentException.class,
        () -> new RandomMutator<Integer>(1, 1, 1).apply(state, 3, new Random()));
  }

  @Test
  public void apply_withZeroIndividualRate_returnsSameState() {
    EvolutionState<Integer> state = evaluatedState(genotype(1), genotype(2));

    assertThat(new RandomMutator<Integer>(0, 1, 1).apply(state, 2, new Random()))
        .isSameInstanceAs(state);
  }

  @Test
  public void apply_withZeroGeneRate_keepsEveryIndividual() {
    EvolutionState<Integer> state = evaluatedState(genotype(1, 2, 3), genotype(4, 5, 6));

    EvolutionState<Integer> mutated =
        new RandomMutator<Integer>(1, 1, 0).apply(state, 2, new Random(3));

    for (int i = 0; i < 2; i++) {
      assertThat(mutated.population().get(i)).isSameInstanceAs(state.population().get(i));
    }
  }

  @Test
  public void apply_mutatedIndividualsAreUnevaluatedAndValid() {
    EvolutionState<Integer> state = evaluatedState(genotype(1, 2, 3, 4, 5, 6, 7, 8));

    EvolutionState<Integer> mutated =
        new RandomMutator<Integer>(1, 1, 1).apply(state, 1, new Random(9));

    Individual<Integer> individual = mutated.population().get(0);
    assertThat(individual.isEvaluated()).isFalse();
    assertThat(individual.genotype().verify()).isTrue();
    assertThat(mutated.generation()).isEqualTo(3);
  }

  @Test
  public void bitFlipMutator_flipsEveryBitWhenAllRatesAreOne() {
    Genotype<Boolean> genotype =
        Genotype.<Boolean>of(
            LinearChromosome.<Boolean>of(BooleanGene.TRUE, BooleanGene.FALSE, BooleanGene.TRUE));
    EvolutionState<Boolean> state =
        EvolutionState.of(0, new MaxRanker(), Population.of(Individual.of(genotype, 0.0)));

    EvolutionState<Boolean> mutated =
        new BitFlipMutator(1, 1, 1).apply(state, 1, new Random(1));

    assertThat(mutated.population().get(0).genotype().flatten())
        .containsExactly(false, true, false)
        .inOrder();
  }

  @Test
  public void swapMutator_preservesGeneMultiset() {
    EvolutionState<Integer> state = evaluatedState(genotype(0, 1, 2, 3, 4, 5, 6, 7, 8, 9));

    EvolutionState<Integer> mutated =
        new SwapMutator<Integer>(1, 1, 0.5).apply(state, 1, new Random(12));

    assertThat(mutated.population().get(0).genotype().flatten())
        .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
  }

  @Test
  public void inversionMutator_reversesOneContiguousSegment() {
    Random random = new Random(4);
    for (int trial = 0; trial < 50; trial++) {
      EvolutionState<Integer> state = evaluatedState(genotype(0, 1, 2, 3, 4, 5, 6, 7));

      ImmutableList<Integer> values =
          new InversionMutator<Integer>(1, 1)
              .apply(state, 1, random)
              .population()
              .get(0)
              .genotype()
              .flatten();

      int start = 0;
      while (start < values.size() && values.get(start) == start) {
        start++;
      }
      int end = values.size() - 1;
      while (end > start && values.get(end) == end) {
        end--;
      }
      for (int i = start; i <= end; i++) {
        assertThat(values.get(i)).isEqualTo(start + end - i);
      }
    }
  }

  @Test
  public void inversionMutator_leavesSingleGeneChromosomeUntouched() {
    EvolutionState<Integer> state = evaluatedState(genotype(5));

    EvolutionState<Integer> mutated =
        new InversionMutator<Integer>(1, 1).apply(state, 1, new Random(1));

    assertThat(mutated.population().get(0)).isSameInstanceAs(state.population().get(0));
  }

  @Test
  public void partialShuffleMutator_keepsPermutationAndEventuallyReorders() {
    Random random = new Random(8);
    boolean reordered = false;
    for (int trial = 0; trial < 50; trial++) {
      EvolutionState<Integer> state = evaluatedState(genotype(0, 1, 2, 3, 4, 5, 6, 7, 8, 9));

      ImmutableList<Integer> values =
          new PartialShuffleMutator<Integer>()
              .apply(state, 1, random)
              .population()
              .get(0)
              .genotype()
              .flatten();

      assertThat(values).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
      reordered |= !values.equals(ImmutableList.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9));
    }
    assertThat(reordered).isTrue();
  }

  @Test
  public void partialShuffleMutator_withZeroBoundaryProbability_keepsIndividual() {
    EvolutionState<Integer> state = evaluatedState(genotype(0, 1, 2, 3));

    EvolutionState<Integer> mutated =
        new PartialShuffleMutator<Integer>(1, 1, 0).apply(state, 1, new Random(2));

    assertThat(mutated.population().get(0)).isSameInstanceAs(state.population().get(0));
  }

  @Test
  public void partialShuffleMutator_withInvalidBoundary_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class, () -> new PartialShuffleMutator<Integer>(1, 1, 1.5));
  }
}
