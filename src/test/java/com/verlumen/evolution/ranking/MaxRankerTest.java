package com.verlumen.evolution.ranking;

import static com.google.common.truth.Truth.assertThat;
import static com.verlumen.evolution.PopulationFixtures.withFitness;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MaxRankerTest {
  private final MaxRanker ranker = new MaxRanker();

  @Test
  public void compareFitness_higherIsBetter() {
    assertThat(ranker.compareFitness(2.0, 1.0)).isEqualTo(1);
    assertThat(ranker.compareFitness(1.0, 2.0)).isEqualTo(-1);
  }

  @Test
  public void fitnessTransform_isIdentity() {
    assertThat(ranker.fitnessTransform(ImmutableList.of(1.0, -2.0, 3.0)))
        .containsExactly(1.0, -2.0, 3.0)
        .inOrder();
  }

  @Test
  public void best_returnsHighestFitness() {
    assertThat(ranker.best(withFitness(1.0, 9.0, 4.0)).fitness()).isEqualTo(9.0);
  }
}
