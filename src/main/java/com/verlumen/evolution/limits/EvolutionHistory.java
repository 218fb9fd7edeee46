package com.verlumen.evolution.limits;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.ranking.Ranker;
import java.time.Duration;
import java.util.Optional;

/**
 * Read-only snapshot of an evolution's progress, handed to every {@link Limit} after each
 * generation. Only the most recent generation's record is kept.
 */
@AutoValue
public abstract class EvolutionHistory {
  public static EvolutionHistory empty() {
    return create(Optional.empty(), 0, Duration.ZERO);
  }

  public static EvolutionHistory create(
      Optional<GenerationRecord> last, int completedGenerations, Duration elapsed) {
    checkArgument(
        completedGenerations >= 0,
        "Completed generations (%s) must not be negative",
        completedGenerations);
    checkArgument(
        last.isPresent() == (completedGenerations > 0),
        "A last record is required exactly when generations have completed");
    return new AutoValue_EvolutionHistory(last, completedGenerations, elapsed);
  }

  /** Record of the most recently completed generation, if any. */
  public abstract Optional<GenerationRecord> last();

  /** Number of generations recorded so far. */
  public abstract int completedGenerations();

  /** Time spent evolving so far. */
  public abstract Duration elapsed();

  /** Steady count of the most recent generation, or zero before the first one completes. */
  public int steadyGenerations() {
    return last().map(GenerationRecord::steady).orElse(0);
  }

  /** Returns this history with {@code elapsed} replaced. */
  public EvolutionHistory withElapsed(Duration elapsed) {
    return create(last(), completedGenerations(), elapsed);
  }

  /**
   * Returns a history extended with one more generation. The steady count grows by one unless
   * {@code bestFitness} is strictly better than the previous generation's best under {@code
   * ranker}, in which case it resets to zero.
   */
  public EvolutionHistory append(
      int generation, double bestFitness, Ranker ranker, Duration elapsed) {
    int steady =
        last()
            .map(
                previous ->
                    ranker.compareFitness(bestFitness, previous.bestFitness()) > 0
                        ? 0
                        : previous.steady() + 1)
            .orElse(0);
    return create(
        Optional.of(GenerationRecord.create(generation, bestFitness, steady)),
        completedGenerations() + 1,
        elapsed);
  }
}
