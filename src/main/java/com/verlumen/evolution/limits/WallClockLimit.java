package com.verlumen.evolution.limits;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.EvolutionState;
import java.time.Duration;

/** Stops evolution once the time spent evolving reaches a bound. */
public final class WallClockLimit implements Limit {
  private final Duration maxDuration;

  public WallClockLimit(Duration maxDuration) {
    checkArgument(
        !maxDuration.isNegative() && !maxDuration.isZero(),
        "Maximum duration (%s) must be positive",
        maxDuration);
    this.maxDuration = maxDuration;
  }

  public Duration maxDuration() {
    return maxDuration;
  }

  @Override
  public boolean shouldTerminate(EvolutionState<?> state, EvolutionHistory history) {
    return history.elapsed().compareTo(maxDuration) >= 0;
  }

  @Override
  public String toString() {
    return "WallClockLimit(maxDuration=" + maxDuration + ")";
  }
}
