package com.verlumen.evolution.engine;

/** Default values used when an engine configuration leaves a setting unspecified. */
final class GAConstants {
  static final int DEFAULT_POPULATION_SIZE = 50;
  static final double DEFAULT_SURVIVAL_RATE = 0.4;
  static final int TOURNAMENT_SIZE = 3;

  /** Products closer than this to an integer are treated as that integer when sizing groups. */
  static final double GROUP_SIZE_TOLERANCE = 1e-9;

  private GAConstants() {}
}
