package com.verlumen.evolution.engine;

import com.verlumen.evolution.EvolutionState;

/**
 * Observer notified at fixed points of the generational pipeline. Each phase hook receives the
 * state immediately before or after that phase. Every method does nothing by default.
 */
public interface EvolutionListener<T> {
  default void onEvolutionStart(EvolutionState<T> state) {}

  default void onEvolutionEnd(EvolutionState<T> state) {}

  default void onGenerationStart(EvolutionState<T> state) {}

  default void onGenerationEnd(EvolutionState<T> state) {}

  default void onInitializationStart(EvolutionState<T> state) {}

  default void onInitializationEnd(EvolutionState<T> state) {}

  default void onEvaluationStart(EvolutionState<T> state) {}

  default void onEvaluationEnd(EvolutionState<T> state) {}

  default void onParentSelectionStart(EvolutionState<T> state) {}

  default void onParentSelectionEnd(EvolutionState<T> state) {}

  default void onSurvivorSelectionStart(EvolutionState<T> state) {}

  default void onSurvivorSelectionEnd(EvolutionState<T> state) {}

  default void onAlterationStart(EvolutionState<T> state) {}

  default void onAlterationEnd(EvolutionState<T> state) {}
}
