package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.verlumen.evolution.EvolutionState;
import java.util.function.UnaryOperator;

/** Hooks transforming the state at the start and at the end of every generation. */
@AutoValue
public abstract class EvolutionInterceptor<T> {
  public static <T> EvolutionInterceptor<T> identity() {
    return of(UnaryOperator.identity(), UnaryOperator.identity());
  }

  public static <T> EvolutionInterceptor<T> before(UnaryOperator<EvolutionState<T>> before) {
    return of(before, UnaryOperator.identity());
  }

  public static <T> EvolutionInterceptor<T> after(UnaryOperator<EvolutionState<T>> after) {
    return of(UnaryOperator.identity(), after);
  }

  public static <T> EvolutionInterceptor<T> of(
      UnaryOperator<EvolutionState<T>> before, UnaryOperator<EvolutionState<T>> after) {
    return new AutoValue_EvolutionInterceptor<T>(before, after);
  }

  abstract UnaryOperator<EvolutionState<T>> beforeHook();

  abstract UnaryOperator<EvolutionState<T>> afterHook();

  public EvolutionState<T> applyBefore(EvolutionState<T> state) {
    return beforeHook().apply(state);
  }

  public EvolutionState<T> applyAfter(EvolutionState<T> state) {
    return afterHook().apply(state);
  }
}
