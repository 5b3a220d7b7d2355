package io.intellixity.mapflow.phase;

import io.intellixity.mapflow.query.PhaseKind;

/** Phase-actor type that runs a phase. Link phases run on the map executor. */
public enum ExecutorKind {
  MAP_EXECUTOR,
  REDUCE_EXECUTOR;

  public static ExecutorKind forPhase(PhaseKind kind) {
    return switch (kind) {
      case LINK, MAP -> MAP_EXECUTOR;
      case REDUCE -> REDUCE_EXECUTOR;
    };
  }
}
