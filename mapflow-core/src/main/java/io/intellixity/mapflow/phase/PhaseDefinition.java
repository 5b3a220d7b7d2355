package io.intellixity.mapflow.phase;

import java.util.List;
import java.util.Objects;

/** A validated, ready-to-schedule phase. Owned by the flow engine once handed over. */
public record PhaseDefinition(ExecutorKind executor, List<BehaviorFlag> behaviors, ExecutionTarget target) {
  public PhaseDefinition {
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(target, "target");
    behaviors = List.copyOf(behaviors == null ? List.of() : behaviors);
  }
}
