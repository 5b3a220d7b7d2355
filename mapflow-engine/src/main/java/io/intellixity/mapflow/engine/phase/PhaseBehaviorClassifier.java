package io.intellixity.mapflow.engine.phase;

import io.intellixity.mapflow.phase.BehaviorFlag;
import io.intellixity.mapflow.query.PhaseKind;

import java.util.List;
import java.util.Objects;

/**
 * Derives the execution behaviors of a phase from its kind and accumulate flag.\n
 *
 * | kind        | accumulate | behaviors               |\n
 * |-------------|------------|-------------------------|\n
 * | link / map  | true       | [accumulate]            |\n
 * | link / map  | false      | []                      |\n
 * | reduce      | true       | [accumulate, converge(2)] |\n
 * | reduce      | false      | [converge(2)]           |\n
 */
public final class PhaseBehaviorClassifier {
  /** Reduce phases merge the outputs of all upstream producers pairwise. */
  public static final int REDUCE_CONVERGE_ARITY = 2;

  private static final BehaviorFlag REDUCE_CONVERGE = BehaviorFlag.converge(REDUCE_CONVERGE_ARITY);

  private static final List<BehaviorFlag> NONE = List.of();
  private static final List<BehaviorFlag> ACCUMULATE_ONLY = List.of(BehaviorFlag.ACCUMULATE);
  private static final List<BehaviorFlag> REDUCE_ACCUMULATE = List.of(BehaviorFlag.ACCUMULATE, REDUCE_CONVERGE);
  private static final List<BehaviorFlag> REDUCE_ONLY = List.of(REDUCE_CONVERGE);

  public List<BehaviorFlag> classify(PhaseKind kind, boolean accumulate) {
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case LINK, MAP -> accumulate ? ACCUMULATE_ONLY : NONE;
      case REDUCE -> accumulate ? REDUCE_ACCUMULATE : REDUCE_ONLY;
    };
  }
}
