package io.intellixity.mapflow.phase;

/**
 * Execution behavior of a phase, interpreted by the flow engine.\n
 *
 * - {@link Accumulate}: the phase's output is part of the final query result\n
 * - {@link Converge}: inputs from all upstream producers are merged before the phase runs\n
 */
public sealed interface BehaviorFlag {
  Accumulate ACCUMULATE = new Accumulate();

  final class Accumulate implements BehaviorFlag {
    private Accumulate() {}

    @Override public String toString() { return "accumulate"; }
  }

  record Converge(int arity) implements BehaviorFlag {
    public Converge {
      if (arity < 1) throw new IllegalArgumentException("arity must be >= 1");
    }

    @Override public String toString() { return "converge(" + arity + ")"; }
  }

  static BehaviorFlag converge(int arity) {
    return new Converge(arity);
  }
}
