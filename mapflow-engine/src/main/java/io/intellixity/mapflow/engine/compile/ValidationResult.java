package io.intellixity.mapflow.engine.compile;

import io.intellixity.mapflow.phase.PhaseDefinition;
import io.intellixity.mapflow.query.QueryTerm;

import java.util.List;

/** Outcome of query validation: every phase, or the one term that was rejected. */
public sealed interface ValidationResult {

  /** All terms were accepted; phases are in query order. */
  record Valid(List<PhaseDefinition> phases) implements ValidationResult {
    public Valid {
      phases = List.copyOf(phases);
    }
  }

  /** The rejected term exactly as submitted (null when the query held a null entry). */
  record Invalid(QueryTerm badTerm) implements ValidationResult {}

  static ValidationResult valid(List<PhaseDefinition> phases) {
    return new Valid(phases);
  }

  static ValidationResult invalid(QueryTerm badTerm) {
    return new Invalid(badTerm);
  }
}
