package io.intellixity.mapflow.phase;

import io.intellixity.mapflow.query.QueryTerm;

import java.util.Objects;

/**
 * Where a phase runs, plus the concrete term the executor receives.\n
 *
 * For stored scripting sources the term has already been rebuilt with the fetched source text.\n
 */
public record ExecutionTarget(Runtime runtime, QueryTerm term) {
  public enum Runtime {
    /** Runs in-process (module functions, inline functions, locally compiled source, links). */
    NATIVE,

    /** Runs in the external scripting runtime. */
    SCRIPTING
  }

  public ExecutionTarget {
    Objects.requireNonNull(runtime, "runtime");
    Objects.requireNonNull(term, "term");
  }

  public static ExecutionTarget nativeLocal(QueryTerm term) {
    return new ExecutionTarget(Runtime.NATIVE, term);
  }

  public static ExecutionTarget scripting(QueryTerm term) {
    return new ExecutionTarget(Runtime.SCRIPTING, term);
  }
}
