package io.intellixity.mapflow.engine.exec;

import io.intellixity.mapflow.exec.FlowHandle;
import io.intellixity.mapflow.query.QueryTerm;

import java.util.Objects;

/** Outcome of {@link QueryDriver#start}: a started flow, or the term that made the query invalid. */
public sealed interface StartResult {

  record Started(FlowHandle flow) implements StartResult {
    public Started {
      Objects.requireNonNull(flow, "flow");
    }
  }

  /** No flow was created. */
  record BadQueryTerm(QueryTerm term) implements StartResult {}
}
