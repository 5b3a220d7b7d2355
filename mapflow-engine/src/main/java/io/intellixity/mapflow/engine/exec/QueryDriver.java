package io.intellixity.mapflow.engine.exec;

import io.intellixity.mapflow.engine.compile.QuerySyntaxValidator;
import io.intellixity.mapflow.engine.compile.ValidationResult;
import io.intellixity.mapflow.exec.FlowEngine;
import io.intellixity.mapflow.exec.FlowHandle;
import io.intellixity.mapflow.exec.ResultSink;
import io.intellixity.mapflow.exec.ResultTransformer;
import io.intellixity.mapflow.phase.PhaseDefinition;
import io.intellixity.mapflow.query.MapReduceJob;
import io.intellixity.mapflow.query.QueryTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for running a map-reduce query.\n
 *
 * Validates the query, then hands the phases to the {@link FlowEngine} with the caller's timeout
 * stretched by {@link #TIMEOUT_BUFFER} so validation and setup do not eat into the flow's own
 * timeout. An invalid query never reaches the flow engine.\n
 */
public final class QueryDriver {
  private static final Logger log = LoggerFactory.getLogger(QueryDriver.class);

  public static final double TIMEOUT_BUFFER = 1.1;

  private final QuerySyntaxValidator validator;
  private final FlowEngine flows;

  public QueryDriver(QuerySyntaxValidator validator, FlowEngine flows) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.flows = Objects.requireNonNull(flows, "flows");
  }

  public StartResult start(String node,
                           ResultSink client,
                           String requestId,
                           List<QueryTerm> query,
                           ResultTransformer transformer,
                           long timeoutMillis) {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(query, "query");
    long effectiveTimeout = effectiveTimeout(timeoutMillis);

    ValidationResult validation = validator.validate(query);
    if (validation instanceof ValidationResult.Invalid bad) {
      log.info("Rejected map-reduce request {}: bad query term {}", requestId, bad.badTerm());
      return new StartResult.BadQueryTerm(bad.badTerm());
    }

    List<PhaseDefinition> phases = ((ValidationResult.Valid) validation).phases();
    log.debug("Starting flow for request {} on node {}: {} phases, timeout {}ms",
        requestId, node, phases.size(), effectiveTimeout);
    FlowHandle flow = flows.newFlow(
        node,
        client,
        requestId,
        phases,
        (transformer == null) ? ResultTransformer.identity() : transformer,
        effectiveTimeout
    );
    if (flow == null) throw new IllegalStateException("FlowEngine returned null for request " + requestId);
    return new StartResult.Started(flow);
  }

  /** Starts a submitted job, using {@code defaultTimeoutMillis} when the job carries none. */
  public StartResult start(String node,
                           ResultSink client,
                           String requestId,
                           MapReduceJob job,
                           ResultTransformer transformer,
                           long defaultTimeoutMillis) {
    Objects.requireNonNull(job, "job");
    return start(node, client, requestId, job.query(), transformer, job.timeoutOr(defaultTimeoutMillis));
  }

  /** {@code timeout * 1.1}, truncated. */
  public static long effectiveTimeout(long timeoutMillis) {
    if (timeoutMillis < 0) throw new IllegalArgumentException("timeoutMillis must be >= 0");
    return (long) (timeoutMillis * TIMEOUT_BUFFER);
  }
}
