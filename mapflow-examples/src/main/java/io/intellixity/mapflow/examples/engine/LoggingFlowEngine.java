package io.intellixity.mapflow.examples.engine;

import io.intellixity.mapflow.exec.FlowEngine;
import io.intellixity.mapflow.exec.FlowHandle;
import io.intellixity.mapflow.exec.ResultSink;
import io.intellixity.mapflow.exec.ResultTransformer;
import io.intellixity.mapflow.phase.PhaseDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Flow engine for the examples app: accepts flows, assigns ids and logs the phase plan.\n
 *
 * It does not schedule anything; plug a real engine in through {@link FlowEngine}.\n
 */
public final class LoggingFlowEngine implements FlowEngine {
  private static final Logger log = LoggerFactory.getLogger(LoggingFlowEngine.class);

  private final AtomicLong sequence = new AtomicLong();

  @Override
  public FlowHandle newFlow(String node,
                            ResultSink client,
                            String requestId,
                            List<PhaseDefinition> phases,
                            ResultTransformer transformer,
                            long effectiveTimeoutMillis) {
    String flowId = node + "-" + sequence.incrementAndGet();
    log.info("Accepted flow {} for request {}: {} phases, timeout {}ms", flowId, requestId, phases.size(), effectiveTimeoutMillis);
    for (int i = 0; i < phases.size(); i++) {
      PhaseDefinition p = phases.get(i);
      log.info("  phase {}: {} {} {} {}", i + 1, p.executor(), p.behaviors(), p.target().runtime(), p.target().term().kind());
    }
    return new FlowHandle(flowId, node, requestId);
  }
}
