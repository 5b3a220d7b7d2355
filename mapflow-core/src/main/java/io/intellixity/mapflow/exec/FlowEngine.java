package io.intellixity.mapflow.exec;

import io.intellixity.mapflow.phase.PhaseDefinition;

import java.util.List;

/**
 * SPI of the flow-execution engine that schedules and runs validated phases.
 * <p>
 * Implementations own all concurrency, fault handling and result aggregation for running phases.
 */
public interface FlowEngine {
  FlowHandle newFlow(String node,
                     ResultSink client,
                     String requestId,
                     List<PhaseDefinition> phases,
                     ResultTransformer transformer,
                     long effectiveTimeoutMillis);
}
