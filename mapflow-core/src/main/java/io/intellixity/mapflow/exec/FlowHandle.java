package io.intellixity.mapflow.exec;

import java.util.Objects;

/** Handle for a flow created by a {@link FlowEngine}. */
public record FlowHandle(String flowId, String node, String requestId) {
  public FlowHandle {
    Objects.requireNonNull(flowId, "flowId");
  }
}
