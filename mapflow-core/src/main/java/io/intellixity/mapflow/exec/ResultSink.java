package io.intellixity.mapflow.exec;

import java.util.List;

/**
 * Client side of a running query: receives accumulated results or the failure that ended the flow.
 * <p>
 * Opaque to query compilation; only the flow engine calls it.
 */
public interface ResultSink {
  void deliver(String requestId, List<Object> results);

  void fail(String requestId, Throwable error);
}
