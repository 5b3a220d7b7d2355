package io.intellixity.mapflow.exec;

import java.util.List;

/** Applied by the flow engine to accumulated results before they are delivered to the client. */
@FunctionalInterface
public interface ResultTransformer {
  List<Object> transform(List<Object> results);

  static ResultTransformer identity() {
    return results -> results;
  }
}
