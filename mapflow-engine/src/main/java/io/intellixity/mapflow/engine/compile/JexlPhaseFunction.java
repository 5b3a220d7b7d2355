package io.intellixity.mapflow.engine.compile;

import io.intellixity.mapflow.query.PhaseFunction;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlScript;
import org.apache.commons.jexl3.MapContext;

import java.util.Objects;

/** {@link PhaseFunction} over a compiled JEXL lambda. Every call gets a fresh, empty context. */
final class JexlPhaseFunction implements PhaseFunction {
  private final JexlScript lambda;
  private final String source;

  JexlPhaseFunction(JexlScript lambda, String source) {
    this.lambda = Objects.requireNonNull(lambda, "lambda");
    this.source = source;
  }

  @Override
  public Object apply(Object... args) {
    try {
      return lambda.execute(new MapContext(), args);
    } catch (JexlException e) {
      throw new IllegalStateException("Anonymous function failed: " + e.getMessage(), e);
    }
  }

  /** Declared parameter names, in order. */
  String[] parameters() {
    String[] p = lambda.getParameters();
    return p == null ? new String[0] : p;
  }

  @Override
  public String toString() {
    return "JexlPhaseFunction[" + source + "]";
  }
}
