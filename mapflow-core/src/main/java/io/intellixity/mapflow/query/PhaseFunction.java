package io.intellixity.mapflow.query;

/**
 * A locally callable phase body.
 * <p>
 * Map functions are called as {@code apply(value, keyData, arg)}, reduce functions as
 * {@code apply(values, arg)}. Implementations must not retain state between calls.
 */
@FunctionalInterface
public interface PhaseFunction {
  Object apply(Object... args);
}
