package io.intellixity.mapflow.engine.compile;

/**
 * Raised when anonymous function source does not parse or does not evaluate to exactly one function.
 * <p>
 * Fatal to the operation that asked for the compilation; never translated into a bad query term.
 */
public final class FunctionCompilationException extends RuntimeException {
  public FunctionCompilationException(String message) {
    super(message);
  }

  public FunctionCompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
