package io.intellixity.mapflow.engine.compile;

import io.intellixity.mapflow.query.FunctionReference;

/** Raised when a stored scripting source cannot be read or decoded. */
public final class SourceFetchException extends RuntimeException {
  private final FunctionReference.RemoteStoredSource reference;

  public SourceFetchException(FunctionReference.RemoteStoredSource reference, String message) {
    super(message);
    this.reference = reference;
  }

  public SourceFetchException(FunctionReference.RemoteStoredSource reference, String message, Throwable cause) {
    super(message, cause);
    this.reference = reference;
  }

  public FunctionReference.RemoteStoredSource reference() {
    return reference;
  }
}
