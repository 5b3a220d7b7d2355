package io.intellixity.mapflow.store;

/** Raised by {@link KeyValueStore} implementations when a read fails (I/O, timeout, driver error). */
public final class StoreException extends RuntimeException {
  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
