package io.intellixity.mapflow.store;

import java.util.Optional;

/**
 * Key/value read access to durable storage.
 * <p>
 * Reads block until the backend answers. Timeout and retry discipline belong to the backend client.
 */
public interface KeyValueStore {
  /**
   * Reads the object stored under bucket/key.
   *
   * @return the object, or empty when no object exists
   * @throws StoreException when the backend fails to answer
   */
  Optional<StoredObject> get(String bucket, String key, ReadQuorum quorum);
}
