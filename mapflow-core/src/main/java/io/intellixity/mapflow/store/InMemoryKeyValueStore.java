package io.intellixity.mapflow.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Single-copy in-process store. Read quorum is ignored. */
public final class InMemoryKeyValueStore implements KeyValueStore {
  private final Map<BucketKey, StoredObject> objects = new ConcurrentHashMap<>();

  public InMemoryKeyValueStore put(StoredObject obj) {
    Objects.requireNonNull(obj, "obj");
    objects.put(new BucketKey(obj.bucket(), obj.key()), obj);
    return this;
  }

  public InMemoryKeyValueStore putText(String bucket, String key, String value) {
    return put(StoredObject.text(bucket, key, value));
  }

  @Override
  public Optional<StoredObject> get(String bucket, String key, ReadQuorum quorum) {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(key, "key");
    return Optional.ofNullable(objects.get(new BucketKey(bucket, key)));
  }

  private record BucketKey(String bucket, String key) {}
}
