package io.intellixity.mapflow.store;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/** A value read from a {@link KeyValueStore}. */
public record StoredObject(String bucket, String key, byte[] value, String contentType) {
  public StoredObject {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    value = value.clone();
  }

  public static StoredObject text(String bucket, String key, String value) {
    return new StoredObject(bucket, key, Objects.requireNonNull(value, "value").getBytes(StandardCharsets.UTF_8), "text/plain");
  }

  @Override
  public byte[] value() {
    return value.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StoredObject other)) return false;
    return bucket.equals(other.bucket) && key.equals(other.key)
        && Arrays.equals(value, other.value) && Objects.equals(contentType, other.contentType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(bucket, key, Arrays.hashCode(value), contentType);
  }

  @Override
  public String toString() {
    return "StoredObject[bucket=" + bucket + ", key=" + key + ", bytes=" + value.length + ", contentType=" + contentType + "]";
  }
}
