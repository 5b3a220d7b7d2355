package io.intellixity.mapflow.store.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.mapflow.store.handle.StoreHandle;

import java.util.Objects;

/** Mongo backend; {@code namespace} is the database holding one collection per bucket. */
public record MongoStoreHandle(String id, MongoClient client, String namespace) implements StoreHandle<MongoClient> {
  public MongoStoreHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    if (namespace == null || namespace.isBlank()) throw new IllegalArgumentException("Mongo database name is required");
  }
}
