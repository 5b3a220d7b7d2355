package io.intellixity.mapflow.store.jdbc;

import io.intellixity.mapflow.store.handle.StoreHandle;

import javax.sql.DataSource;

import java.util.Objects;

/** JDBC backend; {@code namespace} is the schema of the objects table, null for the connection default. */
public record JdbcStoreHandle(String id, DataSource client, String namespace) implements StoreHandle<DataSource> {
  public JdbcStoreHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    namespace = (namespace == null || namespace.isBlank()) ? null : namespace;
  }
}
