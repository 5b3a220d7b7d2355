package io.intellixity.mapflow.store.jdbc;

import io.intellixity.mapflow.store.KeyValueStore;
import io.intellixity.mapflow.store.ReadQuorum;
import io.intellixity.mapflow.store.StoreException;
import io.intellixity.mapflow.store.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Key/value store over a relational table.\n
 *
 * Expected table (name configurable, default {@value #DEFAULT_TABLE}):\n
 * <pre>
 *   bucket       varchar  not null
 *   obj_key      varchar  not null
 *   value        bytea    not null
 *   content_type varchar
 *   primary key (bucket, obj_key)
 * </pre>
 *
 * A relational store keeps a single copy, so the read quorum has no effect.\n
 */
public final class JdbcKeyValueStore implements KeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcKeyValueStore.class);

  public static final String DEFAULT_TABLE = "mapred_objects";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String backend;
  private final DataSource ds;
  private final String selectSql;

  public JdbcKeyValueStore(JdbcStoreHandle handle) {
    this(handle, DEFAULT_TABLE);
  }

  public JdbcKeyValueStore(JdbcStoreHandle handle, String table) {
    Objects.requireNonNull(handle, "handle");
    this.backend = handle.id();
    this.ds = handle.client();
    this.selectSql = selectSql(handle.namespace(), (table == null || table.isBlank()) ? DEFAULT_TABLE : table);
  }

  static String selectSql(String schemaOrNull, String table) {
    String qualified = (schemaOrNull == null)
        ? requireIdentifier(table, "table")
        : requireIdentifier(schemaOrNull, "schema") + "." + requireIdentifier(table, "table");
    return "SELECT value, content_type FROM " + qualified + " WHERE bucket = ? AND obj_key = ?";
  }

  private static String requireIdentifier(String s, String what) {
    if (s == null || !IDENTIFIER.matcher(s).matches()) {
      throw new IllegalArgumentException("Invalid " + what + " identifier: " + s);
    }
    return s;
  }

  String selectSql() {
    return selectSql;
  }

  @Override
  public Optional<StoredObject> get(String bucket, String key, ReadQuorum quorum) {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(key, "key");

    long start = System.nanoTime();
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(selectSql)) {
      ps.setString(1, bucket);
      ps.setString(2, key);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          debugDone(bucket, key, quorum, false, start);
          return Optional.empty();
        }
        byte[] value = rs.getBytes(1);
        String contentType = rs.getString(2);
        if (value == null) throw new StoreException("[" + backend + "] Object " + bucket + "/" + key + " has a null value");
        debugDone(bucket, key, quorum, true, start);
        return Optional.of(new StoredObject(bucket, key, value, contentType));
      }
    } catch (SQLException e) {
      throw new StoreException("[" + backend + "] JDBC read failed for " + bucket + "/" + key, e);
    }
  }

  private void debugDone(String bucket, String key, ReadQuorum quorum, boolean found, long startNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("[{}] GET {}/{} r={} (ignored, single copy) found={} in {}us",
        backend, bucket, key, quorum, found, (System.nanoTime() - startNanos) / 1_000);
  }
}
