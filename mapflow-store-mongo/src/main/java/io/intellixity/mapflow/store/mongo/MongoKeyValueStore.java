package io.intellixity.mapflow.store.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import io.intellixity.mapflow.store.KeyValueStore;
import io.intellixity.mapflow.store.ReadQuorum;
import io.intellixity.mapflow.store.StoreException;
import io.intellixity.mapflow.store.StoredObject;
import org.bson.Document;
import org.bson.types.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Key/value store over the official MongoDB Java sync driver.\n
 *
 * Layout: one collection per bucket, {@code _id} is the key, the payload lives in {@value #VALUE_FIELD}
 * (string or binary) with an optional {@value #CONTENT_TYPE_FIELD}.\n
 */
public final class MongoKeyValueStore implements KeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(MongoKeyValueStore.class);

  public static final String VALUE_FIELD = "value";
  public static final String CONTENT_TYPE_FIELD = "contentType";

  private final String backend;
  private final MongoDatabase db;

  public MongoKeyValueStore(MongoStoreHandle handle) {
    Objects.requireNonNull(handle, "handle");
    this.backend = handle.id();
    this.db = handle.client().getDatabase(handle.namespace());
  }

  /** Convenience constructor: wraps raw client+database into a handle. */
  public MongoKeyValueStore(MongoClient client, String database) {
    this(new MongoStoreHandle("mongo", client, database));
  }

  @Override
  public Optional<StoredObject> get(String bucket, String key, ReadQuorum quorum) {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(key, "key");
    ReadQuorum q = (quorum == null) ? ReadQuorum.ONE : quorum;

    long start = System.nanoTime();
    Document d;
    try {
      MongoCollection<Document> col = db.getCollection(bucket)
          .withReadConcern(MongoReadSettings.readConcern(q))
          .withReadPreference(MongoReadSettings.readPreference(q));
      d = col.find(new Document("_id", key)).first();
    } catch (MongoException e) {
      throw new StoreException("[" + backend + "] Mongo read failed for " + bucket + "/" + key, e);
    }
    if (log.isDebugEnabled()) {
      log.debug("[{}] GET {}/{} r={} found={} in {}us", backend, bucket, key, q, d != null, (System.nanoTime() - start) / 1_000);
    }
    if (d == null) return Optional.empty();

    byte[] value = valueBytes(d);
    if (value == null) throw new StoreException("[" + backend + "] Object " + bucket + "/" + key + " has no '" + VALUE_FIELD + "' field");
    Object ct = d.get(CONTENT_TYPE_FIELD);
    return Optional.of(new StoredObject(bucket, key, value, ct == null ? null : String.valueOf(ct)));
  }

  static byte[] valueBytes(Document d) {
    Object v = d.get(VALUE_FIELD);
    if (v == null) return null;
    if (v instanceof String s) return s.getBytes(StandardCharsets.UTF_8);
    if (v instanceof Binary b) return b.getData();
    if (v instanceof byte[] bytes) return bytes;
    throw new StoreException("Unsupported value type " + v.getClass().getName() + " in field '" + VALUE_FIELD + "'");
  }
}
