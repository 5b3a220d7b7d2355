package io.intellixity.mapflow.store.mongo;

import com.mongodb.MongoException;
import com.mongodb.ReadConcern;
import com.mongodb.ReadPreference;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import io.intellixity.mapflow.store.ReadQuorum;
import io.intellixity.mapflow.store.StoreException;
import io.intellixity.mapflow.store.StoredObject;
import org.bson.Document;
import org.bson.types.Binary;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class MongoKeyValueStoreTest {
  @Test
  void readsDocumentFromBucketCollection() {
    FakeMongo mongo = new FakeMongo();
    mongo.found = new Document("_id", "mapper")
        .append(MongoKeyValueStore.VALUE_FIELD, "(x) -> x")
        .append(MongoKeyValueStore.CONTENT_TYPE_FIELD, "text/plain");
    MongoKeyValueStore store = new MongoKeyValueStore(new MongoStoreHandle("mongo-a", mongo.client(), "mapflow"));

    Optional<StoredObject> r = store.get("fns", "mapper", ReadQuorum.ONE);

    assertEquals(Optional.of(StoredObject.text("fns", "mapper", "(x) -> x")), r);
    assertEquals(List.of("database:mapflow", "collection:fns", "concern:" + ReadConcern.LOCAL,
        "preference:" + ReadPreference.nearest(), "filter:mapper"), mongo.calls);
  }

  @Test
  void missingDocumentIsEmpty() {
    FakeMongo mongo = new FakeMongo();
    MongoKeyValueStore store = new MongoKeyValueStore(mongo.client(), "mapflow");
    assertTrue(store.get("fns", "absent", ReadQuorum.QUORUM).isEmpty());
  }

  @Test
  void driverFailureIsWrappedWithBackendId() {
    FakeMongo mongo = new FakeMongo();
    mongo.failWith = new MongoException("no primary");
    MongoKeyValueStore store = new MongoKeyValueStore(new MongoStoreHandle("mongo-a", mongo.client(), "mapflow"));

    StoreException ex = assertThrows(StoreException.class, () -> store.get("fns", "k", ReadQuorum.ALL));
    assertTrue(ex.getMessage().startsWith("[mongo-a] "), ex.getMessage());
    assertSame(mongo.failWith, ex.getCause());
  }

  @Test
  void handleRequiresDatabase() {
    FakeMongo mongo = new FakeMongo();
    assertThrows(IllegalArgumentException.class, () -> new MongoStoreHandle("m", mongo.client(), " "));
  }

  @Test
  void stringValueIsUtf8Encoded() {
    Document d = new Document("_id", "k").append(MongoKeyValueStore.VALUE_FIELD, "(x) -> x");
    assertArrayEquals("(x) -> x".getBytes(StandardCharsets.UTF_8), MongoKeyValueStore.valueBytes(d));
  }

  @Test
  void binaryValueIsReturnedAsIs() {
    byte[] raw = {1, 2, 3};
    Document d = new Document(MongoKeyValueStore.VALUE_FIELD, new Binary(raw));
    assertArrayEquals(raw, MongoKeyValueStore.valueBytes(d));
  }

  @Test
  void missingValueIsNull() {
    assertNull(MongoKeyValueStore.valueBytes(new Document("_id", "k")));
  }

  @Test
  void otherValueTypesAreRejected() {
    Document d = new Document(MongoKeyValueStore.VALUE_FIELD, 42);
    assertThrows(StoreException.class, () -> MongoKeyValueStore.valueBytes(d));
  }

  /** Driver interfaces faked with dynamic proxies; records the read path. */
  private static final class FakeMongo {
    Document found;
    MongoException failWith;
    final List<String> calls = new ArrayList<>();

    MongoClient client() {
      return proxy(MongoClient.class, (p, m, a) -> {
        if (m.getName().equals("getDatabase")) {
          calls.add("database:" + a[0]);
          return database();
        }
        throw new UnsupportedOperationException(m.getName());
      });
    }

    private MongoDatabase database() {
      return proxy(MongoDatabase.class, (p, m, a) -> {
        if (m.getName().equals("getCollection")) {
          calls.add("collection:" + a[0]);
          return collection();
        }
        throw new UnsupportedOperationException(m.getName());
      });
    }

    private MongoCollection<?> collection() {
      return proxy(MongoCollection.class, (p, m, a) -> switch (m.getName()) {
        case "withReadConcern" -> {
          calls.add("concern:" + a[0]);
          yield p;
        }
        case "withReadPreference" -> {
          calls.add("preference:" + a[0]);
          yield p;
        }
        case "find" -> {
          if (failWith != null) throw failWith;
          calls.add("filter:" + ((Document) a[0]).get("_id"));
          yield findResult();
        }
        default -> throw new UnsupportedOperationException(m.getName());
      });
    }

    private FindIterable<?> findResult() {
      return proxy(FindIterable.class, (p, m, a) -> {
        if (m.getName().equals("first")) return found;
        throw new UnsupportedOperationException(m.getName());
      });
    }

    @SuppressWarnings("unchecked")
    private static <T> T proxy(Class<T> type, InvocationHandler h) {
      return (T) Proxy.newProxyInstance(MongoKeyValueStoreTest.class.getClassLoader(), new Class<?>[]{type}, h);
    }
  }
}
