package io.intellixity.mapflow.store.mongo;

import com.mongodb.ReadConcern;
import com.mongodb.ReadPreference;
import io.intellixity.mapflow.store.ReadQuorum;

import java.util.Objects;

/**
 * Maps a {@link ReadQuorum} onto Mongo read settings.\n
 *
 * - one:    local read concern, nearest member\n
 * - all:    linearizable read concern, primary\n
 * - others: majority read concern, primary preferred\n
 */
public final class MongoReadSettings {
  private MongoReadSettings() {}

  public static ReadConcern readConcern(ReadQuorum quorum) {
    Objects.requireNonNull(quorum, "quorum");
    if (quorum.isOne()) return ReadConcern.LOCAL;
    if (quorum.replicas() == ReadQuorum.ALL_MARKER) return ReadConcern.LINEARIZABLE;
    return ReadConcern.MAJORITY;
  }

  public static ReadPreference readPreference(ReadQuorum quorum) {
    Objects.requireNonNull(quorum, "quorum");
    if (quorum.isOne()) return ReadPreference.nearest();
    if (quorum.replicas() == ReadQuorum.ALL_MARKER) return ReadPreference.primary();
    return ReadPreference.primaryPreferred();
  }
}
