package io.intellixity.mapflow.engine.compile;

import io.intellixity.mapflow.query.FunctionReference.RemoteSourceText;
import io.intellixity.mapflow.query.FunctionReference.RemoteStoredSource;
import io.intellixity.mapflow.store.KeyValueStore;
import io.intellixity.mapflow.store.ReadQuorum;
import io.intellixity.mapflow.store.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves stored scripting sources into source text.\n
 *
 * One read per reference at {@link ReadQuorum#ONE}. The fetched value is always scripting-runtime
 * source and is never compiled locally.\n
 */
public final class FunctionReferenceResolver {
  private static final Logger log = LoggerFactory.getLogger(FunctionReferenceResolver.class);

  private final KeyValueStore store;

  public FunctionReferenceResolver(KeyValueStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Reads the source stored under the reference's bucket/key.
   *
   * @throws SourceFetchException when the object is missing, the store fails, or the value is not UTF-8 text
   */
  public RemoteSourceText resolve(RemoteStoredSource ref) {
    Objects.requireNonNull(ref, "ref");
    log.debug("Fetching stored source bucket={} key={}", ref.bucket(), ref.key());

    Optional<StoredObject> found;
    try {
      found = store.get(ref.bucket(), ref.key(), ReadQuorum.ONE);
    } catch (RuntimeException e) {
      log.warn("Failed to fetch stored source bucket={} key={}: {}", ref.bucket(), ref.key(), e.toString());
      throw new SourceFetchException(ref, "Failed to fetch " + ref.bucket() + "/" + ref.key(), e);
    }

    if (found == null || found.isEmpty()) {
      log.warn("No stored source at bucket={} key={}", ref.bucket(), ref.key());
      throw new SourceFetchException(ref, "No stored source at " + ref.bucket() + "/" + ref.key());
    }
    return new RemoteSourceText(decode(ref, found.get()));
  }

  private static String decode(RemoteStoredSource ref, StoredObject obj) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(obj.value()))
          .toString();
    } catch (CharacterCodingException e) {
      log.warn("Stored source at bucket={} key={} is not UTF-8 text", ref.bucket(), ref.key());
      throw new SourceFetchException(ref, "Stored source at " + ref.bucket() + "/" + ref.key() + " is not UTF-8 text", e);
    }
  }
}
