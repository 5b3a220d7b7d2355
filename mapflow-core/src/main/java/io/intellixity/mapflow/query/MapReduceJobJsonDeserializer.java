package io.intellixity.mapflow.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON deserializer for {@link MapReduceJob}.\n
 *
 * A step without "keep" is kept only when it is the last step of the query.\n
 */
public final class MapReduceJobJsonDeserializer extends JsonDeserializer<MapReduceJob> {
  @Override
  public MapReduceJob deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Job JSON must be an object");

    JsonNode query = root.get("query");
    if (query == null || !query.isArray()) throw new IllegalArgumentException("Job JSON requires a query array");

    List<QueryTerm> terms = new ArrayList<>(query.size());
    for (int i = 0; i < query.size(); i++) {
      boolean last = (i == query.size() - 1);
      terms.add(QueryTermJsonDeserializer.parseStep(query.get(i), last, codec));
    }

    Long timeout = null;
    JsonNode t = root.get("timeout");
    if (t != null && !t.isNull()) {
      if (!t.isIntegralNumber() || !t.canConvertToLong()) throw new IllegalArgumentException("timeout must be an integer, got: " + t);
      timeout = t.longValue();
    }

    return new MapReduceJob(terms, timeout);
  }
}
