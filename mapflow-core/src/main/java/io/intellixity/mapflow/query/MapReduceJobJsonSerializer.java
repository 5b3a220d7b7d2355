package io.intellixity.mapflow.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link MapReduceJob}. */
public final class MapReduceJobJsonSerializer extends JsonSerializer<MapReduceJob> {
  @Override
  public void serialize(MapReduceJob job, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (job == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeArrayFieldStart("query");
    for (QueryTerm t : job.query()) {
      serializers.defaultSerializeValue(t, g);
    }
    g.writeEndArray();
    if (job.timeoutMillis() != null) {
      g.writeNumberField("timeout", job.timeoutMillis());
    }
    g.writeEndObject();
  }
}
