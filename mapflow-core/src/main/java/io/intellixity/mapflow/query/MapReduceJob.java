package io.intellixity.mapflow.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A submitted map-reduce job: the ordered query terms and an optional timeout.\n
 *
 * The term list may contain nulls; they are rejected by query validation, not here.\n
 */
@JsonSerialize(using = MapReduceJobJsonSerializer.class)
@JsonDeserialize(using = MapReduceJobJsonDeserializer.class)
public record MapReduceJob(List<QueryTerm> query, Long timeoutMillis) {

  public MapReduceJob {
    query = Collections.unmodifiableList(new ArrayList<>(query == null ? List.of() : query));
    if (timeoutMillis != null && timeoutMillis < 0) {
      throw new IllegalArgumentException("timeoutMillis must be >= 0");
    }
  }

  public static MapReduceJob of(List<QueryTerm> query) {
    return new MapReduceJob(query, null);
  }

  public long timeoutOr(long defaultMillis) {
    return timeoutMillis == null ? defaultMillis : timeoutMillis;
  }
}
