package io.intellixity.mapflow.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * One user-supplied phase of a map-reduce query.\n
 *
 * Link terms carry no function reference; their argument is the {@link LinkSpec}.\n
 * Map/reduce terms carry a {@link FunctionReference} and an opaque argument passed through to the
 * phase function.\n
 */
@JsonSerialize(using = QueryTermJsonSerializer.class)
@JsonDeserialize(using = QueryTermJsonDeserializer.class)
public record QueryTerm(PhaseKind kind, FunctionReference function, Object argument, boolean accumulate) {

  public QueryTerm {
    Objects.requireNonNull(kind, "kind");
    if (kind == PhaseKind.LINK && function != null) {
      throw new IllegalArgumentException("Link terms carry no function reference");
    }
    if (kind == PhaseKind.LINK) {
      if (argument == null) argument = LinkSpec.any();
      if (!(argument instanceof LinkSpec)) {
        throw new IllegalArgumentException("Link term argument must be a LinkSpec, got " + argument.getClass().getName());
      }
    }
  }

  public static QueryTerm link(String bucket, String tag, boolean accumulate) {
    return new QueryTerm(PhaseKind.LINK, null, new LinkSpec(bucket, tag), accumulate);
  }

  public static QueryTerm map(FunctionReference function, Object argument, boolean accumulate) {
    return new QueryTerm(PhaseKind.MAP, function, argument, accumulate);
  }

  public static QueryTerm reduce(FunctionReference function, Object argument, boolean accumulate) {
    return new QueryTerm(PhaseKind.REDUCE, function, argument, accumulate);
  }

  /** Only valid for link terms. */
  public LinkSpec linkSpec() {
    if (kind != PhaseKind.LINK) throw new IllegalStateException("Not a link term: " + kind);
    return (LinkSpec) argument;
  }

  /** Same phase, argument and accumulate flag with a different function reference. */
  public QueryTerm withFunction(FunctionReference replacement) {
    return new QueryTerm(kind, replacement, argument, accumulate);
  }
}
