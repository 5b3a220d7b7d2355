package io.intellixity.mapflow.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link QueryTerm} (HTTP map-reduce job step format). */
public final class QueryTermJsonSerializer extends JsonSerializer<QueryTerm> {
  static final String ERLANG = "erlang";
  static final String JAVASCRIPT = "javascript";
  static final String INLINE_PLACEHOLDER = "<inline>";

  @Override
  public void serialize(QueryTerm t, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (t == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeObjectFieldStart(t.kind().name().toLowerCase());

    if (t.kind() == PhaseKind.LINK) {
      LinkSpec ls = t.linkSpec();
      g.writeStringField("bucket", ls.bucket());
      g.writeStringField("tag", ls.tag());
    } else {
      writeFunction(t.function(), g, serializers);
      if (t.argument() != null) {
        g.writeFieldName("arg");
        serializers.defaultSerializeValue(t.argument(), g);
      }
    }

    g.writeBooleanField("keep", t.accumulate());
    g.writeEndObject();
    g.writeEndObject();
  }

  private static void writeFunction(FunctionReference fn, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (fn == null) return;

    if (fn instanceof FunctionReference.ModuleFunction mf) {
      g.writeStringField("language", ERLANG);
      g.writeStringField("module", mf.module());
      g.writeStringField("function", mf.function());
      return;
    }
    if (fn instanceof FunctionReference.InlineFunction) {
      g.writeStringField("language", ERLANG);
      g.writeStringField("qfun", INLINE_PLACEHOLDER);
      return;
    }
    if (fn instanceof FunctionReference.SourceText st) {
      g.writeStringField("language", ERLANG);
      g.writeStringField("source", st.text());
      return;
    }
    if (fn instanceof FunctionReference.RemoteSourceText rs) {
      g.writeStringField("language", JAVASCRIPT);
      g.writeStringField("source", rs.text());
      return;
    }
    if (fn instanceof FunctionReference.RemoteFunctionName rn) {
      g.writeStringField("language", JAVASCRIPT);
      g.writeStringField("name", rn.name());
      return;
    }
    if (fn instanceof FunctionReference.RemoteStoredSource rss) {
      g.writeStringField("language", JAVASCRIPT);
      g.writeStringField("bucket", rss.bucket());
      g.writeStringField("key", rss.key());
      return;
    }
    if (fn instanceof FunctionReference.Unrecognized u) {
      g.writeFieldName("unrecognized");
      serializers.defaultSerializeValue(u.raw(), g);
    }
  }
}
