package io.intellixity.mapflow.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Iterator;

/**
 * Canonical JSON deserializer for {@link QueryTerm}.\n
 *
 * Step forms:\n
 * - { "link":   { "bucket": b, "tag": t, "keep": bool } }\n
 * - { "map":    { "language": "erlang", "module": m, "function": f, "arg": a, "keep": bool } }\n
 * - { "map":    { "language": "erlang", "source": "..." } }\n
 * - { "reduce": { "language": "javascript", "source" | "name" | ("bucket","key"): ... } }\n
 *
 * A function description that matches no known shape decodes to
 * {@link FunctionReference.Unrecognized} so that query validation reports the term.\n
 */
public final class QueryTermJsonDeserializer extends JsonDeserializer<QueryTerm> {
  @Override
  public QueryTerm deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseStep(root, false, codec);
  }

  static QueryTerm parseStep(JsonNode step, boolean defaultKeep, ObjectCodec codec) throws IOException {
    if (step == null || !step.isObject()) throw new IllegalArgumentException("Query step must be an object: " + step);

    Iterator<String> names = step.fieldNames();
    if (!names.hasNext()) throw new IllegalArgumentException("Query step is empty");
    String type = names.next();
    if (names.hasNext()) throw new IllegalArgumentException("Query step must have exactly one phase type: " + step);

    PhaseKind kind = tryKind(type);
    if (kind == null) throw new IllegalArgumentException("Unsupported query step type: " + type);

    JsonNode body = step.get(type);
    if (body == null || !body.isObject()) throw new IllegalArgumentException(type + " must be an object");

    boolean keep = keepOrDefault(body.get("keep"), defaultKeep);

    if (kind == PhaseKind.LINK) {
      return QueryTerm.link(textOrNull(body.get("bucket")), textOrNull(body.get("tag")), keep);
    }

    Object arg = decodeValue(body.get("arg"), codec);
    FunctionReference fn = parseFunction(body, codec);
    return new QueryTerm(kind, fn, arg, keep);
  }

  private static FunctionReference parseFunction(JsonNode body, ObjectCodec codec) throws IOException {
    String language = textOrNull(body.get("language"));
    if (QueryTermJsonSerializer.ERLANG.equalsIgnoreCase(language)) {
      String module = textualOrNull(body.get("module"));
      String function = textualOrNull(body.get("function"));
      if (module != null && function != null) return new FunctionReference.ModuleFunction(module, function);
      String source = textualOrNull(body.get("source"));
      if (source != null) return new FunctionReference.SourceText(source);
    } else if (QueryTermJsonSerializer.JAVASCRIPT.equalsIgnoreCase(language)) {
      String source = textualOrNull(body.get("source"));
      if (source != null) return new FunctionReference.RemoteSourceText(source);
      String name = textualOrNull(body.get("name"));
      if (name != null) return new FunctionReference.RemoteFunctionName(name);
      String bucket = textualOrNull(body.get("bucket"));
      String key = textualOrNull(body.get("key"));
      if (bucket != null && key != null) return new FunctionReference.RemoteStoredSource(bucket, key);
    }
    return new FunctionReference.Unrecognized(codec.treeToValue(body, Object.class));
  }

  private static PhaseKind tryKind(String type) {
    if (type == null) return null;
    try {
      return PhaseKind.valueOf(type.toUpperCase());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static boolean keepOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    if (!n.isBoolean()) throw new IllegalArgumentException("keep must be a boolean, got: " + n);
    return n.booleanValue();
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static String textualOrNull(JsonNode n) {
    return (n != null && n.isTextual()) ? n.asText() : null;
  }
}
