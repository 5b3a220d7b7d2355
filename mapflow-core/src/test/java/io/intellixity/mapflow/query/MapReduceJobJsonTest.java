package io.intellixity.mapflow.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MapReduceJobJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesEveryFunctionShapeInOrder() throws Exception {
    String s = """
        {
          "query": [
            { "link":   { "bucket": "people", "tag": "friend" } },
            { "map":    { "language": "javascript", "source": "function(v) { return [v]; }" } },
            { "map":    { "language": "javascript", "name": "Riak.mapValuesJson" } },
            { "map":    { "language": "javascript", "bucket": "fns", "key": "mapper" } },
            { "map":    { "language": "erlang", "module": "m", "function": "f", "arg": 1 } },
            { "reduce": { "language": "erlang", "source": "(x) -> x" } }
          ],
          "timeout": 30000
        }
        """;
    MapReduceJob job = JSON.readValue(s, MapReduceJob.class);

    assertEquals(6, job.query().size());
    assertEquals(30_000L, job.timeoutMillis());

    QueryTerm link = job.query().get(0);
    assertEquals(PhaseKind.LINK, link.kind());
    assertEquals(new LinkSpec("people", "friend"), link.linkSpec());

    assertEquals(new FunctionReference.RemoteSourceText("function(v) { return [v]; }"), job.query().get(1).function());
    assertEquals(new FunctionReference.RemoteFunctionName("Riak.mapValuesJson"), job.query().get(2).function());
    assertEquals(new FunctionReference.RemoteStoredSource("fns", "mapper"), job.query().get(3).function());

    QueryTerm modfun = job.query().get(4);
    assertEquals(new FunctionReference.ModuleFunction("m", "f"), modfun.function());
    assertEquals(1, modfun.argument());

    QueryTerm reduce = job.query().get(5);
    assertEquals(PhaseKind.REDUCE, reduce.kind());
    assertEquals(new FunctionReference.SourceText("(x) -> x"), reduce.function());
  }

  @Test
  void missingKeep_keepsOnlyTheLastStep() throws Exception {
    String s = """
        { "query": [
            { "map":    { "language": "erlang", "module": "m", "function": "f" } },
            { "map":    { "language": "erlang", "module": "m", "function": "g", "keep": true } },
            { "reduce": { "language": "erlang", "module": "m", "function": "r" } }
        ] }
        """;
    MapReduceJob job = JSON.readValue(s, MapReduceJob.class);

    assertFalse(job.query().get(0).accumulate());
    assertTrue(job.query().get(1).accumulate());
    assertTrue(job.query().get(2).accumulate());
    assertNull(job.timeoutMillis());
    assertEquals(45_000L, job.timeoutOr(45_000L));
  }

  @Test
  void unknownLanguage_decodesToUnrecognizedReference() throws Exception {
    String s = """
        { "query": [ { "map": { "language": "cobol", "source": "MOVE A TO B", "keep": false } } ] }
        """;
    MapReduceJob job = JSON.readValue(s, MapReduceJob.class);

    FunctionReference fn = job.query().get(0).function();
    assertTrue(fn instanceof FunctionReference.Unrecognized);
    Object raw = ((FunctionReference.Unrecognized) fn).raw();
    assertEquals("cobol", ((Map<?, ?>) raw).get("language"));
  }

  @Test
  void erlangWithoutFunctionName_decodesToUnrecognizedReference() throws Exception {
    String s = """
        { "query": [ { "reduce": { "language": "erlang", "module": "m" } } ] }
        """;
    MapReduceJob job = JSON.readValue(s, MapReduceJob.class);
    assertTrue(job.query().get(0).function() instanceof FunctionReference.Unrecognized);
  }

  @Test
  void rejectsUnknownStepType() {
    String s = """
        { "query": [ { "shuffle": { "language": "erlang", "module": "m", "function": "f" } } ] }
        """;
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue(s, MapReduceJob.class));
    assertTrue(messageChain(ex).contains("Unsupported query step type: shuffle"));
  }

  @Test
  void rejectsNonBooleanKeep() {
    String s = """
        { "query": [ { "link": { "bucket": "b", "keep": "yes" } } ] }
        """;
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue(s, MapReduceJob.class));
    assertTrue(messageChain(ex).contains("keep must be a boolean"));
  }

  @Test
  void rejectsJobWithoutQueryArray() {
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue("{\"inputs\": \"b\"}", MapReduceJob.class));
    assertTrue(messageChain(ex).contains("requires a query array"));
  }

  @Test
  void serializesStoredSourceTermInStepForm() throws Exception {
    QueryTerm t = QueryTerm.map(FunctionReference.jsanon("fns", "mapper"), Map.of("limit", 3), true);

    JsonNode n = JSON.readTree(JSON.writeValueAsString(t));
    JsonNode map = n.get("map");
    assertNotNull(map);
    assertEquals("javascript", map.get("language").asText());
    assertEquals("fns", map.get("bucket").asText());
    assertEquals("mapper", map.get("key").asText());
    assertEquals(3, map.get("arg").get("limit").asInt());
    assertTrue(map.get("keep").asBoolean());
  }

  @Test
  void serializesInlineFunctionAsPlaceholder() throws Exception {
    QueryTerm t = QueryTerm.reduce(FunctionReference.qfun(args -> args[0]), null, false);

    JsonNode reduce = JSON.readTree(JSON.writeValueAsString(t)).get("reduce");
    assertEquals("erlang", reduce.get("language").asText());
    assertEquals("<inline>", reduce.get("qfun").asText());
    assertFalse(reduce.has("arg"));
  }

  private static String messageChain(Throwable t) {
    StringBuilder sb = new StringBuilder();
    for (Throwable c = t; c != null; c = c.getCause()) sb.append(c.getMessage()).append('\n');
    return sb.toString();
  }
}
