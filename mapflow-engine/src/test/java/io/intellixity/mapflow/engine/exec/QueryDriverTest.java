package io.intellixity.mapflow.engine.exec;

import io.intellixity.mapflow.engine.compile.FunctionReferenceResolver;
import io.intellixity.mapflow.engine.compile.QuerySyntaxValidator;
import io.intellixity.mapflow.exec.FlowEngine;
import io.intellixity.mapflow.exec.FlowHandle;
import io.intellixity.mapflow.exec.ResultSink;
import io.intellixity.mapflow.exec.ResultTransformer;
import io.intellixity.mapflow.phase.PhaseDefinition;
import io.intellixity.mapflow.query.FunctionReference;
import io.intellixity.mapflow.query.MapReduceJob;
import io.intellixity.mapflow.query.QueryTerm;
import io.intellixity.mapflow.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryDriverTest {
  private static final ResultSink NO_CLIENT = new ResultSink() {
    @Override public void deliver(String requestId, List<Object> results) {}
    @Override public void fail(String requestId, Throwable error) {}
  };

  private final RecordingFlowEngine flows = new RecordingFlowEngine();
  private final QueryDriver driver = new QueryDriver(
      new QuerySyntaxValidator(new FunctionReferenceResolver(new InMemoryKeyValueStore())), flows);

  @Test
  void effectiveTimeoutAddsTenPercent() {
    assertEquals(1100L, QueryDriver.effectiveTimeout(1000L));
    assertEquals(66_000L, QueryDriver.effectiveTimeout(60_000L));
    assertEquals(0L, QueryDriver.effectiveTimeout(0L));
    assertThrows(IllegalArgumentException.class, () -> QueryDriver.effectiveTimeout(-1L));
  }

  @Test
  void validQueryStartsFlowWithPhasesAndBufferedTimeout() {
    ResultTransformer reverse = results -> {
      List<Object> r = new ArrayList<>(results);
      Collections.reverse(r);
      return r;
    };
    List<QueryTerm> query = List.of(
        QueryTerm.map(FunctionReference.modfun("m", "f"), 1, false),
        QueryTerm.reduce(FunctionReference.modfun("m2", "g"), null, true)
    );

    StartResult r = driver.start("node-a", NO_CLIENT, "req-1", query, reverse, 1000L);

    assertTrue(r instanceof StartResult.Started);
    assertEquals(new FlowHandle("flow-1", "node-a", "req-1"), ((StartResult.Started) r).flow());
    assertEquals(1, flows.calls.size());
    RecordingFlowEngine.Call c = flows.calls.get(0);
    assertEquals(1100L, c.timeout);
    assertEquals(2, c.phases.size());
    assertSame(query.get(0), c.phases.get(0).target().term());
    assertSame(reverse, c.transformer);
    assertSame(NO_CLIENT, c.client);
  }

  @Test
  void missingTransformerMeansIdentity() {
    driver.start("n", NO_CLIENT, "req-2", List.of(QueryTerm.link("b", "t", true)), null, 10L);
    List<Object> in = List.of("a", "b");
    assertEquals(in, flows.calls.get(0).transformer.transform(in));
  }

  @Test
  void invalidQueryNeverReachesFlowEngine() {
    QueryTerm bad = QueryTerm.map(FunctionReference.jsanon("fns", "absent"), null, false);

    StartResult r = driver.start("n", NO_CLIENT, "req-3", List.of(bad), null, 1000L);

    assertTrue(r instanceof StartResult.BadQueryTerm);
    assertSame(bad, ((StartResult.BadQueryTerm) r).term());
    assertTrue(flows.calls.isEmpty());
  }

  @Test
  void jobWithoutTimeoutUsesDefault() {
    MapReduceJob job = MapReduceJob.of(List.of(QueryTerm.map(FunctionReference.jsfun("Riak.mapValues"), null, true)));

    driver.start("n", NO_CLIENT, "req-4", job, null, 60_000L);
    driver.start("n", NO_CLIENT, "req-5", new MapReduceJob(job.query(), 2000L), null, 60_000L);

    assertEquals(66_000L, flows.calls.get(0).timeout);
    assertEquals(2200L, flows.calls.get(1).timeout);
  }

  @Test
  void nullFlowFromEngineIsAnError() {
    QueryDriver broken = new QueryDriver(
        new QuerySyntaxValidator(new FunctionReferenceResolver(new InMemoryKeyValueStore())),
        (node, client, requestId, phases, transformer, timeout) -> null);
    assertThrows(IllegalStateException.class,
        () -> broken.start("n", NO_CLIENT, "req-6", List.of(QueryTerm.link(null, null, true)), null, 1L));
  }

  private static final class RecordingFlowEngine implements FlowEngine {
    static final class Call {
      ResultSink client;
      List<PhaseDefinition> phases;
      ResultTransformer transformer;
      long timeout;
    }

    final List<Call> calls = new ArrayList<>();

    @Override
    public FlowHandle newFlow(String node, ResultSink client, String requestId, List<PhaseDefinition> phases,
                              ResultTransformer transformer, long effectiveTimeoutMillis) {
      Call c = new Call();
      c.client = client;
      c.phases = phases;
      c.transformer = transformer;
      c.timeout = effectiveTimeoutMillis;
      calls.add(c);
      return new FlowHandle("flow-" + calls.size(), node, requestId);
    }
  }
}
