package io.intellixity.mapflow.query;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class QueryTermTest {
  @Test
  void linkDefaultsToWildcards() {
    QueryTerm t = QueryTerm.link(null, " ", false);
    assertEquals(LinkSpec.any(), t.linkSpec());
    assertNull(t.function());
  }

  @Test
  void linkRejectsFunctionReference() {
    assertThrows(IllegalArgumentException.class,
        () -> new QueryTerm(PhaseKind.LINK, FunctionReference.modfun("m", "f"), null, true));
  }

  @Test
  void linkSpecOnlyForLinkTerms() {
    QueryTerm t = QueryTerm.map(FunctionReference.modfun("m", "f"), null, false);
    assertThrows(IllegalStateException.class, t::linkSpec);
  }

  @Test
  void withFunctionKeepsKindArgumentAndAccumulate() {
    QueryTerm t = QueryTerm.reduce(FunctionReference.jsanon("b", "k"), 42, true);
    QueryTerm r = t.withFunction(FunctionReference.jsanon("function(v) { return v; }"));

    assertEquals(PhaseKind.REDUCE, r.kind());
    assertEquals(42, r.argument());
    assertTrue(r.accumulate());
    assertEquals(new FunctionReference.RemoteSourceText("function(v) { return v; }"), r.function());
  }

  @Test
  void onlyRemoteShapesRunInScriptingRuntime() {
    assertFalse(FunctionReference.modfun("m", "f").scripting());
    assertFalse(FunctionReference.qfun(args -> null).scripting());
    assertFalse(FunctionReference.strfun("(x) -> x").scripting());
    assertTrue(FunctionReference.jsanon("function(v) { return [v]; }").scripting());
    assertTrue(FunctionReference.jsfun("Riak.mapValues").scripting());
    assertTrue(FunctionReference.jsanon("fns", "mapper").scripting());
  }

  @Test
  void sourceTextAcceptsUtf8Bytes() {
    byte[] bytes = "(x) -> x + 1".getBytes(StandardCharsets.UTF_8);
    assertEquals(new FunctionReference.SourceText("(x) -> x + 1"), FunctionReference.SourceText.of(bytes));
  }
}
