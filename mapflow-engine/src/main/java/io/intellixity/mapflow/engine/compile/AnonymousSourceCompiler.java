package io.intellixity.mapflow.engine.compile;

import io.intellixity.mapflow.query.PhaseFunction;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlFeatures;
import org.apache.commons.jexl3.JexlScript;
import org.apache.commons.jexl3.introspection.JexlPermissions;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Compiles the source of an anonymous function into a callable {@link PhaseFunction}.\n
 *
 * The source must be a single JEXL lambda, e.g. {@code (x) -> x + 1} or
 * {@code function(v, keyData, arg) { [v] }}. Anything else, including a lambda followed by more
 * statements, is rejected.\n
 *
 * The default engine is sandboxed: restricted class permissions, no assignments, no object
 * construction, no loops, no pragmas or annotations. Navigating through null is an error.\n
 *
 * Failures raise {@link FunctionCompilationException}; callers treat them as fatal.\n
 */
public final class AnonymousSourceCompiler {
  private static final int MAX_SOURCE_IN_MESSAGE = 80;

  private final JexlEngine jexl;

  public AnonymousSourceCompiler() {
    this(sandboxedEngine());
  }

  /** For callers that need a differently configured engine (tests, trusted deployments). */
  public AnonymousSourceCompiler(JexlEngine jexl) {
    this.jexl = Objects.requireNonNull(jexl, "jexl");
  }

  public static JexlEngine sandboxedEngine() {
    JexlFeatures features = new JexlFeatures()
        .sideEffect(false)
        .sideEffectGlobal(false)
        .newInstance(false)
        .loops(false)
        .pragma(false)
        .annotation(false)
        .lambda(true);
    return new JexlBuilder()
        .features(features)
        .permissions(JexlPermissions.RESTRICTED)
        .strict(true)
        .safe(false)
        .silent(false)
        .cache(256)
        .create();
  }

  /** Accepts either a {@link String} or UTF-8 {@code byte[]}. */
  public PhaseFunction defineAnonymous(Object source) {
    if (source instanceof String s) return compile(s);
    if (source instanceof byte[] b) return compile(b);
    throw new IllegalArgumentException("Function source must be a String or byte[], got: "
        + (source == null ? "null" : source.getClass().getName()));
  }

  public PhaseFunction compile(byte[] utf8) {
    Objects.requireNonNull(utf8, "utf8");
    return compile(new String(utf8, StandardCharsets.UTF_8));
  }

  public PhaseFunction compile(String text) {
    Objects.requireNonNull(text, "text");

    JexlScript script;
    try {
      script = jexl.createScript(text);
    } catch (JexlException e) {
      throw new FunctionCompilationException("Cannot parse function source '" + abbreviate(text) + "': " + e.getMessage(), e);
    }

    // A script only carries parameters when its whole body is a single lambda.
    if (script.getParameters() == null) {
      throw new FunctionCompilationException("Function source '" + abbreviate(text) + "' does not define a function");
    }
    return new JexlPhaseFunction(script, abbreviate(text));
  }

  private static String abbreviate(String text) {
    String s = text.strip();
    return s.length() <= MAX_SOURCE_IN_MESSAGE ? s : s.substring(0, MAX_SOURCE_IN_MESSAGE) + "...";
  }
}
