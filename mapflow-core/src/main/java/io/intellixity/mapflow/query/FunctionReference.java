package io.intellixity.mapflow.query;

import java.nio.charset.StandardCharsets;

/**
 * How a map or reduce phase obtains its callable logic.\n
 *
 * Shapes:\n
 * - {@link ModuleFunction}: a natively registered function, by module and name\n
 * - {@link InlineFunction}: an already constructed {@link PhaseFunction}\n
 * - {@link SourceText}: source of an anonymous native function, compiled locally\n
 * - {@link RemoteSourceText}: source run by the scripting runtime\n
 * - {@link RemoteFunctionName}: a function pre-registered in the scripting runtime\n
 * - {@link RemoteStoredSource}: scripting source stored under bucket/key, fetched before use\n
 * - {@link Unrecognized}: anything else; always rejected by validation\n
 *
 * Records keep whatever the caller supplied. Structural checks belong to query validation so a
 * malformed reference can be reported as a bad query term.\n
 */
public sealed interface FunctionReference {

  /** True when the referenced logic runs in the scripting runtime rather than natively. */
  boolean scripting();

  record ModuleFunction(String module, String function) implements FunctionReference {
    @Override public boolean scripting() { return false; }
  }

  record InlineFunction(PhaseFunction handle) implements FunctionReference {
    @Override public boolean scripting() { return false; }
  }

  record SourceText(String text) implements FunctionReference {
    public static SourceText of(byte[] utf8) {
      return new SourceText(utf8 == null ? null : new String(utf8, StandardCharsets.UTF_8));
    }

    @Override public boolean scripting() { return false; }
  }

  record RemoteSourceText(String text) implements FunctionReference {
    @Override public boolean scripting() { return true; }
  }

  record RemoteFunctionName(String name) implements FunctionReference {
    @Override public boolean scripting() { return true; }
  }

  record RemoteStoredSource(String bucket, String key) implements FunctionReference {
    @Override public boolean scripting() { return true; }
  }

  /** Catch-all for references that match none of the known shapes. */
  record Unrecognized(Object raw) implements FunctionReference {
    @Override public boolean scripting() { return false; }
  }

  static FunctionReference modfun(String module, String function) {
    return new ModuleFunction(module, function);
  }

  static FunctionReference qfun(PhaseFunction handle) {
    return new InlineFunction(handle);
  }

  static FunctionReference strfun(String text) {
    return new SourceText(text);
  }

  static FunctionReference jsanon(String text) {
    return new RemoteSourceText(text);
  }

  static FunctionReference jsanon(String bucket, String key) {
    return new RemoteStoredSource(bucket, key);
  }

  static FunctionReference jsfun(String name) {
    return new RemoteFunctionName(name);
  }
}
