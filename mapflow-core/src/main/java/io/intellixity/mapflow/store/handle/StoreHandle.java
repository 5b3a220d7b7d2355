package io.intellixity.mapflow.store.handle;

/**
 * A store backend as handed to a {@code KeyValueStore}: the native client plus where to look in it.\n
 *
 * The id names the backend in log lines and store errors. The namespace is backend specific (a
 * Mongo database, a SQL schema) and may be null where the backend has a usable default.\n
 */
public interface StoreHandle<TClient> {
  String id();

  TClient client();

  String namespace();
}
