package io.b2mash.schemaswitch.connection;

import io.b2mash.schemaswitch.multitenancy.SearchPath;

/**
 * The slice of the host connection layer the adapters need. Search paths are thread-confined:
 * setting one affects only statements issued later from the same thread.
 */
public interface TenantConnection {

  /** Executes one or more raw SQL statements as a single batch. */
  void execute(String sql);

  /** Executes a parameterised update and returns the affected row count. */
  int update(String sql, Object... args);

  SearchPath schemaSearchPath();

  void setSchemaSearchPath(SearchPath searchPath);

  ConnectionSettings settings();
}
