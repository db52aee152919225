package io.b2mash.schemaswitch.migration;

public interface MigrationRunner {

  /** Applies every pending migration. Returns the number applied. */
  int migrate(String schema);

  /** Applies pending migrations up to and including {@code version}. */
  int migrateUp(String schema, String version);

  /** Reverts applied migrations newer than {@code version}, newest first. */
  int migrateDown(String schema, String version);

  /** Reverts the {@code steps} most recently applied migrations. */
  int rollback(String schema, int steps);
}
