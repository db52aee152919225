package io.b2mash.schemaswitch.migration;

import io.b2mash.schemaswitch.multitenancy.TenantAdapter;

/**
 * Runs migration primitives for one tenant while that tenant is active, against the schema that
 * holds its tables.
 */
public class TenantMigrator {

  private final TenantAdapter tenantAdapter;
  private final MigrationRunner migrationRunner;

  public TenantMigrator(TenantAdapter tenantAdapter, MigrationRunner migrationRunner) {
    this.tenantAdapter = tenantAdapter;
    this.migrationRunner = migrationRunner;
  }

  public int migrate(String tenant) {
    return tenantAdapter.callAs(
        tenant, () -> migrationRunner.migrate(tenantAdapter.schemaFor(tenant)));
  }

  public int migrateUp(String tenant, String version) {
    return tenantAdapter.callAs(
        tenant, () -> migrationRunner.migrateUp(tenantAdapter.schemaFor(tenant), version));
  }

  public int migrateDown(String tenant, String version) {
    return tenantAdapter.callAs(
        tenant, () -> migrationRunner.migrateDown(tenantAdapter.schemaFor(tenant), version));
  }

  public int rollback(String tenant, int steps) {
    return tenantAdapter.callAs(
        tenant, () -> migrationRunner.rollback(tenantAdapter.schemaFor(tenant), steps));
  }

  /** Rolls back {@code steps} migrations and applies everything pending again. */
  public int redo(String tenant, int steps) {
    return tenantAdapter.callAs(
        tenant,
        () -> {
          String schema = tenantAdapter.schemaFor(tenant);
          migrationRunner.rollback(schema, steps);
          return migrationRunner.migrate(schema);
        });
  }
}
