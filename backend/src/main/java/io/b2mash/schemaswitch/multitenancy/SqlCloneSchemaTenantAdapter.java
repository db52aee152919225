package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.clone.SchemaDumper;
import io.b2mash.schemaswitch.clone.SearchPathPatcher;
import io.b2mash.schemaswitch.connection.ConnectionSettings;
import io.b2mash.schemaswitch.connection.SchemaExistenceCheck;
import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.migration.MigrationRunner;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema per tenant, but new schemas are cloned from a structure-only dump of the default schema
 * instead of replaying every migration. The migration history rows are copied as well, so the new
 * schema reports the same migration state as the template.
 */
public class SqlCloneSchemaTenantAdapter extends SchemaTenantAdapter {

  private static final Logger log = LoggerFactory.getLogger(SqlCloneSchemaTenantAdapter.class);

  private final SchemaDumper schemaDumper;
  private final List<String> migrationHistoryTables;

  public SqlCloneSchemaTenantAdapter(
      TenantRegistry registry,
      TenantConnection connection,
      ModelRegistry models,
      TenantSeeder seeder,
      List<TenantSwitchListener> listeners,
      SchemaExistenceCheck schemaExistenceCheck,
      MigrationRunner migrationRunner,
      SchemaDumper schemaDumper,
      List<String> migrationHistoryTables) {
    super(
        registry,
        connection,
        models,
        seeder,
        listeners,
        schemaExistenceCheck,
        migrationRunner);
    this.schemaDumper = schemaDumper;
    this.migrationHistoryTables = List.copyOf(migrationHistoryTables);
  }

  @Override
  protected void importDatabaseSchema(String tenant) {
    cloneSchema(tenant);
    copyMigrationHistory(tenant);
  }

  private void cloneSchema(String tenant) {
    ConnectionSettings settings = connection.settings();
    String dump = schemaDumper.dumpSchema(defaultTenant(), settings);
    connection.execute(SearchPathPatcher.patch(dump, tenant, defaultTenant()));
    log.info("Cloned structure of {} into {}", defaultTenant(), tenant);
  }

  private void copyMigrationHistory(String tenant) {
    if (migrationHistoryTables.isEmpty()) {
      return;
    }
    ConnectionSettings settings = connection.settings();
    String dump = schemaDumper.dumpTableData(defaultTenant(), migrationHistoryTables, settings);
    connection.execute(SearchPathPatcher.patch(dump, tenant, defaultTenant()));
    log.info("Copied {} from {} into {}", migrationHistoryTables, defaultTenant(), tenant);
  }
}
