package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.clone.SchemaDumper;
import io.b2mash.schemaswitch.connection.SchemaExistenceCheck;
import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.migration.MigrationRunner;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds and initialises the one adapter matching the registry's strategy. */
public class TenantAdapterFactory {

  private static final Logger log = LoggerFactory.getLogger(TenantAdapterFactory.class);

  private final TenantConnection connection;
  private final ModelRegistry models;
  private final TenantSeeder seeder;
  private final List<TenantSwitchListener> listeners;
  private final SchemaExistenceCheck schemaExistenceCheck;
  private final MigrationRunner migrationRunner;
  private final SchemaDumper schemaDumper;
  private final List<String> migrationHistoryTables;
  private final TenantIdMapper tenantIdMapper;

  public TenantAdapterFactory(
      TenantConnection connection,
      ModelRegistry models,
      TenantSeeder seeder,
      List<TenantSwitchListener> listeners,
      SchemaExistenceCheck schemaExistenceCheck,
      MigrationRunner migrationRunner,
      SchemaDumper schemaDumper,
      List<String> migrationHistoryTables,
      TenantIdMapper tenantIdMapper) {
    this.connection = connection;
    this.models = models;
    this.seeder = seeder;
    this.listeners = List.copyOf(listeners);
    this.schemaExistenceCheck = schemaExistenceCheck;
    this.migrationRunner = migrationRunner;
    this.schemaDumper = schemaDumper;
    this.migrationHistoryTables = List.copyOf(migrationHistoryTables);
    this.tenantIdMapper = tenantIdMapper;
  }

  public TenantAdapter create(TenantRegistry registry) {
    AbstractTenantAdapter adapter =
        switch (registry.strategy()) {
          case SINGLE_SCHEMA ->
              new SingleSchemaTenantAdapter(
                  registry, connection, models, seeder, listeners, tenantIdMapper);
          case SQL_CLONE ->
              new SqlCloneSchemaTenantAdapter(
                  registry,
                  connection,
                  models,
                  seeder,
                  listeners,
                  schemaExistenceCheck,
                  migrationRunner,
                  schemaDumper,
                  migrationHistoryTables);
          case SCHEMA ->
              new SchemaTenantAdapter(
                  registry,
                  connection,
                  models,
                  seeder,
                  listeners,
                  schemaExistenceCheck,
                  migrationRunner);
          case DISABLED -> new DefaultTenantAdapter(registry, connection, models, listeners);
        };
    adapter.init();
    log.info("Using {} for {} tenancy", adapter.getClass().getSimpleName(), registry.strategy());
    return adapter;
  }
}
