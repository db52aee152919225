package io.b2mash.schemaswitch.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tenancy settings bound from {@code tenancy.*}. Unset values fall back to the defaults applied in
 * the compact constructor.
 *
 * @param tenantNames tenants known to the registry, in bulk-run order
 * @param defaultSchema schema used when no tenant is active, and the clone template
 * @param persistentSchemas schemas appended to every search path (shared lookup tables)
 * @param excludedModels models that always live in the default schema
 * @param useSchemas one schema per tenant
 * @param useSqlClone build new tenant schemas from a dump of the default schema
 * @param useSingleSchema shared schema with a tenant column
 * @param seedAfterCreate run the seeder right after a tenant is created
 * @param parallelMigrations run bulk tasks on a worker pool
 * @param workerCount size of the worker pool
 * @param workerStaggerDelay pause between worker starts
 * @param retryBackoff pause before retrying a tenant after a connection timeout
 * @param migrationLocations Flyway locations for tenant migrations
 * @param undoLocations locations of {@code U<version>__*.sql} undo scripts
 * @param seedScript SQL script run by the seeder
 * @param migrationHistoryTables tables copied as data when cloning a schema
 * @param pgDumpCommand dump executable
 */
@ConfigurationProperties(prefix = "tenancy")
public record TenancyProperties(
    List<String> tenantNames,
    String defaultSchema,
    List<String> persistentSchemas,
    List<String> excludedModels,
    boolean useSchemas,
    boolean useSqlClone,
    boolean useSingleSchema,
    boolean seedAfterCreate,
    boolean parallelMigrations,
    Integer workerCount,
    Duration workerStaggerDelay,
    Duration retryBackoff,
    List<String> migrationLocations,
    List<String> undoLocations,
    String seedScript,
    List<String> migrationHistoryTables,
    String pgDumpCommand) {

  public static final String DEFAULT_SCHEMA = "public";

  public TenancyProperties {
    tenantNames = tenantNames == null ? List.of() : List.copyOf(tenantNames);
    defaultSchema =
        defaultSchema == null || defaultSchema.isBlank() ? DEFAULT_SCHEMA : defaultSchema;
    persistentSchemas = persistentSchemas == null ? List.of() : List.copyOf(persistentSchemas);
    excludedModels = excludedModels == null ? List.of() : List.copyOf(excludedModels);
    workerCount = workerCount == null ? 4 : workerCount;
    workerStaggerDelay = workerStaggerDelay == null ? Duration.ofSeconds(1) : workerStaggerDelay;
    retryBackoff = retryBackoff == null ? Duration.ofSeconds(1) : retryBackoff;
    migrationLocations =
        migrationLocations == null || migrationLocations.isEmpty()
            ? List.of("classpath:db/migration/tenant")
            : List.copyOf(migrationLocations);
    undoLocations =
        undoLocations == null || undoLocations.isEmpty()
            ? List.of("classpath:db/migration/tenant-undo")
            : List.copyOf(undoLocations);
    seedScript =
        seedScript == null || seedScript.isBlank() ? "classpath:db/seed/tenant.sql" : seedScript;
    migrationHistoryTables =
        migrationHistoryTables == null || migrationHistoryTables.isEmpty()
            ? List.of("flyway_schema_history")
            : List.copyOf(migrationHistoryTables);
    pgDumpCommand = pgDumpCommand == null || pgDumpCommand.isBlank() ? "pg_dump" : pgDumpCommand;
  }
}
