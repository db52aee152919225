package io.b2mash.schemaswitch.migration;

import io.b2mash.schemaswitch.exception.TenantMigrationException;
import io.b2mash.schemaswitch.multitenancy.SchemaNames;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.configuration.FluentConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Flyway-backed migrations for tenant schemas. Forward migrations are plain Flyway runs scoped to
 * the schema. Reverting uses undo scripts named {@code U<version>__<description>.sql}: each script
 * runs in its own transaction together with the removal of the matching history row.
 */
public class FlywayMigrationRunner implements MigrationRunner {

  private static final Logger log = LoggerFactory.getLogger(FlywayMigrationRunner.class);
  static final String HISTORY_TABLE = "flyway_schema_history";

  private final DataSource migrationDataSource;
  private final List<String> locations;
  private final List<String> undoLocations;
  private final JdbcTemplate migrationJdbc;
  private final TransactionTemplate migrationTxTemplate;
  private final ResourcePatternResolver resourceResolver;

  public FlywayMigrationRunner(
      DataSource migrationDataSource, List<String> locations, List<String> undoLocations) {
    this(
        migrationDataSource, locations, undoLocations, new PathMatchingResourcePatternResolver());
  }

  FlywayMigrationRunner(
      DataSource migrationDataSource,
      List<String> locations,
      List<String> undoLocations,
      ResourcePatternResolver resourceResolver) {
    this.migrationDataSource = migrationDataSource;
    this.locations = List.copyOf(locations);
    this.undoLocations = List.copyOf(undoLocations);
    this.migrationJdbc = new JdbcTemplate(migrationDataSource);
    this.resourceResolver = resourceResolver;

    var txManager = new DataSourceTransactionManager(migrationDataSource);
    this.migrationTxTemplate = new TransactionTemplate(txManager);
    this.migrationTxTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public int migrate(String schema) {
    return runFlyway(schema, configure(schema));
  }

  @Override
  public int migrateUp(String schema, String version) {
    return runFlyway(schema, configure(schema).target(version));
  }

  @Override
  public int migrateDown(String schema, String version) {
    MigrationVersion target = MigrationVersion.fromVersion(version);
    List<String> newer =
        appliedVersionsNewestFirst(schema).stream()
            .filter(applied -> MigrationVersion.fromVersion(applied).compareTo(target) > 0)
            .toList();
    newer.forEach(applied -> undo(schema, applied));
    log.info("Reverted schema {} to version {}, {} undone", schema, version, newer.size());
    return newer.size();
  }

  @Override
  public int rollback(String schema, int steps) {
    if (steps < 1) {
      throw new IllegalArgumentException("Rollback steps must be positive: " + steps);
    }
    List<String> applied = appliedVersionsNewestFirst(schema);
    List<String> reverted = applied.subList(0, Math.min(steps, applied.size()));
    reverted.forEach(version -> undo(schema, version));
    log.info("Rolled back schema {} by {} migrations", schema, reverted.size());
    return reverted.size();
  }

  FluentConfiguration configure(String schema) {
    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations(locations.toArray(String[]::new))
        .schemas(SchemaNames.validate(schema))
        .baselineOnMigrate(true);
  }

  int runFlyway(String schema, FluentConfiguration configuration) {
    try {
      var result = configuration.load().migrate();
      log.info("Migrated schema {}, {} migrations applied", schema, result.migrationsExecuted);
      return result.migrationsExecuted;
    } catch (FlywayException e) {
      throw new TenantMigrationException("Migration failed for schema " + schema, e);
    }
  }

  List<String> appliedVersionsNewestFirst(String schema) {
    return migrationJdbc.queryForList(appliedVersionsQuery(schema), String.class);
  }

  // BASELINE and SCHEMA rows are Flyway markers without an undo script
  static String appliedVersionsQuery(String schema) {
    return "SELECT version FROM "
        + SchemaNames.quote(schema)
        + "."
        + HISTORY_TABLE
        + " WHERE success AND version IS NOT NULL AND type NOT IN ('BASELINE', 'SCHEMA')"
        + " ORDER BY installed_rank DESC";
  }

  private void undo(String schema, String version) {
    Resource script = findUndoScript(version);
    migrationTxTemplate.executeWithoutResult(
        status -> {
          // SET LOCAL only lasts until the transaction ends
          migrationJdbc.execute("SET LOCAL search_path TO " + SchemaNames.quote(schema));
          migrationJdbc.execute(
              (ConnectionCallback<Void>)
                  connection -> {
                    ScriptUtils.executeSqlScript(
                        connection, new EncodedResource(script, StandardCharsets.UTF_8));
                    return null;
                  });
          migrationJdbc.update(
              "DELETE FROM "
                  + SchemaNames.quote(schema)
                  + "."
                  + HISTORY_TABLE
                  + " WHERE version = ?",
              version);
        });
    log.info("Undid migration {} on schema {} using {}", version, schema, script.getFilename());
  }

  Resource findUndoScript(String version) {
    for (String location : undoLocations) {
      try {
        Resource[] matches = resourceResolver.getResources(location + "/U" + version + "__*.sql");
        for (Resource match : matches) {
          if (match.exists()) {
            return match;
          }
        }
      } catch (IOException e) {
        throw new TenantMigrationException("Cannot scan undo location " + location, e);
      }
    }
    throw new TenantMigrationException(
        "No undo script U" + version + "__*.sql found in " + undoLocations);
  }
}
