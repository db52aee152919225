package io.b2mash.schemaswitch.config;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.schemaswitch.clone.CommandEnvironment;
import io.b2mash.schemaswitch.clone.PgDumpSchemaDumper;
import io.b2mash.schemaswitch.clone.ProcessCommandExecutor;
import io.b2mash.schemaswitch.clone.SchemaDumper;
import io.b2mash.schemaswitch.connection.CachingSchemaExistenceCheck;
import io.b2mash.schemaswitch.connection.ConnectionSettings;
import io.b2mash.schemaswitch.connection.JdbcTenantConnection;
import io.b2mash.schemaswitch.connection.SchemaExistenceCheck;
import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.migration.FlywayMigrationRunner;
import io.b2mash.schemaswitch.migration.MigrationRunner;
import io.b2mash.schemaswitch.migration.SqlScriptTenantSeeder;
import io.b2mash.schemaswitch.migration.TenantMigrator;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.model.TableModel;
import io.b2mash.schemaswitch.multitenancy.SearchPath;
import io.b2mash.schemaswitch.multitenancy.TenantAdapter;
import io.b2mash.schemaswitch.multitenancy.TenantAdapterFactory;
import io.b2mash.schemaswitch.multitenancy.TenantIdMapper;
import io.b2mash.schemaswitch.multitenancy.TenantLoggingListener;
import io.b2mash.schemaswitch.multitenancy.TenantSwitchListener;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import io.b2mash.schemaswitch.task.FailureClassifier;
import io.b2mash.schemaswitch.task.TenantTaskCommandRunner;
import io.b2mash.schemaswitch.task.TenantTaskRunner;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the tenancy engine. Applications customise it by declaring their own {@link
 * SchemaExistenceCheck}, {@link TenantIdMapper}, {@link TenantSwitchListener} or {@link TableModel}
 * beans.
 */
@Configuration
@EnableConfigurationProperties(TenancyProperties.class)
public class TenancyConfig {

  @Bean
  TenantRegistry tenantRegistry(TenancyProperties properties) {
    return TenantRegistry.from(properties);
  }

  @Bean
  TenantConnection tenantConnection(
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource,
      TenantRegistry registry) {
    var settings =
        ConnectionSettings.fromJdbcUrl(
            migrationDataSource.getJdbcUrl(),
            migrationDataSource.getUsername(),
            migrationDataSource.getPassword());
    return new JdbcTenantConnection(
        new JdbcTemplate(migrationDataSource),
        settings,
        SearchPath.of(registry.defaultSchema(), registry.persistentSchemas()));
  }

  @Bean
  ModelRegistry modelRegistry(ObjectProvider<TableModel> tableModels) {
    return new ModelRegistry(tableModels.orderedStream().toList());
  }

  @Bean
  MigrationRunner migrationRunner(
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource,
      TenancyProperties properties) {
    return new FlywayMigrationRunner(
        migrationDataSource, properties.migrationLocations(), properties.undoLocations());
  }

  @Bean
  TenantSeeder tenantSeeder(
      TenantConnection tenantConnection,
      TenancyProperties properties,
      ResourceLoader resourceLoader) {
    return new SqlScriptTenantSeeder(
        tenantConnection, resourceLoader.getResource(properties.seedScript()));
  }

  @Bean
  SchemaDumper schemaDumper(TenancyProperties properties) {
    return new PgDumpSchemaDumper(
        properties.pgDumpCommand(), new ProcessCommandExecutor(), CommandEnvironment.fromSystem());
  }

  @Bean
  TenantLoggingListener tenantLoggingListener() {
    return new TenantLoggingListener();
  }

  @Bean
  TenantAdapterFactory tenantAdapterFactory(
      TenantConnection tenantConnection,
      ModelRegistry modelRegistry,
      TenantSeeder tenantSeeder,
      ObjectProvider<TenantSwitchListener> listeners,
      ObjectProvider<SchemaExistenceCheck> schemaExistenceCheck,
      MigrationRunner migrationRunner,
      SchemaDumper schemaDumper,
      ObjectProvider<TenantIdMapper> tenantIdMapper,
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource,
      TenancyProperties properties) {
    return new TenantAdapterFactory(
        tenantConnection,
        modelRegistry,
        tenantSeeder,
        listeners.orderedStream().toList(),
        schemaExistenceCheck.getIfAvailable(
            () ->
                new CachingSchemaExistenceCheck(
                    new JdbcTemplate(migrationDataSource), Duration.ofMinutes(10))),
        migrationRunner,
        schemaDumper,
        properties.migrationHistoryTables(),
        tenantIdMapper.getIfAvailable(() -> TenantIdMapper.IDENTITY));
  }

  @Bean
  TenantAdapter tenantAdapter(TenantAdapterFactory factory, TenantRegistry registry) {
    return factory.create(registry);
  }

  @Bean
  TenantMigrator tenantMigrator(TenantAdapter tenantAdapter, MigrationRunner migrationRunner) {
    return new TenantMigrator(tenantAdapter, migrationRunner);
  }

  @Bean
  TenantTaskRunner tenantTaskRunner(
      TenantRegistry registry, TenantAdapter tenantAdapter, TenantMigrator tenantMigrator) {
    return new TenantTaskRunner(registry, tenantAdapter, tenantMigrator, new FailureClassifier());
  }

  @Bean
  TenantTaskCommandRunner tenantTaskCommandRunner(TenantTaskRunner tenantTaskRunner) {
    return new TenantTaskCommandRunner(tenantTaskRunner);
  }
}
