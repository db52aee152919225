package io.b2mash.schemaswitch.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the default schema on startup. It is the home of excluded models, the shared schema in
 * single-schema mode and the template cloned for new tenants.
 */
@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway defaultSchemaFlyway(
      @Qualifier("migrationDataSource") DataSource migrationDataSource,
      TenancyProperties properties) {
    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations(properties.migrationLocations().toArray(String[]::new))
        .schemas(properties.defaultSchema())
        .baselineOnMigrate(true)
        .load();
  }
}
