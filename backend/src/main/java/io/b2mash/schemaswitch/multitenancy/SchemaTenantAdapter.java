package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.connection.SchemaExistenceCheck;
import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.exception.CreateTenantException;
import io.b2mash.schemaswitch.exception.TenantExistsException;
import io.b2mash.schemaswitch.exception.TenantNotFoundException;
import io.b2mash.schemaswitch.migration.MigrationRunner;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.model.TableModel;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.sql.SQLException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * One PostgreSQL schema per tenant. Switching rewrites the thread's search path to the tenant
 * followed by the persistent schemas, so unqualified names resolve in the tenant's schema before
 * the shared ones. New schemas get their structure by running every tenant migration.
 */
public class SchemaTenantAdapter extends AbstractTenantAdapter {

  private static final Logger log = LoggerFactory.getLogger(SchemaTenantAdapter.class);
  private static final String DUPLICATE_SCHEMA = "42P06";

  protected final SchemaExistenceCheck schemaExistenceCheck;
  protected final MigrationRunner migrationRunner;

  public SchemaTenantAdapter(
      TenantRegistry registry,
      TenantConnection connection,
      ModelRegistry models,
      TenantSeeder seeder,
      List<TenantSwitchListener> listeners,
      SchemaExistenceCheck schemaExistenceCheck,
      MigrationRunner migrationRunner) {
    super(registry, connection, models, seeder, listeners);
    this.schemaExistenceCheck = schemaExistenceCheck;
    this.migrationRunner = migrationRunner;
  }

  @Override
  protected void resetContext() {
    context.clear();
    connection.setSchemaSearchPath(searchPathFor(null));
  }

  @Override
  protected void connectTo(String tenant) {
    if (tenant == null) {
      resetContext();
      return;
    }
    if (!SchemaNames.isValid(tenant)) {
      throw new TenantNotFoundException(tenant, "Invalid schema name \"" + tenant + "\"");
    }
    SearchPath attempted = searchPathFor(tenant);
    boolean exists;
    try {
      exists = schemaExistenceCheck.exists(tenant);
    } catch (DataAccessException e) {
      throw new TenantNotFoundException(tenant, notFoundMessage(tenant, attempted), e);
    }
    if (!exists) {
      throw new TenantNotFoundException(tenant, notFoundMessage(tenant, attempted));
    }
    context.setTenantId(tenant);
    connection.setSchemaSearchPath(attempted);
    log.debug("Switched to tenant {} with search path {}", tenant, attempted);
  }

  @Override
  protected void createTenant(String tenant) {
    String quoted = SchemaNames.quote(tenant);
    if (schemaExistenceCheck.exists(tenant)) {
      throw new TenantExistsException(tenant);
    }
    try {
      connection.execute("CREATE SCHEMA " + quoted);
    } catch (DataAccessException e) {
      if (isDuplicateSchema(e)) {
        throw new TenantExistsException(tenant, e);
      }
      throw new CreateTenantException(tenant, e);
    } finally {
      schemaExistenceCheck.evict(tenant);
    }
    log.info("Created schema {}", tenant);
  }

  @Override
  protected void importDatabaseSchema(String tenant) {
    migrationRunner.migrate(tenant);
  }

  @Override
  protected void dropTenant(String tenant) {
    if (!SchemaNames.isValid(tenant) || !schemaExistenceCheck.exists(tenant)) {
      throw TenantNotFoundException.of(tenant);
    }
    try {
      connection.execute("DROP SCHEMA " + SchemaNames.quote(tenant) + " CASCADE");
    } finally {
      schemaExistenceCheck.evict(tenant);
    }
    if (tenant.equals(activeTenant())) {
      reset();
    }
  }

  /** Excluded tables always resolve to the default schema, whatever the search path says. */
  @Override
  protected void processExcludedModel(TableModel model) {
    model.pinToSchema(defaultTenant());
    log.debug("Pinned excluded model {} to {}", model.name(), model.qualifiedTableName());
  }

  @Override
  public String schemaFor(String tenant) {
    return tenant == null ? defaultTenant() : tenant;
  }

  @Override
  public SearchPath searchPathFor(String tenant) {
    return SearchPath.of(schemaFor(tenant), registry.persistentSchemas());
  }

  private static String notFoundMessage(String tenant, SearchPath attempted) {
    return "One of the following schema(s) is invalid: \"" + tenant + "\" " + attempted;
  }

  private static boolean isDuplicateSchema(DataAccessException e) {
    return e.getMostSpecificCause() instanceof SQLException sqlException
        && DUPLICATE_SCHEMA.equals(sqlException.getSQLState());
  }
}
