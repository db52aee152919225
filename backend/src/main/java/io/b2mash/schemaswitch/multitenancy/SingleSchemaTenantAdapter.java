package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.model.TableModel;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All tenants share the default schema; rows carry a tenant column. Switching only records the
 * tenant id for the thread, and dropping a tenant deletes its rows from every tenant-scoped table.
 */
public class SingleSchemaTenantAdapter extends AbstractTenantAdapter {

  private static final Logger log = LoggerFactory.getLogger(SingleSchemaTenantAdapter.class);

  private final TenantIdMapper tenantIdMapper;

  public SingleSchemaTenantAdapter(
      TenantRegistry registry,
      TenantConnection connection,
      ModelRegistry models,
      TenantSeeder seeder,
      List<TenantSwitchListener> listeners,
      TenantIdMapper tenantIdMapper) {
    super(registry, connection, models, seeder, listeners);
    this.tenantIdMapper = tenantIdMapper;
  }

  /**
   * {@link TenantRegistry#MULTI_TENANT_DISABLED} while scoping is off for this thread, otherwise
   * the name of the active tenant.
   */
  @Override
  public String current() {
    requireInitialized();
    if (MultiTenancyToggle.isDisabled()) {
      return TenantRegistry.MULTI_TENANT_DISABLED;
    }
    String name = activeTenant();
    return name == null ? defaultTenant() : name;
  }

  /** The raw value for the tenant column, or {@code null} when no tenant is active. */
  public String currentTenantId() {
    return context.getTenantId();
  }

  @Override
  protected String activeTenant() {
    String tenantId = context.getTenantId();
    return tenantId == null ? null : tenantIdMapper.toName(tenantId);
  }

  @Override
  protected void resetContext() {
    context.clear();
  }

  @Override
  protected void connectTo(String tenant) {
    log.debug("Switch to {}", tenant);
    if (tenant == null) {
      resetContext();
      return;
    }
    if (TenantRegistry.MULTI_TENANT_DISABLED.equals(tenant)) {
      throw new IllegalArgumentException("Reserved tenant name: " + tenant);
    }
    context.setTenantId(tenantIdMapper.toId(tenant));
  }

  @Override
  protected void createTenant(String tenant) {
    // structure is shared, nothing to provision
  }

  @Override
  protected void importDatabaseSchema(String tenant) {
    // structure is shared
  }

  @Override
  protected void processExcludedModel(TableModel model) {
    // every table already lives in the default schema
  }

  /**
   * Deletes the tenant's rows table by table while the tenant is active. Tables are emptied in
   * reverse registration order, so models registered after the ones they reference go first.
   */
  @Override
  protected void dropTenant(String tenant) {
    runAs(
        tenant,
        () -> {
          String tenantId = currentTenantId();
          List<TableModel> scoped = new ArrayList<>(models.tenantScopedModels());
          Collections.reverse(scoped);
          for (TableModel model : scoped) {
            int deleted =
                connection.update(
                    "DELETE FROM "
                        + model.qualifiedTableName()
                        + " WHERE "
                        + SchemaNames.quote(model.tenantColumn())
                        + " = ?",
                    tenantId);
            log.debug("Deleted {} rows of {} for tenant {}", deleted, model.name(), tenant);
          }
        });
  }
}
