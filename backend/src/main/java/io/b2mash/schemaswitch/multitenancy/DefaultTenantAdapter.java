package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.model.TableModel;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.util.List;

/**
 * Tenancy switched off. Switches are remembered so {@link #current()} and scoped restores behave,
 * but nothing is created, dropped or isolated.
 */
public class DefaultTenantAdapter extends AbstractTenantAdapter {

  public DefaultTenantAdapter(
      TenantRegistry registry,
      TenantConnection connection,
      ModelRegistry models,
      List<TenantSwitchListener> listeners) {
    super(registry, connection, models, TenantSeeder.NONE, listeners);
  }

  @Override
  protected void resetContext() {
    context.clear();
  }

  @Override
  protected void connectTo(String tenant) {
    context.setTenantId(tenant);
  }

  @Override
  protected void createTenant(String tenant) {}

  @Override
  protected void importDatabaseSchema(String tenant) {}

  @Override
  protected void dropTenant(String tenant) {}

  @Override
  protected void processExcludedModel(TableModel model) {}
}
