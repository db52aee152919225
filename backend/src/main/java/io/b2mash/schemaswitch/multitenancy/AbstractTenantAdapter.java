package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.exception.CreateTenantException;
import io.b2mash.schemaswitch.exception.DropTenantException;
import io.b2mash.schemaswitch.migration.TenantSeeder;
import io.b2mash.schemaswitch.model.ModelRegistry;
import io.b2mash.schemaswitch.model.TableModel;
import io.b2mash.schemaswitch.registry.TenancyStrategy;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Shared lifecycle for all strategies. Subclasses supply the strategy-specific steps ({@link
 * #connectTo}, {@link #resetContext}, {@link #createTenant}, {@link #importDatabaseSchema}, {@link
 * #dropTenant}, {@link #processExcludedModel}); this class owns the per-thread context, switch
 * listeners, the scoped restore and the translation of database errors.
 */
public abstract class AbstractTenantAdapter implements TenantAdapter {

  private static final Logger log = LoggerFactory.getLogger(AbstractTenantAdapter.class);

  protected final TenantRegistry registry;
  protected final TenantConnection connection;
  protected final ModelRegistry models;
  protected final TenantContext context = new TenantContext();

  private final TenantSeeder seeder;
  private final List<TenantSwitchListener> listeners;
  private volatile boolean initialized;

  protected AbstractTenantAdapter(
      TenantRegistry registry,
      TenantConnection connection,
      ModelRegistry models,
      TenantSeeder seeder,
      List<TenantSwitchListener> listeners) {
    this.registry = registry;
    this.connection = connection;
    this.models = models;
    this.seeder = seeder;
    this.listeners = List.copyOf(listeners);
  }

  @Override
  public synchronized void init() {
    if (initialized) {
      return;
    }
    processExcludedModels();
    initialized = true;
    reset();
    log.info(
        "Initialised {} tenancy with default schema {} and {} registered tenants",
        strategy(),
        defaultTenant(),
        registry.tenantNames().size());
  }

  @Override
  public String current() {
    requireInitialized();
    String tenant = context.getTenantId();
    return tenant == null ? defaultTenant() : tenant;
  }

  @Override
  public void switchTenant(String tenant) {
    requireInitialized();
    String from = activeTenant();
    for (TenantSwitchListener listener : listeners) {
      listener.beforeSwitch(from, tenant);
    }
    connectTo(tenant);
    for (TenantSwitchListener listener : listeners) {
      listener.afterSwitch(from, tenant);
    }
  }

  @Override
  public void reset() {
    String from = activeTenant();
    resetContext();
    for (TenantSwitchListener listener : listeners) {
      listener.afterSwitch(from, null);
    }
  }

  @Override
  public void runAs(String tenant, Runnable work) {
    callAs(
        tenant,
        () -> {
          work.run();
          return null;
        });
  }

  @Override
  public <T> T callAs(String tenant, Supplier<T> work) {
    requireInitialized();
    String previous = activeTenant();
    switchTenant(tenant);
    try {
      return work.get();
    } finally {
      restore(previous);
    }
  }

  @Override
  public void create(String tenant) {
    requireInitialized();
    try {
      createTenant(tenant);
      runAs(
          tenant,
          () -> {
            importDatabaseSchema(tenant);
            processExcludedModels();
            if (registry.seedAfterCreate()) {
              seeder.seed(tenant);
            }
          });
    } catch (DataAccessException e) {
      throw new CreateTenantException(tenant, e);
    }
    log.info("Created tenant {}", tenant);
  }

  @Override
  public void drop(String tenant) {
    requireInitialized();
    try {
      dropTenant(tenant);
    } catch (DataAccessException e) {
      log.error("Failed to drop tenant {}", tenant, e);
      throw new DropTenantException(tenant, e);
    }
    log.info("Dropped tenant {}", tenant);
  }

  @Override
  public void seed(String tenant) {
    runAs(tenant, () -> seeder.seed(tenant));
  }

  @Override
  public String schemaFor(String tenant) {
    return defaultTenant();
  }

  @Override
  public SearchPath searchPathFor(String tenant) {
    return SearchPath.of(defaultTenant(), registry.persistentSchemas());
  }

  @Override
  public String defaultTenant() {
    return registry.defaultSchema();
  }

  @Override
  public TenancyStrategy strategy() {
    return registry.strategy();
  }

  public boolean isInitialized() {
    return initialized;
  }

  /** The tenant name active on this thread, {@code null} for the default. */
  protected String activeTenant() {
    return context.getTenantId();
  }

  protected void requireInitialized() {
    if (!initialized) {
      throw new IllegalStateException(getClass().getSimpleName() + " has not been initialised");
    }
  }

  private void processExcludedModels() {
    for (String name : registry.excludedModels()) {
      processExcludedModel(models.require(name));
    }
  }

  private void restore(String previous) {
    try {
      switchTenant(previous);
    } catch (RuntimeException e) {
      log.warn("Could not restore tenant {}, resetting to default", previous, e);
      reset();
    }
  }

  /** Makes {@code tenant} active; {@code null} means {@link #resetContext()}. */
  protected abstract void connectTo(String tenant);

  protected abstract void resetContext();

  protected abstract void createTenant(String tenant);

  protected abstract void importDatabaseSchema(String tenant);

  protected abstract void dropTenant(String tenant);

  protected abstract void processExcludedModel(TableModel model);
}
