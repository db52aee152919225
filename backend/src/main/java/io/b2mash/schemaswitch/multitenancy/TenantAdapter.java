package io.b2mash.schemaswitch.multitenancy;

import io.b2mash.schemaswitch.registry.TenancyStrategy;
import java.util.function.Supplier;

/**
 * The tenancy contract every strategy implements. Application code and the bulk task runner only
 * talk to this interface; which strategy sits behind it is decided once, at startup.
 *
 * <p>The active tenant is tracked per thread. {@link #runAs} and {@link #callAs} restore the tenant
 * that was active before the call on every exit path, including exceptions.
 */
public interface TenantAdapter {

  /** The active tenant, or {@link #defaultTenant()} when none is selected. */
  String current();

  /**
   * Makes {@code tenant} active for this thread until the next switch. {@code null} resets to the
   * default tenant.
   *
   * @throws io.b2mash.schemaswitch.exception.TenantNotFoundException if the tenant does not exist
   */
  void switchTenant(String tenant);

  /** Runs {@code work} as {@code tenant}, then restores the previously active tenant. */
  void runAs(String tenant, Runnable work);

  /** Like {@link #runAs} but returns the work's result. */
  <T> T callAs(String tenant, Supplier<T> work);

  /** Back to the default tenant and the default search path. */
  void reset();

  /**
   * Provisions a tenant and imports its structure.
   *
   * @throws io.b2mash.schemaswitch.exception.TenantExistsException if it is already present
   */
  void create(String tenant);

  /**
   * Irreversibly removes the tenant's data.
   *
   * @throws io.b2mash.schemaswitch.exception.TenantNotFoundException if it is absent
   * @throws io.b2mash.schemaswitch.exception.DropTenantException if the database refuses
   */
  void drop(String tenant);

  /** Loads seed data into the tenant. */
  void seed(String tenant);

  /** The schema holding {@code tenant}'s tables. */
  String schemaFor(String tenant);

  /** The search path statements run under while {@code tenant} is active. */
  SearchPath searchPathFor(String tenant);

  String defaultTenant();

  TenancyStrategy strategy();

  /** Processes excluded models and resets. Must be called once before anything else. */
  void init();
}
