package io.b2mash.schemaswitch.multitenancy;

/**
 * Per-thread holder for the active tenant. Each adapter owns one instance, so two adapters (or two
 * worker threads) never see each other's tenant.
 */
public final class TenantContext {

  private final ThreadLocal<String> currentTenant = new ThreadLocal<>();

  public void setTenantId(String tenantId) {
    if (tenantId == null) {
      currentTenant.remove();
    } else {
      currentTenant.set(tenantId);
    }
  }

  public String getTenantId() {
    return currentTenant.get();
  }

  public void clear() {
    currentTenant.remove();
  }
}
