package io.b2mash.schemaswitch.multitenancy;

import org.hibernate.context.spi.CurrentTenantIdentifierResolver;

public class TenantIdentifierResolver implements CurrentTenantIdentifierResolver<String> {

  private final TenantAdapter tenantAdapter;

  public TenantIdentifierResolver(TenantAdapter tenantAdapter) {
    this.tenantAdapter = tenantAdapter;
  }

  @Override
  public String resolveCurrentTenantIdentifier() {
    return tenantAdapter.current();
  }

  @Override
  public boolean validateExistingCurrentSessions() {
    return true;
  }

  @Override
  public boolean isRoot(String tenantId) {
    return tenantAdapter.defaultTenant().equals(tenantId);
  }
}
