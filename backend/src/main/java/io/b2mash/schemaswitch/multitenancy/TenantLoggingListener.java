package io.b2mash.schemaswitch.multitenancy;

import org.slf4j.MDC;

/** Keeps the {@code tenantId} MDC entry in step with the active tenant. */
public class TenantLoggingListener implements TenantSwitchListener {

  static final String MDC_TENANT_ID = "tenantId";

  @Override
  public void afterSwitch(String fromTenant, String toTenant) {
    if (toTenant == null) {
      MDC.remove(MDC_TENANT_ID);
    } else {
      MDC.put(MDC_TENANT_ID, toTenant);
    }
  }
}
