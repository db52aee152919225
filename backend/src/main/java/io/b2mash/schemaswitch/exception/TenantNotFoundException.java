package io.b2mash.schemaswitch.exception;

public class TenantNotFoundException extends TenancyException {

  private final String tenant;

  public TenantNotFoundException(String tenant, String detail) {
    super(detail);
    this.tenant = tenant;
  }

  public TenantNotFoundException(String tenant, String detail, Throwable cause) {
    super(detail, cause);
    this.tenant = tenant;
  }

  public static TenantNotFoundException of(String tenant) {
    return new TenantNotFoundException(tenant, "Tenant \"" + tenant + "\" does not exist");
  }

  public String getTenant() {
    return tenant;
  }
}
