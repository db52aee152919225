package io.b2mash.schemaswitch.exception;

public class TenantExistsException extends TenancyException {

  private final String tenant;

  public TenantExistsException(String tenant) {
    super("Tenant \"" + tenant + "\" already exists");
    this.tenant = tenant;
  }

  public TenantExistsException(String tenant, Throwable cause) {
    super("Tenant \"" + tenant + "\" already exists", cause);
    this.tenant = tenant;
  }

  public String getTenant() {
    return tenant;
  }
}
