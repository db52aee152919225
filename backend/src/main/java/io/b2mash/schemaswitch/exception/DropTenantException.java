package io.b2mash.schemaswitch.exception;

public class DropTenantException extends TenancyException {

  private final String tenant;

  public DropTenantException(String tenant, Throwable cause) {
    super("Failed to drop tenant \"" + tenant + "\": " + cause.getMessage(), cause);
    this.tenant = tenant;
  }

  public String getTenant() {
    return tenant;
  }
}
