package io.b2mash.schemaswitch.exception;

public class CreateTenantException extends TenancyException {

  private final String tenant;

  public CreateTenantException(String tenant, Throwable cause) {
    super("Failed to create tenant \"" + tenant + "\": " + cause.getMessage(), cause);
    this.tenant = tenant;
  }

  public String getTenant() {
    return tenant;
  }
}
