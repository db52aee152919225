package io.b2mash.schemaswitch.exception;

public class TenantMigrationException extends TenancyException {

  public TenantMigrationException(String message) {
    super(message);
  }

  public TenantMigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
