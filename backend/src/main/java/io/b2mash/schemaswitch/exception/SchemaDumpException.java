package io.b2mash.schemaswitch.exception;

public class SchemaDumpException extends TenancyException {

  public SchemaDumpException(String message) {
    super(message);
  }

  public SchemaDumpException(String message, Throwable cause) {
    super(message, cause);
  }
}
