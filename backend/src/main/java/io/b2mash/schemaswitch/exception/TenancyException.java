package io.b2mash.schemaswitch.exception;

public class TenancyException extends RuntimeException {

  public TenancyException(String message) {
    super(message);
  }

  public TenancyException(String message, Throwable cause) {
    super(message, cause);
  }
}
