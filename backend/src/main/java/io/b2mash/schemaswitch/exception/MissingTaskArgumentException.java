package io.b2mash.schemaswitch.exception;

public class MissingTaskArgumentException extends TenancyException {

  public MissingTaskArgumentException(String task, String argument) {
    super("Task " + task + " requires argument '" + argument + "'");
  }
}
