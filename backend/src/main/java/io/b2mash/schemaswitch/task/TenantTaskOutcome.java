package io.b2mash.schemaswitch.task;

public record TenantTaskOutcome(
    String tenant, Status status, FailureKind failureKind, int attempts, String message) {

  public enum Status {
    SUCCEEDED,
    FAILED
  }

  public static TenantTaskOutcome succeeded(String tenant, int attempts) {
    return new TenantTaskOutcome(tenant, Status.SUCCEEDED, null, attempts, null);
  }

  public static TenantTaskOutcome failed(
      String tenant, FailureKind failureKind, int attempts, Throwable failure) {
    String message = failure.getClass().getSimpleName() + ": " + failure.getMessage();
    return new TenantTaskOutcome(tenant, Status.FAILED, failureKind, attempts, message);
  }

  public boolean succeeded() {
    return status == Status.SUCCEEDED;
  }
}
