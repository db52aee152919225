package io.b2mash.schemaswitch.task;

public enum FailureKind {
  /** Connection timeouts and similar; the tenant is tried once more. */
  RETRYABLE,
  /** Anything else; the tenant is reported as failed. */
  TERMINAL
}
