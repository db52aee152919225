package io.b2mash.schemaswitch.task;

import java.time.Duration;
import java.util.List;

public record TenantTaskReport(
    TenantTask task, List<TenantTaskOutcome> outcomes, Duration elapsed) {

  public TenantTaskReport {
    outcomes = List.copyOf(outcomes);
  }

  public List<String> succeededTenants() {
    return outcomes.stream()
        .filter(TenantTaskOutcome::succeeded)
        .map(TenantTaskOutcome::tenant)
        .toList();
  }

  public List<TenantTaskOutcome> failures() {
    return outcomes.stream().filter(outcome -> !outcome.succeeded()).toList();
  }

  public boolean allSucceeded() {
    return outcomes.stream().allMatch(TenantTaskOutcome::succeeded);
  }

  /** Extra attempts spent on retries across all tenants. */
  public int retries() {
    return outcomes.stream().mapToInt(outcome -> outcome.attempts() - 1).sum();
  }
}
