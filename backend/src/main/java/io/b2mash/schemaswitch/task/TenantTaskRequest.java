package io.b2mash.schemaswitch.task;

import java.util.List;

/**
 * One bulk run.
 *
 * @param task what to do per tenant
 * @param tenants explicit tenants, or {@code null}/empty for every registered tenant
 * @param version target version for {@link TenantTask#MIGRATE_UP} and {@link
 *     TenantTask#MIGRATE_DOWN}
 * @param steps migrations to revert for {@link TenantTask#ROLLBACK} and {@link TenantTask#REDO};
 *     defaults to 1
 */
public record TenantTaskRequest(
    TenantTask task, List<String> tenants, String version, Integer steps) {

  public TenantTaskRequest {
    if (task == null) {
      throw new IllegalArgumentException("Task must not be null");
    }
    tenants = tenants == null ? List.of() : List.copyOf(tenants);
  }

  public static TenantTaskRequest of(TenantTask task) {
    return new TenantTaskRequest(task, null, null, null);
  }

  public TenantTaskRequest forTenants(List<String> tenantNames) {
    return new TenantTaskRequest(task, tenantNames, version, steps);
  }

  public TenantTaskRequest withVersion(String targetVersion) {
    return new TenantTaskRequest(task, tenants, targetVersion, steps);
  }

  public TenantTaskRequest withSteps(int stepCount) {
    return new TenantTaskRequest(task, tenants, version, stepCount);
  }

  public int stepsOrDefault() {
    return steps == null ? 1 : steps;
  }
}
