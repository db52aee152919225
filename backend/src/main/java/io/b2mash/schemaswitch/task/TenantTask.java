package io.b2mash.schemaswitch.task;

import java.util.Locale;

public enum TenantTask {
  CREATE,
  MIGRATE,
  SEED,
  ROLLBACK,
  MIGRATE_UP,
  MIGRATE_DOWN,
  REDO;

  public boolean requiresVersion() {
    return this == MIGRATE_UP || this == MIGRATE_DOWN;
  }

  public boolean takesSteps() {
    return this == ROLLBACK || this == REDO;
  }

  /** True for tasks that change schema structure rather than tenant rows. */
  public boolean migratesSchema() {
    return this != CREATE && this != SEED;
  }

  /** Accepts {@code migrate-up}, {@code migrate_up} or {@code MIGRATE_UP}. */
  public static TenantTask fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Task name must not be blank");
    }
    return valueOf(name.trim().replace('-', '_').replace(':', '_').toUpperCase(Locale.ROOT));
  }
}
