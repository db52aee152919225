package io.b2mash.schemaswitch.multitenancy;

import java.util.function.Supplier;

/**
 * Thread-scoped switch that turns tenant scoping off, for example for maintenance jobs that must
 * see every tenant's rows in the shared schema.
 */
public final class MultiTenancyToggle {

  private static final ThreadLocal<Boolean> DISABLED = ThreadLocal.withInitial(() -> false);

  private MultiTenancyToggle() {}

  public static boolean isDisabled() {
    return DISABLED.get();
  }

  public static void runWithoutTenancy(Runnable work) {
    callWithoutTenancy(
        () -> {
          work.run();
          return null;
        });
  }

  public static <T> T callWithoutTenancy(Supplier<T> work) {
    boolean previous = DISABLED.get();
    DISABLED.set(true);
    try {
      return work.get();
    } finally {
      DISABLED.set(previous);
    }
  }
}
