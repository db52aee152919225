package io.b2mash.schemaswitch.task;

import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Command-line entry to the bulk runner. Does nothing unless {@code --tenancy.task} is given:
 *
 * <pre>
 * --tenancy.task=migrate-up --tenancy.version=5 [--tenancy.tenants=acme,globex]
 * --tenancy.task=rollback [--tenancy.steps=2]
 * </pre>
 */
public class TenantTaskCommandRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TenantTaskCommandRunner.class);

  static final String TASK_OPTION = "tenancy.task";
  static final String TENANTS_OPTION = "tenancy.tenants";
  static final String VERSION_OPTION = "tenancy.version";
  static final String STEPS_OPTION = "tenancy.steps";

  private final TenantTaskRunner taskRunner;

  public TenantTaskCommandRunner(TenantTaskRunner taskRunner) {
    this.taskRunner = taskRunner;
  }

  @Override
  public void run(ApplicationArguments args) {
    String taskName = option(args, TASK_OPTION);
    if (taskName == null) {
      return;
    }
    var request =
        new TenantTaskRequest(
            task(taskName),
            tenants(option(args, TENANTS_OPTION)),
            option(args, VERSION_OPTION),
            steps(option(args, STEPS_OPTION)));

    TenantTaskReport report = taskRunner.run(request);
    for (TenantTaskOutcome failure : report.failures()) {
      log.warn(
          "Tenant {} failed after {} attempt(s): {}",
          failure.tenant(),
          failure.attempts(),
          failure.message());
    }
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static TenantTask task(String value) {
    try {
      return TenantTask.fromName(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown --"
              + TASK_OPTION
              + " '"
              + value
              + "', expected one of "
              + Arrays.toString(TenantTask.values()),
          e);
    }
  }

  private static Integer steps(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "--" + STEPS_OPTION + " must be a whole number, got '" + value + "'", e);
    }
  }

  private static List<String> tenants(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
