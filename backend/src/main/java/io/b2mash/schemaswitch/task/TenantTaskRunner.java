package io.b2mash.schemaswitch.task;

import io.b2mash.schemaswitch.exception.MissingTaskArgumentException;
import io.b2mash.schemaswitch.exception.TenancyException;
import io.b2mash.schemaswitch.migration.TenantMigrator;
import io.b2mash.schemaswitch.multitenancy.TenantAdapter;
import io.b2mash.schemaswitch.registry.TenantRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Applies a {@link TenantTask} to every tenant of a run. A failing tenant never stops the others;
 * its failure is logged and recorded in the report.
 *
 * <p>In parallel mode a fixed pool of workers drains a shared queue. Worker starts are staggered so
 * the connection pool is not hit all at once. A tenant that fails with a connection timeout is
 * tried exactly once more after a fixed backoff.
 */
public class TenantTaskRunner {

  private static final Logger log = LoggerFactory.getLogger(TenantTaskRunner.class);
  private static final int ATTEMPTS_ON_TIMEOUT = 2;
  private static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final TenantRegistry registry;
  private final TenantAdapter tenantAdapter;
  private final TenantMigrator migrator;
  private final FailureClassifier failureClassifier;
  private final RetryTemplate retryTemplate;

  public TenantTaskRunner(
      TenantRegistry registry,
      TenantAdapter tenantAdapter,
      TenantMigrator migrator,
      FailureClassifier failureClassifier) {
    this.registry = registry;
    this.tenantAdapter = tenantAdapter;
    this.migrator = migrator;
    this.failureClassifier = failureClassifier;
    this.retryTemplate = retryTemplate(failureClassifier, registry.retryBackoff());
  }

  private static RetryTemplate retryTemplate(FailureClassifier classifier, Duration backoff) {
    // shared instances, retry state is tracked per policy
    RetryPolicy retryOnce = new SimpleRetryPolicy(ATTEMPTS_ON_TIMEOUT);
    RetryPolicy never = new NeverRetryPolicy();
    var policy = new ExceptionClassifierRetryPolicy();
    policy.setExceptionClassifier(
        failure -> classifier.classify(failure) == FailureKind.RETRYABLE ? retryOnce : never);

    var backOff = new FixedBackOffPolicy();
    backOff.setBackOffPeriod(backoff.toMillis());

    var template = new RetryTemplate();
    template.setRetryPolicy(policy);
    template.setBackOffPolicy(backOff);
    return template;
  }

  public TenantTaskReport run(TenantTaskRequest request) {
    validate(request);
    List<String> tenants = targets(request);

    long started = System.nanoTime();
    log.info(
        "Running {} for {} tenants ({})",
        request.task(),
        tenants.size(),
        registry.parallel() ? registry.workerCount() + " workers" : "sequential");

    List<TenantTaskOutcome> outcomes =
        registry.parallel() ? runParallel(request, tenants) : runSequential(request, tenants);

    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    var report = new TenantTaskReport(request.task(), outcomes, elapsed);
    log.info(
        "{}: {} tenants, {} succeeded, {} failed in {} ms",
        request.task(),
        outcomes.size(),
        report.succeededTenants().size(),
        report.failures().size(),
        report.elapsed().toMillis());
    return report;
  }

  private void validate(TenantTaskRequest request) {
    TenantTask task = request.task();
    if (task.requiresVersion() && (request.version() == null || request.version().isBlank())) {
      throw new MissingTaskArgumentException(task.name(), "version");
    }
    if (task.takesSteps() && request.stepsOrDefault() < 1) {
      throw new IllegalArgumentException("Steps must be positive: " + request.steps());
    }
  }

  /**
   * Tenants that share the default schema also share its migrations, so a schema task runs once
   * against the default tenant when the strategy has no per-tenant schemas.
   */
  private List<String> targets(TenantTaskRequest request) {
    List<String> tenants = request.tenants().isEmpty() ? registry.tenantNames() : request.tenants();
    if (request.task().migratesSchema()
        && !tenantAdapter.strategy().usesSchemas()
        && !tenants.isEmpty()) {
      log.info(
          "{} tenants share schema {}, running {} once",
          tenants.size(),
          tenantAdapter.defaultTenant(),
          request.task());
      return List.of(tenantAdapter.defaultTenant());
    }
    return tenants;
  }

  List<TenantTaskOutcome> runSequential(TenantTaskRequest request, List<String> tenants) {
    var outcomes = new ArrayList<TenantTaskOutcome>();
    for (String tenant : tenants) {
      try {
        apply(request, tenant);
        outcomes.add(TenantTaskOutcome.succeeded(tenant, 1));
      } catch (RuntimeException e) {
        log.error("{} failed for tenant {}", request.task(), tenant, e);
        outcomes.add(TenantTaskOutcome.failed(tenant, failureClassifier.classify(e), 1, e));
      }
    }
    return outcomes;
  }

  List<TenantTaskOutcome> runParallel(TenantTaskRequest request, List<String> tenants) {
    if (tenants.isEmpty()) {
      return List.of();
    }
    Queue<String> queue = new ConcurrentLinkedQueue<>(tenants);
    List<TenantTaskOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
    int workers = Math.min(registry.workerCount(), tenants.size());

    ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
    var futures = new ArrayList<Future<?>>();
    try {
      for (int i = 0; i < workers; i++) {
        if (i > 0) {
          Thread.sleep(registry.workerStaggerDelay().toMillis());
        }
        futures.add(executor.submit(() -> drain(queue, request, outcomes)));
      }
      Throwable workerFailure = joinAll(futures);
      if (workerFailure != null) {
        throw new TenancyException("Tenant worker failed", workerFailure);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      awaitWorkers(executor);
      Thread.currentThread().interrupt();
      throw new TenancyException("Interrupted while waiting for tenant workers", e);
    } finally {
      executor.shutdown();
    }
    return new ArrayList<>(outcomes);
  }

  /** Waits for every worker and returns the first failure, if any. */
  private static Throwable joinAll(List<Future<?>> futures) throws InterruptedException {
    Throwable first = null;
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException e) {
        if (first == null) {
          first = e.getCause();
        } else {
          first.addSuppressed(e.getCause());
        }
      }
    }
    return first;
  }

  private static void awaitWorkers(ExecutorService executor) {
    try {
      if (!executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Tenant workers still running after {}", WORKER_SHUTDOWN_TIMEOUT);
      }
    } catch (InterruptedException e) {
      log.warn("Interrupted again while stopping tenant workers");
    }
  }

  private void drain(Queue<String> queue, TenantTaskRequest request, List<TenantTaskOutcome> sink) {
    String tenant;
    while ((tenant = queue.poll()) != null) {
      sink.add(runWithRetry(request, tenant));
    }
  }

  private TenantTaskOutcome runWithRetry(TenantTaskRequest request, String tenant) {
    var attempts = new AtomicInteger();
    try {
      retryTemplate.execute(
          context -> {
            if (attempts.incrementAndGet() > 1) {
              log.warn(
                  "Retrying {} for tenant {} after connection timeout", request.task(), tenant);
            }
            apply(request, tenant);
            return null;
          });
      return TenantTaskOutcome.succeeded(tenant, attempts.get());
    } catch (RuntimeException e) {
      log.error("{} failed for tenant {}", request.task(), tenant, e);
      return TenantTaskOutcome.failed(tenant, failureClassifier.classify(e), attempts.get(), e);
    }
  }

  void apply(TenantTaskRequest request, String tenant) {
    switch (request.task()) {
      case CREATE -> tenantAdapter.create(tenant);
      case MIGRATE -> migrator.migrate(tenant);
      case SEED -> tenantAdapter.seed(tenant);
      case ROLLBACK -> migrator.rollback(tenant, request.stepsOrDefault());
      case MIGRATE_UP -> migrator.migrateUp(tenant, request.version());
      case MIGRATE_DOWN -> migrator.migrateDown(tenant, request.version());
      case REDO -> migrator.redo(tenant, request.stepsOrDefault());
    }
  }

  private static ThreadFactory workerThreadFactory() {
    var counter = new AtomicInteger();
    return runnable -> {
      var thread = new Thread(runnable, "tenant-task-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
