package io.b2mash.schemaswitch.registry;

import io.b2mash.schemaswitch.config.TenancyProperties;
import io.b2mash.schemaswitch.multitenancy.SchemaNames;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of the tenancy configuration. Read by the adapter factory and the bulk task
 * runner; has no behaviour beyond validation on construction.
 */
public final class TenantRegistry {

  /** Reported by the single-schema adapter when tenancy is switched off for the thread. */
  public static final String MULTI_TENANT_DISABLED = "MULTI_TENANT_DISABLED";

  private final List<String> tenantNames;
  private final String defaultSchema;
  private final List<String> persistentSchemas;
  private final Set<String> excludedModels;
  private final TenancyStrategy strategy;
  private final boolean seedAfterCreate;
  private final boolean parallel;
  private final int workerCount;
  private final Duration workerStaggerDelay;
  private final Duration retryBackoff;

  private TenantRegistry(Builder builder) {
    this.strategy = builder.strategy;
    this.defaultSchema = SchemaNames.validate(builder.defaultSchema);
    this.persistentSchemas =
        builder.persistentSchemas.stream().map(SchemaNames::validate).toList();
    this.tenantNames = validateTenants(builder.tenantNames, strategy);
    this.excludedModels = Set.copyOf(builder.excludedModels);
    this.seedAfterCreate = builder.seedAfterCreate;
    this.parallel = builder.parallel;
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("Worker count must be positive: " + builder.workerCount);
    }
    this.workerCount = builder.workerCount;
    this.workerStaggerDelay = builder.workerStaggerDelay;
    this.retryBackoff = builder.retryBackoff;
  }

  public static TenantRegistry from(TenancyProperties properties) {
    return builder()
        .strategy(
            TenancyStrategy.select(
                properties.useSchemas(), properties.useSqlClone(), properties.useSingleSchema()))
        .tenantNames(properties.tenantNames())
        .defaultSchema(properties.defaultSchema())
        .persistentSchemas(properties.persistentSchemas())
        .excludedModels(properties.excludedModels())
        .seedAfterCreate(properties.seedAfterCreate())
        .parallel(properties.parallelMigrations())
        .workerCount(properties.workerCount())
        .workerStaggerDelay(properties.workerStaggerDelay())
        .retryBackoff(properties.retryBackoff())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private static List<String> validateTenants(List<String> names, TenancyStrategy strategy) {
    var unique = new LinkedHashSet<String>();
    for (String name : names) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Tenant name must not be blank");
      }
      if (MULTI_TENANT_DISABLED.equals(name)) {
        throw new IllegalArgumentException("Reserved tenant name: " + name);
      }
      if (strategy.usesSchemas()) {
        SchemaNames.validate(name);
      }
      if (!unique.add(name)) {
        throw new IllegalArgumentException("Duplicate tenant name: " + name);
      }
    }
    return List.copyOf(unique);
  }

  public List<String> tenantNames() {
    return tenantNames;
  }

  public String defaultSchema() {
    return defaultSchema;
  }

  public List<String> persistentSchemas() {
    return persistentSchemas;
  }

  public Set<String> excludedModels() {
    return excludedModels;
  }

  public TenancyStrategy strategy() {
    return strategy;
  }

  public boolean seedAfterCreate() {
    return seedAfterCreate;
  }

  public boolean parallel() {
    return parallel;
  }

  public int workerCount() {
    return workerCount;
  }

  public Duration workerStaggerDelay() {
    return workerStaggerDelay;
  }

  public Duration retryBackoff() {
    return retryBackoff;
  }

  public static final class Builder {

    private List<String> tenantNames = List.of();
    private String defaultSchema = TenancyProperties.DEFAULT_SCHEMA;
    private List<String> persistentSchemas = List.of();
    private Set<String> excludedModels = Set.of();
    private TenancyStrategy strategy = TenancyStrategy.DISABLED;
    private boolean seedAfterCreate;
    private boolean parallel;
    private int workerCount = 4;
    private Duration workerStaggerDelay = Duration.ofSeconds(1);
    private Duration retryBackoff = Duration.ofSeconds(1);

    private Builder() {}

    public Builder tenantNames(List<String> tenantNames) {
      this.tenantNames = List.copyOf(tenantNames);
      return this;
    }

    public Builder defaultSchema(String defaultSchema) {
      this.defaultSchema = defaultSchema;
      return this;
    }

    public Builder persistentSchemas(List<String> persistentSchemas) {
      this.persistentSchemas = List.copyOf(persistentSchemas);
      return this;
    }

    public Builder excludedModels(Iterable<String> excludedModels) {
      var copy = new LinkedHashSet<String>();
      excludedModels.forEach(copy::add);
      this.excludedModels = copy;
      return this;
    }

    public Builder strategy(TenancyStrategy strategy) {
      this.strategy = strategy;
      return this;
    }

    public Builder seedAfterCreate(boolean seedAfterCreate) {
      this.seedAfterCreate = seedAfterCreate;
      return this;
    }

    public Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder workerStaggerDelay(Duration workerStaggerDelay) {
      this.workerStaggerDelay = workerStaggerDelay;
      return this;
    }

    public Builder retryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    public TenantRegistry build() {
      return new TenantRegistry(this);
    }
  }
}
