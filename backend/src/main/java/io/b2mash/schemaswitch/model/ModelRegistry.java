package io.b2mash.schemaswitch.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Models known to the application, in registration order. */
public class ModelRegistry {

  private final Map<String, TableModel> models = new LinkedHashMap<>();

  public ModelRegistry() {}

  public ModelRegistry(Collection<TableModel> initialModels) {
    initialModels.forEach(this::register);
  }

  public synchronized ModelRegistry register(TableModel model) {
    if (models.putIfAbsent(model.name(), model) != null) {
      throw new IllegalArgumentException("Model already registered: " + model.name());
    }
    return this;
  }

  public synchronized Optional<TableModel> find(String name) {
    return Optional.ofNullable(models.get(name));
  }

  public synchronized TableModel require(String name) {
    return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown model: " + name));
  }

  /** Models carrying a tenant column, in registration order. */
  public synchronized List<TableModel> tenantScopedModels() {
    var scoped = new ArrayList<TableModel>();
    for (TableModel model : models.values()) {
      if (model.isTenantScoped()) {
        scoped.add(model);
      }
    }
    return scoped;
  }

  public synchronized List<TableModel> all() {
    return List.copyOf(models.values());
  }
}
