package io.b2mash.schemaswitch.multitenancy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of schemas consulted for unqualified names. The first entry is the active tenant (or
 * the default schema), followed by the persistent schemas.
 */
public record SearchPath(List<String> schemas) {

  public SearchPath {
    if (schemas == null || schemas.isEmpty()) {
      throw new IllegalArgumentException("Search path needs at least one schema");
    }
    schemas = List.copyOf(new LinkedHashSet<>(schemas));
    schemas.forEach(SchemaNames::validate);
  }

  public static SearchPath of(String first, List<String> persistentSchemas) {
    var schemas = new ArrayList<String>();
    schemas.add(first);
    schemas.addAll(persistentSchemas);
    return new SearchPath(schemas);
  }

  public String first() {
    return schemas.get(0);
  }

  /** Comma separated, quoted; ready for {@code SET search_path TO ...}. */
  public String toSql() {
    return schemas.stream().map(SchemaNames::quote).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return toSql();
  }
}
