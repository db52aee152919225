package io.b2mash.schemaswitch.model;

import io.b2mash.schemaswitch.multitenancy.SchemaNames;
import java.util.Objects;

/**
 * Storage metadata for one entity type: its table, the optional tenant column used in the shared
 * schema, and an optional schema override. Without an override the table is resolved through the
 * active search path.
 */
public final class TableModel {

  private final String name;
  private final String tableName;
  private final String tenantColumn;
  private volatile String pinnedSchema;

  private TableModel(String name, String tableName, String tenantColumn) {
    this.name = Objects.requireNonNull(name, "name");
    this.tableName = SchemaNames.validate(unqualified(tableName));
    this.tenantColumn = tenantColumn == null ? null : SchemaNames.validate(tenantColumn);
  }

  /** A model whose rows are isolated by schema only. */
  public static TableModel of(String name, String tableName) {
    return new TableModel(name, tableName, null);
  }

  /** A model whose rows carry the tenant id in {@code tenantColumn} in the shared schema. */
  public static TableModel tenantScoped(String name, String tableName, String tenantColumn) {
    return new TableModel(name, tableName, Objects.requireNonNull(tenantColumn, "tenantColumn"));
  }

  /** Drops a schema qualifier that may already be present, e.g. {@code public.countries}. */
  private static String unqualified(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    int dot = tableName.indexOf('.');
    return dot < 0 ? tableName : tableName.substring(dot + 1);
  }

  public String name() {
    return name;
  }

  public String tableName() {
    return tableName;
  }

  public String tenantColumn() {
    return tenantColumn;
  }

  public boolean isTenantScoped() {
    return tenantColumn != null;
  }

  public String pinnedSchema() {
    return pinnedSchema;
  }

  /** Overrides the resolved location so the table is found in {@code schema} under any tenant. */
  public void pinToSchema(String schema) {
    this.pinnedSchema = SchemaNames.validate(schema);
  }

  /** The name to use in SQL. */
  public String qualifiedTableName() {
    String schema = pinnedSchema;
    return schema == null
        ? SchemaNames.quote(tableName)
        : SchemaNames.quote(schema) + "." + SchemaNames.quote(tableName);
  }

  @Override
  public String toString() {
    return "TableModel[" + name + " -> " + qualifiedTableName() + "]";
  }
}
