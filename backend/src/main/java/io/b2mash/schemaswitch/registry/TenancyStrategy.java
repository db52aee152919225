package io.b2mash.schemaswitch.registry;

public enum TenancyStrategy {
  /** Tenancy disabled; switches are recorded but nothing is isolated. */
  DISABLED,
  /** One schema per tenant, structure built by running migrations. */
  SCHEMA,
  /** One schema per tenant, structure cloned from a dump of the default schema. */
  SQL_CLONE,
  /** Shared schema, rows scoped by a tenant column. */
  SINGLE_SCHEMA;

  /** Single schema wins over everything; SQL clone only applies together with schemas. */
  public static TenancyStrategy select(
      boolean useSchemas, boolean useSqlClone, boolean useSingleSchema) {
    if (useSingleSchema) {
      return SINGLE_SCHEMA;
    }
    if (useSchemas && useSqlClone) {
      return SQL_CLONE;
    }
    if (useSchemas) {
      return SCHEMA;
    }
    return DISABLED;
  }

  public boolean usesSchemas() {
    return this == SCHEMA || this == SQL_CLONE;
  }
}
