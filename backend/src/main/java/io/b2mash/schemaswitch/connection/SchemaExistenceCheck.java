package io.b2mash.schemaswitch.connection;

@FunctionalInterface
public interface SchemaExistenceCheck {

  boolean exists(String schemaName);

  /** Forgets anything remembered about the schema, after it was created or dropped. */
  default void evict(String schemaName) {}
}
