package io.b2mash.schemaswitch.migration;

@FunctionalInterface
public interface TenantSeeder {

  TenantSeeder NONE = tenant -> {};

  void seed(String tenant);
}
