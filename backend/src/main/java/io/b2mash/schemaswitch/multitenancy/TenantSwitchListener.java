package io.b2mash.schemaswitch.multitenancy;

/**
 * Callback around every tenant switch. {@code null} stands for the default tenant. Exceptions
 * thrown from {@link #beforeSwitch} abort the switch.
 */
public interface TenantSwitchListener {

  default void beforeSwitch(String fromTenant, String toTenant) {}

  default void afterSwitch(String fromTenant, String toTenant) {}
}
