package io.b2mash.schemaswitch.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TenantLoggingListenerTest {

  private final TenantLoggingListener listener = new TenantLoggingListener();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void shouldPutTenantIntoMdc() {
    listener.afterSwitch(null, "acme");

    assertThat(MDC.get(TenantLoggingListener.MDC_TENANT_ID)).isEqualTo("acme");
  }

  @Test
  void shouldRemoveTenantOnReset() {
    listener.afterSwitch(null, "acme");
    listener.afterSwitch("acme", null);

    assertThat(MDC.get(TenantLoggingListener.MDC_TENANT_ID)).isNull();
  }
}
