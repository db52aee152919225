package io.b2mash.schemaswitch.multitenancy;

import java.util.Map;
import javax.sql.DataSource;
import org.hibernate.cfg.MultiTenancySettings;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.hibernate.autoconfigure.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Routes every Hibernate session through the tenant adapter. */
@Configuration
public class HibernateMultiTenancyConfig {

  @Bean
  SchemaMultiTenantConnectionProvider schemaMultiTenantConnectionProvider(
      @Qualifier("appDataSource") DataSource appDataSource, TenantAdapter tenantAdapter) {
    return new SchemaMultiTenantConnectionProvider(appDataSource, tenantAdapter);
  }

  @Bean
  TenantIdentifierResolver tenantIdentifierResolver(TenantAdapter tenantAdapter) {
    return new TenantIdentifierResolver(tenantAdapter);
  }

  @Bean
  HibernatePropertiesCustomizer multiTenancyCustomizer(
      SchemaMultiTenantConnectionProvider connectionProvider,
      TenantIdentifierResolver tenantResolver) {
    return (Map<String, Object> hibernateProperties) -> {
      hibernateProperties.put(
          MultiTenancySettings.MULTI_TENANT_CONNECTION_PROVIDER, connectionProvider);
      hibernateProperties.put(
          MultiTenancySettings.MULTI_TENANT_IDENTIFIER_RESOLVER, tenantResolver);
    };
  }
}
