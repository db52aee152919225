package io.b2mash.schemaswitch.multitenancy;

/**
 * Translates between tenant names used by callers and the ids stored in the tenant column of the
 * shared schema. Only consulted by the single-schema adapter.
 */
public interface TenantIdMapper {

  TenantIdMapper IDENTITY =
      new TenantIdMapper() {
        @Override
        public String toId(String tenantName) {
          return tenantName;
        }

        @Override
        public String toName(String tenantId) {
          return tenantId;
        }
      };

  String toId(String tenantName);

  String toName(String tenantId);
}
