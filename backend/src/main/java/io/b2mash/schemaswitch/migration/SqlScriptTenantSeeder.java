package io.b2mash.schemaswitch.migration;

import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.exception.TenancyException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

/** Runs one SQL script through the tenant connection. A missing script is a no-op. */
public class SqlScriptTenantSeeder implements TenantSeeder {

  private static final Logger log = LoggerFactory.getLogger(SqlScriptTenantSeeder.class);

  private final TenantConnection connection;
  private final Resource script;

  public SqlScriptTenantSeeder(TenantConnection connection, Resource script) {
    this.connection = connection;
    this.script = script;
  }

  @Override
  public void seed(String tenant) {
    if (!script.exists()) {
      log.debug("No seed script at {}, skipping seed for tenant {}", script, tenant);
      return;
    }
    String sql;
    try (var in = script.getInputStream()) {
      sql = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TenancyException("Cannot read seed script " + script, e);
    }
    if (sql.lines().map(String::strip).allMatch(line -> line.isEmpty() || line.startsWith("--"))) {
      log.debug("Seed script {} has no statements", script);
      return;
    }
    connection.execute(sql);
    log.info("Seeded tenant {} from {}", tenant, script.getFilename());
  }
}
