package io.b2mash.schemaswitch.connection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Looks schemas up in {@code information_schema.schemata}. Only positive answers are cached, so a
 * freshly created schema is found on the next switch even without an explicit eviction.
 */
public class CachingSchemaExistenceCheck implements SchemaExistenceCheck {

  private static final String EXISTS_SQL =
      "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = ?)";

  private final JdbcTemplate jdbcTemplate;
  private final Cache<String, Boolean> existingSchemas;

  public CachingSchemaExistenceCheck(JdbcTemplate jdbcTemplate, Duration expireAfterWrite) {
    this.jdbcTemplate = jdbcTemplate;
    this.existingSchemas =
        Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(expireAfterWrite).build();
  }

  @Override
  public boolean exists(String schemaName) {
    if (existingSchemas.getIfPresent(schemaName) != null) {
      return true;
    }
    boolean exists =
        Boolean.TRUE.equals(jdbcTemplate.queryForObject(EXISTS_SQL, Boolean.class, schemaName));
    if (exists) {
      existingSchemas.put(schemaName, Boolean.TRUE);
    }
    return exists;
  }

  @Override
  public void evict(String schemaName) {
    existingSchemas.invalidate(schemaName);
  }
}
