package io.b2mash.schemaswitch.connection;

import io.b2mash.schemaswitch.multitenancy.SearchPath;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link TenantConnection} on top of a pooled {@link JdbcTemplate}. Each statement borrows a
 * connection, applies the calling thread's search path, runs, and puts the default path back before
 * the connection returns to the pool.
 */
public class JdbcTenantConnection implements TenantConnection {

  private static final Logger log = LoggerFactory.getLogger(JdbcTenantConnection.class);

  private final JdbcTemplate jdbcTemplate;
  private final ConnectionSettings settings;
  private final SearchPath defaultSearchPath;
  private final ThreadLocal<SearchPath> searchPath;

  public JdbcTenantConnection(
      JdbcTemplate jdbcTemplate, ConnectionSettings settings, SearchPath defaultSearchPath) {
    this.jdbcTemplate = jdbcTemplate;
    this.settings = settings;
    this.defaultSearchPath = defaultSearchPath;
    this.searchPath = ThreadLocal.withInitial(() -> defaultSearchPath);
  }

  @Override
  public void execute(String sql) {
    jdbcTemplate.execute(
        (ConnectionCallback<Void>)
            connection -> {
              withSearchPath(
                  connection,
                  () -> {
                    try (Statement stmt = connection.createStatement()) {
                      stmt.execute(sql);
                    }
                    return null;
                  });
              return null;
            });
  }

  @Override
  public int update(String sql, Object... args) {
    Integer updated =
        jdbcTemplate.execute(
            (ConnectionCallback<Integer>)
                connection ->
                    withSearchPath(
                        connection,
                        () -> {
                          try (var stmt = connection.prepareStatement(sql)) {
                            for (int i = 0; i < args.length; i++) {
                              stmt.setObject(i + 1, args[i]);
                            }
                            return stmt.executeUpdate();
                          }
                        }));
    return updated == null ? 0 : updated;
  }

  @Override
  public SearchPath schemaSearchPath() {
    return searchPath.get();
  }

  @Override
  public void setSchemaSearchPath(SearchPath path) {
    if (path == null || path.equals(defaultSearchPath)) {
      searchPath.remove();
    } else {
      searchPath.set(path);
    }
    log.debug("Search path for {} set to {}", Thread.currentThread().getName(), schemaSearchPath());
  }

  @Override
  public ConnectionSettings settings() {
    return settings;
  }

  private <T> T withSearchPath(Connection connection, SqlWork<T> work) throws SQLException {
    setSearchPath(connection, searchPath.get());
    try {
      return work.run();
    } finally {
      setSearchPath(connection, defaultSearchPath);
    }
  }

  private void setSearchPath(Connection connection, SearchPath path) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("SET search_path TO " + path.toSql());
    }
  }

  @FunctionalInterface
  private interface SqlWork<T> {
    T run() throws SQLException;
  }
}
