package io.b2mash.schemaswitch.multitenancy;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.hibernate.engine.jdbc.connections.spi.MultiTenantConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives Hibernate sessions a connection whose search path matches the session's tenant, and puts
 * the default search path back before the connection is returned to the pool.
 */
public class SchemaMultiTenantConnectionProvider implements MultiTenantConnectionProvider<String> {

  private static final Logger log =
      LoggerFactory.getLogger(SchemaMultiTenantConnectionProvider.class);

  private final DataSource dataSource;
  private final TenantAdapter tenantAdapter;

  public SchemaMultiTenantConnectionProvider(DataSource dataSource, TenantAdapter tenantAdapter) {
    this.dataSource = dataSource;
    this.tenantAdapter = tenantAdapter;
  }

  @Override
  public Connection getAnyConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public void releaseAnyConnection(Connection connection) throws SQLException {
    connection.close();
  }

  @Override
  public Connection getConnection(String tenantIdentifier) throws SQLException {
    Connection connection = getAnyConnection();
    try {
      setSearchPath(connection, tenantAdapter.searchPathFor(tenantIdentifier));
    } catch (SQLException | RuntimeException e) {
      // Release connection on setup failure to prevent pool leak
      releaseAnyConnection(connection);
      throw e;
    }
    return connection;
  }

  @Override
  public void releaseConnection(String tenantIdentifier, Connection connection)
      throws SQLException {
    try {
      setSearchPath(connection, tenantAdapter.searchPathFor(null));
    } finally {
      releaseAnyConnection(connection);
    }
  }

  public Connection getReadOnlyConnection(String tenantIdentifier) throws SQLException {
    Connection connection = getConnection(tenantIdentifier);
    connection.setReadOnly(true);
    return connection;
  }

  public void releaseReadOnlyConnection(String tenantIdentifier, Connection connection)
      throws SQLException {
    connection.setReadOnly(false);
    releaseConnection(tenantIdentifier, connection);
  }

  @Override
  public boolean supportsAggressiveRelease() {
    return false;
  }

  @Override
  public boolean isUnwrappableAs(Class<?> unwrapType) {
    return MultiTenantConnectionProvider.class.isAssignableFrom(unwrapType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T unwrap(Class<T> unwrapType) {
    if (isUnwrappableAs(unwrapType)) {
      return (T) this;
    }
    throw new IllegalArgumentException("Cannot unwrap to " + unwrapType);
  }

  private void setSearchPath(Connection connection, SearchPath searchPath) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("SET search_path TO " + searchPath.toSql());
    }
    log.trace("Hibernate connection search path set to {}", searchPath);
  }
}
