package io.b2mash.schemaswitch.connection;

import java.net.URI;

/**
 * Where the database lives and who we connect as. Handed to the dump utility; {@code null} fields
 * are left to the utility's own defaults.
 */
public record ConnectionSettings(
    String host, Integer port, String username, String password, String database) {

  private static final String JDBC_PREFIX = "jdbc:";

  /** Parses {@code jdbc:postgresql://host[:port]/database[?params]}. */
  public static ConnectionSettings fromJdbcUrl(String jdbcUrl, String username, String password) {
    if (jdbcUrl == null || !jdbcUrl.startsWith(JDBC_PREFIX)) {
      throw new IllegalArgumentException("Not a JDBC URL: " + jdbcUrl);
    }
    URI uri = URI.create(jdbcUrl.substring(JDBC_PREFIX.length()));
    String path = uri.getPath();
    String database = path == null || path.length() <= 1 ? null : path.substring(1);
    Integer port = uri.getPort() == -1 ? null : uri.getPort();
    return new ConnectionSettings(uri.getHost(), port, username, password, database);
  }

  @Override
  public String toString() {
    return "ConnectionSettings[host="
        + host
        + ", port="
        + port
        + ", username="
        + username
        + ", database="
        + database
        + "]";
  }
}
