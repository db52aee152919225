package io.b2mash.schemaswitch.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import javax.sql.DataSource;
import org.hibernate.engine.jdbc.connections.spi.MultiTenantConnectionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaMultiTenantConnectionProviderTest {

  private final DataSource dataSource = mock(DataSource.class);
  private final TenantAdapter tenantAdapter = mock(TenantAdapter.class);
  private final Connection connection = mock(Connection.class);
  private final Statement statement = mock(Statement.class);
  private final SchemaMultiTenantConnectionProvider provider =
      new SchemaMultiTenantConnectionProvider(dataSource, tenantAdapter);

  @BeforeEach
  void setUp() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.createStatement()).thenReturn(statement);
    when(tenantAdapter.searchPathFor(null)).thenReturn(new SearchPath(List.of("public")));
    when(tenantAdapter.searchPathFor("acme"))
        .thenReturn(new SearchPath(List.of("acme", "shared_extensions")));
  }

  @Test
  void connectionForTenantGetsTenantSearchPath() throws SQLException {
    Connection result = provider.getConnection("acme");

    assertThat(result).isSameAs(connection);
    verify(statement).execute("SET search_path TO \"acme\", \"shared_extensions\"");
  }

  @Test
  void releaseRestoresDefaultSearchPathBeforeClosing() throws SQLException {
    provider.releaseConnection("acme", connection);

    var order = inOrder(statement, connection);
    order.verify(statement).execute("SET search_path TO \"public\"");
    order.verify(connection).close();
  }

  @Test
  void connectionIsClosedWhenSearchPathCannotBeSet() throws SQLException {
    when(statement.execute("SET search_path TO \"acme\", \"shared_extensions\""))
        .thenThrow(new SQLException("connection reset", "08006"));

    assertThatThrownBy(() -> provider.getConnection("acme")).isInstanceOf(SQLException.class);
    verify(connection).close();
  }

  @Test
  void unwrapsToProvider() {
    assertThat(provider.isUnwrappableAs(MultiTenantConnectionProvider.class)).isTrue();
    assertThat(provider.unwrap(MultiTenantConnectionProvider.class)).isSameAs(provider);
    assertThatThrownBy(() -> provider.unwrap(String.class))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
