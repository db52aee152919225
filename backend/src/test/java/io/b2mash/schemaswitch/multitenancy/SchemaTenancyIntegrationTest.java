package io.b2mash.schemaswitch.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.schemaswitch.TestcontainersConfiguration;
import io.b2mash.schemaswitch.connection.TenantConnection;
import io.b2mash.schemaswitch.exception.TenantExistsException;
import io.b2mash.schemaswitch.exception.TenantNotFoundException;
import io.b2mash.schemaswitch.migration.TenantMigrator;
import io.b2mash.schemaswitch.task.TenantTask;
import io.b2mash.schemaswitch.task.TenantTaskRequest;
import io.b2mash.schemaswitch.task.TenantTaskRunner;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
class SchemaTenancyIntegrationTest {

  @Autowired private TenantAdapter tenantAdapter;
  @Autowired private TenantConnection tenantConnection;
  @Autowired private TenantMigrator tenantMigrator;
  @Autowired private TenantTaskRunner taskRunner;

  @Autowired
  @Qualifier("migrationDataSource")
  private DataSource migrationDataSource;

  @AfterEach
  void tearDown() {
    tenantAdapter.reset();
    for (String tenant : List.of("it_acme", "it_globex", "it_initech")) {
      if (!schemaExists(tenant)) {
        continue;
      }
      tenantAdapter.drop(tenant);
    }
  }

  @Test
  void createdTenantGetsEveryMigratedTable() {
    tenantAdapter.create("it_acme");

    assertThat(tablesIn("it_acme"))
        .containsExactlyInAnyOrder("accounts", "invoices", "flyway_schema_history");
    assertThatThrownBy(() -> tenantAdapter.create("it_acme"))
        .isInstanceOf(TenantExistsException.class);
  }

  @Test
  void unqualifiedStatementsLandInActiveTenant() {
    tenantAdapter.create("it_acme");
    tenantAdapter.create("it_globex");

    tenantAdapter.runAs(
        "it_acme",
        () ->
            tenantConnection.execute(
                "INSERT INTO accounts (id, name) VALUES (gen_random_uuid(), 'Acme')"));

    assertThat(countRows("it_acme", "accounts")).isEqualTo(1);
    assertThat(countRows("it_globex", "accounts")).isZero();
    assertThat(tenantAdapter.current()).isEqualTo("public");
  }

  @Test
  void rollbackUndoesNewestMigrationAndMigrateReappliesIt() {
    tenantAdapter.create("it_acme");

    assertThat(tenantMigrator.rollback("it_acme", 1)).isEqualTo(1);
    assertThat(tablesIn("it_acme")).doesNotContain("invoices");

    assertThat(tenantMigrator.migrate("it_acme")).isEqualTo(1);
    assertThat(tablesIn("it_acme")).contains("invoices");
  }

  @Test
  void droppedTenantCannotBeSwitchedTo() {
    tenantAdapter.create("it_acme");

    tenantAdapter.drop("it_acme");

    assertThatThrownBy(() -> tenantAdapter.switchTenant("it_acme"))
        .isInstanceOf(TenantNotFoundException.class);
    assertThatThrownBy(() -> tenantAdapter.drop("it_acme"))
        .isInstanceOf(TenantNotFoundException.class);
  }

  @Test
  void bulkCreateReportsEveryTenant() {
    var report =
        taskRunner.run(
            TenantTaskRequest.of(TenantTask.CREATE)
                .forTenants(List.of("it_globex", "it_initech")));

    assertThat(report.allSucceeded()).isTrue();
    assertThat(tablesIn("it_initech")).contains("accounts", "invoices");
  }

  private List<String> tablesIn(String schema) {
    return new JdbcTemplate(migrationDataSource)
        .queryForList(
            "SELECT table_name FROM information_schema.tables WHERE table_schema = ?",
            String.class,
            schema);
  }

  private boolean schemaExists(String schema) {
    return Boolean.TRUE.equals(
        new JdbcTemplate(migrationDataSource)
            .queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = ?)",
                Boolean.class,
                schema));
  }

  private int countRows(String schema, String table) {
    Integer count =
        new JdbcTemplate(migrationDataSource)
            .queryForObject(
                "SELECT count(*) FROM \"" + schema + "\".\"" + table + "\"", Integer.class);
    return count == null ? 0 : count;
  }
}
