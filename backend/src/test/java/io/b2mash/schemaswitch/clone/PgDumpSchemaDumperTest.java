package io.b2mash.schemaswitch.clone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.schemaswitch.clone.CommandExecutor.CommandResult;
import io.b2mash.schemaswitch.connection.ConnectionSettings;
import io.b2mash.schemaswitch.exception.SchemaDumpException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PgDumpSchemaDumperTest {

  private static final ConnectionSettings SETTINGS =
      new ConnectionSettings("db.internal", 5433, "migrator", "s3cret", "app");

  private final CommandEnvironment environment =
      new CommandEnvironment(Map.of("PATH", "/usr/bin", "PGPASSWORD", "from-shell"));
  private final List<List<String>> commands = new ArrayList<>();
  private final List<Map<String, String>> environments = new ArrayList<>();

  @AfterEach
  void interruptFlagIsCleared() {
    Thread.interrupted();
  }

  @Test
  void dumpSchemaRunsStructureOnlyDumpWithCredentialsInEnvironment() {
    var dumper = dumper(new CommandResult(0, "CREATE TABLE public.accounts ();", ""));

    String dump = dumper.dumpSchema("public", SETTINGS);

    assertThat(dump).isEqualTo("CREATE TABLE public.accounts ();");
    assertThat(commands)
        .containsExactly(List.of("pg_dump", "-s", "-x", "-O", "-n", "public", "app"));
    assertThat(environments.get(0))
        .containsEntry("PGHOST", "db.internal")
        .containsEntry("PGPORT", "5433")
        .containsEntry("PGUSER", "migrator")
        .containsEntry("PGPASSWORD", "s3cret")
        .containsEntry("PATH", "/usr/bin");
    assertThat(environment.get("PGPASSWORD")).isEqualTo("from-shell");
    assertThat(environment.get("PGHOST")).isNull();
  }

  @Test
  void dumpTableDataSelectsEachTableAsInserts() {
    var dumper = dumper(new CommandResult(0, "INSERT INTO ...", ""));

    dumper.dumpTableData("public", List.of("flyway_schema_history", "ar_internal"), SETTINGS);

    assertThat(commands.get(0))
        .containsExactly(
            "pg_dump",
            "-a",
            "--inserts",
            "-t",
            "public.flyway_schema_history",
            "-t",
            "public.ar_internal",
            "-n",
            "public",
            "app");
  }

  @Test
  void nonZeroExitFailsWithStderrAndRestoresEnvironment() {
    var dumper = dumper(new CommandResult(1, "", "pg_dump: error: connection refused\n"));

    assertThatThrownBy(() -> dumper.dumpSchema("public", SETTINGS))
        .isInstanceOf(SchemaDumpException.class)
        .hasMessage("pg_dump exited with 1: pg_dump: error: connection refused");
    assertThat(environment.get("PGPASSWORD")).isEqualTo("from-shell");
    assertThat(environment.get("PGUSER")).isNull();
  }

  @Test
  void launchFailureIsWrapped() {
    var dumper =
        new PgDumpSchemaDumper(
            "pg_dump_missing",
            (command, env) -> {
              throw new IOException("No such file");
            },
            environment);

    assertThatThrownBy(() -> dumper.dumpSchema("public", SETTINGS))
        .isInstanceOf(SchemaDumpException.class)
        .hasMessageContaining("pg_dump_missing")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void interruptionIsWrappedAndFlagRestored() {
    var dumper =
        new PgDumpSchemaDumper(
            "pg_dump",
            (command, env) -> {
              throw new InterruptedException();
            },
            environment);

    assertThatThrownBy(() -> dumper.dumpSchema("public", SETTINGS))
        .isInstanceOf(SchemaDumpException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void settingsWithoutDatabaseAreRejected() {
    var dumper = dumper(new CommandResult(0, "", ""));
    var noDatabase = new ConnectionSettings("db", null, "app", null, null);

    assertThatThrownBy(() -> dumper.dumpSchema("public", noDatabase))
        .isInstanceOf(SchemaDumpException.class);
    assertThat(commands).isEmpty();
  }

  @Test
  void unsetSettingsAreLeftToTheTool() {
    var variables =
        PgDumpSchemaDumper.pgVariables(new ConnectionSettings(null, null, "app", null, "app"));

    assertThat(variables).containsEntry("PGUSER", "app").containsEntry("PGPORT", null);
  }

  private PgDumpSchemaDumper dumper(CommandResult result) {
    return new PgDumpSchemaDumper(
        "pg_dump",
        (command, env) -> {
          commands.add(command);
          environments.add(env);
          return result;
        },
        environment);
  }
}
