package io.b2mash.schemaswitch.clone;

import io.b2mash.schemaswitch.connection.ConnectionSettings;
import io.b2mash.schemaswitch.exception.SchemaDumpException;
import io.b2mash.schemaswitch.multitenancy.SchemaNames;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shells out to {@code pg_dump}. Credentials travel as {@code PGHOST}, {@code PGPORT}, {@code
 * PGUSER} and {@code PGPASSWORD}, set on the {@link CommandEnvironment} only while the dump runs.
 */
public class PgDumpSchemaDumper implements SchemaDumper {

  private static final Logger log = LoggerFactory.getLogger(PgDumpSchemaDumper.class);

  private final String pgDumpCommand;
  private final CommandExecutor executor;
  private final CommandEnvironment environment;

  public PgDumpSchemaDumper(
      String pgDumpCommand, CommandExecutor executor, CommandEnvironment environment) {
    this.pgDumpCommand = pgDumpCommand;
    this.executor = executor;
    this.environment = environment;
  }

  @Override
  public String dumpSchema(String schema, ConnectionSettings settings) {
    var command = new ArrayList<String>();
    command.add(pgDumpCommand);
    command.addAll(List.of("-s", "-x", "-O", "-n", SchemaNames.validate(schema)));
    command.add(requireDatabase(settings));
    return dump(command, settings);
  }

  @Override
  public String dumpTableData(String schema, List<String> tables, ConnectionSettings settings) {
    var command = new ArrayList<String>();
    command.add(pgDumpCommand);
    command.addAll(List.of("-a", "--inserts"));
    for (String table : tables) {
      command.add("-t");
      command.add(SchemaNames.validate(schema) + "." + SchemaNames.validate(table));
    }
    command.addAll(List.of("-n", schema));
    command.add(requireDatabase(settings));
    return dump(command, settings);
  }

  static Map<String, String> pgVariables(ConnectionSettings settings) {
    var variables = new LinkedHashMap<String, String>();
    variables.put("PGHOST", settings.host());
    variables.put("PGPORT", settings.port() == null ? null : settings.port().toString());
    variables.put("PGUSER", settings.username());
    variables.put("PGPASSWORD", settings.password());
    return variables;
  }

  private String dump(List<String> command, ConnectionSettings settings) {
    log.debug("Running {}", command);
    try (var scope = environment.apply(pgVariables(settings))) {
      var result = executor.run(command, environment.snapshot());
      if (!result.succeeded()) {
        throw new SchemaDumpException(
            pgDumpCommand + " exited with " + result.exitCode() + ": " + result.stderr().strip());
      }
      return result.stdout();
    } catch (IOException e) {
      throw new SchemaDumpException("Could not run " + pgDumpCommand, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SchemaDumpException("Interrupted while running " + pgDumpCommand, e);
    }
  }

  private static String requireDatabase(ConnectionSettings settings) {
    if (settings.database() == null || settings.database().isBlank()) {
      throw new SchemaDumpException("Connection settings do not name a database");
    }
    return settings.database();
  }
}
