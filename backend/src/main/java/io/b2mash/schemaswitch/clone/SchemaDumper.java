package io.b2mash.schemaswitch.clone;

import io.b2mash.schemaswitch.connection.ConnectionSettings;
import java.util.List;

public interface SchemaDumper {

  /** Structure only: no data, no ownership, no privileges. */
  String dumpSchema(String schema, ConnectionSettings settings);

  /** Data of the given bookkeeping tables only, as INSERT statements. */
  String dumpTableData(String schema, List<String> tables, ConnectionSettings settings);
}
