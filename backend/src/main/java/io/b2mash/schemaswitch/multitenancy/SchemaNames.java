package io.b2mash.schemaswitch.multitenancy;

import java.util.regex.Pattern;

/** Validation and quoting for schema identifiers that end up concatenated into DDL. */
public final class SchemaNames {

  private static final Pattern SCHEMA_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  private static final int MAX_LENGTH = 63;

  private SchemaNames() {}

  /** Returns the name unchanged, or throws if it is not a plain PostgreSQL identifier. */
  public static String validate(String schemaName) {
    if (schemaName == null
        || schemaName.length() > MAX_LENGTH
        || !SCHEMA_PATTERN.matcher(schemaName).matches()) {
      throw new IllegalArgumentException("Invalid schema name: " + schemaName);
    }
    return schemaName;
  }

  public static boolean isValid(String schemaName) {
    return schemaName != null
        && schemaName.length() <= MAX_LENGTH
        && SCHEMA_PATTERN.matcher(schemaName).matches();
  }

  public static String quote(String schemaName) {
    return "\"" + validate(schemaName) + "\"";
  }
}
