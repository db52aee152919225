package io.b2mash.schemaswitch.clone;

import io.b2mash.schemaswitch.multitenancy.SchemaNames;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites a dump of the template schema so it can be replayed into a tenant schema. Statements
 * that would fight the adapter's own search path, or that fail on older servers, are removed; the
 * result starts with a single {@code SET search_path} for the tenant.
 *
 * <p>Every {@code <default>.} qualifier is rewritten to the tenant schema, including references to
 * extension objects installed in the default schema. Extensions belong in a persistent schema.
 */
public final class SearchPathPatcher {

  private static final List<Pattern> BLACKLISTED_STATEMENTS =
      List.of(
          Pattern.compile("SET search_path", Pattern.CASE_INSENSITIVE),
          Pattern.compile("pg_catalog\\.set_config\\('search_path'", Pattern.CASE_INSENSITIVE),
          Pattern.compile("SET lock_timeout", Pattern.CASE_INSENSITIVE),
          Pattern.compile("SET transaction_timeout", Pattern.CASE_INSENSITIVE),
          Pattern.compile("SET idle_in_transaction_session_timeout", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*CREATE SCHEMA ", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*COMMENT ON SCHEMA ", Pattern.CASE_INSENSITIVE),
          // psql meta-commands such as \restrict are not SQL
          Pattern.compile("^\\s*\\\\"));

  private SearchPathPatcher() {}

  public static String searchPathStatement(String tenant, String defaultSchema) {
    return "SET search_path = "
        + SchemaNames.quote(tenant)
        + ", "
        + SchemaNames.quote(defaultSchema)
        + ";";
  }

  public static String patch(String sql, String tenant, String defaultSchema) {
    Pattern qualifier =
        Pattern.compile(
            "(?<![\\w\"])(?:\""
                + Pattern.quote(defaultSchema)
                + "\"|"
                + Pattern.quote(defaultSchema)
                + ")\\.");
    String replacement = Matcher.quoteReplacement(SchemaNames.quote(tenant) + ".");

    String body =
        sql.lines()
            .filter(SearchPathPatcher::isAllowed)
            .map(line -> qualifier.matcher(line).replaceAll(replacement))
            .collect(Collectors.joining("\n"));
    return searchPathStatement(tenant, defaultSchema) + "\n" + body;
  }

  static boolean isAllowed(String line) {
    for (Pattern pattern : BLACKLISTED_STATEMENTS) {
      if (pattern.matcher(line).find()) {
        return false;
      }
    }
    return true;
  }
}
