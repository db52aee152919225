package io.b2mash.schemaswitch.clone;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SearchPathPatcherTest {

  @Test
  void prependsTenantSearchPath() {
    String patched =
        SearchPathPatcher.patch("CREATE TABLE accounts (id bigint);", "acme", "public");

    assertThat(patched)
        .isEqualTo("SET search_path = \"acme\", \"public\";\nCREATE TABLE accounts (id bigint);");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "SET search_path = public, pg_catalog;",
        "SELECT pg_catalog.set_config('search_path', '', false);",
        "SET lock_timeout = 0;",
        "SET transaction_timeout = 0;",
        "SET idle_in_transaction_session_timeout = 0;",
        "CREATE SCHEMA public;",
        "COMMENT ON SCHEMA public IS 'standard public schema';",
        "set search_path to public;",
        "\\restrict AbC123",
        "  \\unrestrict AbC123"
      })
  void removesStatementsThatConflictWithTenantSchema(String line) {
    assertThat(SearchPathPatcher.isAllowed(line)).isFalse();
    assertThat(SearchPathPatcher.patch(line, "acme", "public"))
        .isEqualTo(SearchPathPatcher.searchPathStatement("acme", "public") + "\n");
  }

  @Test
  void keepsOrdinaryStatements() {
    assertThat(SearchPathPatcher.isAllowed("SET statement_timeout = 0;")).isTrue();
    assertThat(SearchPathPatcher.isAllowed("CREATE TABLE schemas (name text);")).isTrue();
  }

  @Test
  void rewritesDefaultSchemaQualifiers() {
    String dump =
        """
        CREATE TABLE public.accounts (id bigint NOT NULL);
        ALTER TABLE ONLY "public".invoices ADD CONSTRAINT invoices_account_fk
            FOREIGN KEY (account_id) REFERENCES public.accounts(id);
        CREATE TABLE public_archive.entries (id bigint);
        """;

    String patched = SearchPathPatcher.patch(dump, "acme", "public");

    assertThat(patched)
        .contains("CREATE TABLE \"acme\".accounts")
        .contains("ALTER TABLE ONLY \"acme\".invoices")
        .contains("REFERENCES \"acme\".accounts(id)")
        .contains("CREATE TABLE public_archive.entries");
  }

  @Test
  void dropsRestrictGuardsWrittenByCurrentPgDump() {
    String dump =
        """
        --
        \\restrict AbC123
        SET statement_timeout = 0;
        CREATE TABLE public.accounts (id bigint NOT NULL);
        \\unrestrict AbC123
        """;

    String patched = SearchPathPatcher.patch(dump, "acme", "public");

    assertThat(patched)
        .doesNotContain("restrict")
        .isEqualTo(
            """
            SET search_path = "acme", "public";
            --
            SET statement_timeout = 0;
            CREATE TABLE "acme".accounts (id bigint NOT NULL);""");
  }

  @Test
  void leavesPersistentSchemaQualifiersAlone() {
    String dump =
        """
        CREATE TABLE public.contacts (email shared_extensions.citext NOT NULL);
        ALTER TABLE public.contacts ALTER id SET DEFAULT shared_extensions.uuid_generate_v4();
        """;

    String patched = SearchPathPatcher.patch(dump, "acme", "public");

    assertThat(patched)
        .contains("CREATE TABLE \"acme\".contacts (email shared_extensions.citext NOT NULL)")
        .contains("SET DEFAULT shared_extensions.uuid_generate_v4()");
  }
}
