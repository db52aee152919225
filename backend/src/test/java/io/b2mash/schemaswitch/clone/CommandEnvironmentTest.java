package io.b2mash.schemaswitch.clone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class CommandEnvironmentTest {

  private final CommandEnvironment environment =
      new CommandEnvironment(Map.of("PATH", "/usr/bin", "PGHOST", "base-host"));

  @Test
  void overridesLastUntilScopeCloses() {
    try (var scope = environment.apply(Map.of("PGHOST", "db", "PGUSER", "app"))) {
      assertThat(environment.get("PGHOST")).isEqualTo("db");
      assertThat(environment.get("PGUSER")).isEqualTo("app");
      assertThat(environment.get("PATH")).isEqualTo("/usr/bin");
    }

    assertThat(environment.get("PGHOST")).isEqualTo("base-host");
    assertThat(environment.snapshot()).doesNotContainKey("PGUSER");
  }

  @Test
  void previousValuesComeBackWhenWorkFails() {
    assertThatThrownBy(
            () -> {
              try (var scope = environment.apply(Map.of("PGPASSWORD", "secret"))) {
                throw new IllegalStateException("dump failed");
              }
            })
        .isInstanceOf(IllegalStateException.class);

    assertThat(environment.get("PGPASSWORD")).isNull();
  }

  @Test
  void nestedScopesRestoreInnerThenOuter() {
    try (var outer = environment.apply(Map.of("PGHOST", "outer"))) {
      try (var inner = environment.apply(Map.of("PGHOST", "inner"))) {
        assertThat(environment.get("PGHOST")).isEqualTo("inner");
      }
      assertThat(environment.get("PGHOST")).isEqualTo("outer");
    }
    assertThat(environment.get("PGHOST")).isEqualTo("base-host");
  }

  @Test
  void nullValuesAreSkipped() {
    var variables = new HashMap<String, String>();
    variables.put("PGHOST", null);
    variables.put("PGPORT", "5433");

    try (var scope = environment.apply(variables)) {
      assertThat(environment.get("PGHOST")).isEqualTo("base-host");
      assertThat(environment.get("PGPORT")).isEqualTo("5433");
    }
  }

  @Test
  void overridesAreInvisibleToOtherThreads() throws Exception {
    try (var scope = environment.apply(Map.of("PGHOST", "mine"))) {
      String seen = CompletableFuture.supplyAsync(() -> environment.get("PGHOST")).get();

      assertThat(seen).isEqualTo("base-host");
    }
  }
}
