package io.b2mash.schemaswitch.registry;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TenancyStrategyTest {

  @ParameterizedTest(name = "schemas={0}, sqlClone={1}, singleSchema={2} -> {3}")
  @CsvSource({
    "false, false, false, DISABLED",
    "true,  false, false, SCHEMA",
    "true,  true,  false, SQL_CLONE",
    "false, true,  false, DISABLED",
    "false, false, true,  SINGLE_SCHEMA",
    "true,  true,  true,  SINGLE_SCHEMA"
  })
  void singleSchemaWinsAndCloneNeedsSchemas(
      boolean useSchemas, boolean useSqlClone, boolean useSingleSchema, TenancyStrategy expected) {
    assertThat(TenancyStrategy.select(useSchemas, useSqlClone, useSingleSchema))
        .isEqualTo(expected);
  }
}
