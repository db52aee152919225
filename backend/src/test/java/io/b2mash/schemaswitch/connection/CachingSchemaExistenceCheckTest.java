package io.b2mash.schemaswitch.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class CachingSchemaExistenceCheckTest {

  @Mock private JdbcTemplate jdbcTemplate;

  private CachingSchemaExistenceCheck check;

  @BeforeEach
  void setUp() {
    check = new CachingSchemaExistenceCheck(jdbcTemplate, Duration.ofMinutes(5));
  }

  @Test
  void positiveAnswersAreCached() {
    when(jdbcTemplate.queryForObject(anyString(), eq(Boolean.class), eq("acme")))
        .thenReturn(true);

    assertThat(check.exists("acme")).isTrue();
    assertThat(check.exists("acme")).isTrue();

    verify(jdbcTemplate, times(1)).queryForObject(anyString(), eq(Boolean.class), eq("acme"));
  }

  @Test
  void negativeAnswersAreAskedAgain() {
    when(jdbcTemplate.queryForObject(anyString(), eq(Boolean.class), eq("ghost")))
        .thenReturn(false);

    assertThat(check.exists("ghost")).isFalse();
    assertThat(check.exists("ghost")).isFalse();

    verify(jdbcTemplate, times(2)).queryForObject(anyString(), eq(Boolean.class), eq("ghost"));
  }

  @Test
  void evictForgetsCachedSchema() {
    when(jdbcTemplate.queryForObject(anyString(), eq(Boolean.class), eq("acme")))
        .thenReturn(true, false);

    assertThat(check.exists("acme")).isTrue();
    check.evict("acme");

    assertThat(check.exists("acme")).isFalse();
  }
}
