package io.b2mash.schemaswitch.task;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.IdentityHashMap;
import java.util.Map;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

/**
 * Sorts per-tenant failures into {@link FailureKind}s by walking the cause chain. Only failures to
 * obtain or keep a connection count as retryable.
 */
public class FailureClassifier {

  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  public FailureKind classify(Throwable failure) {
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    for (Throwable t = failure; t != null && seen.put(t, true) == null; t = t.getCause()) {
      if (t instanceof SQLTransientConnectionException
          || t instanceof CannotGetJdbcConnectionException) {
        return FailureKind.RETRYABLE;
      }
      if (t instanceof SQLException sqlException
          && sqlException.getSQLState() != null
          && sqlException.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS)) {
        return FailureKind.RETRYABLE;
      }
    }
    return FailureKind.TERMINAL;
  }
}
