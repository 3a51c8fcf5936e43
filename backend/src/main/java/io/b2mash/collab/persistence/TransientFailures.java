package io.b2mash.collab.persistence;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

/**
 * Classifies persistence failures as transient (connection-level, worth retrying) or permanent.
 * Walks the full cause chain since JPA and Spring wrap the driver exception several levels deep.
 */
public final class TransientFailures {

  /**
   * SQLSTATE codes treated as transient: connection exception class 08 (lost, unable to connect,
   * rejected) and 57P01 (terminated by administrator command).
   */
  static final Set<String> TRANSIENT_SQL_STATES =
      Set.of("08000", "08001", "08003", "08004", "08006", "57P01");

  private TransientFailures() {}

  public static boolean isTransient(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof CannotGetJdbcConnectionException
          || current instanceof SQLTransientConnectionException) {
        return true;
      }
      if (current instanceof SQLException sqlException
          && sqlException.getSQLState() != null
          && TRANSIENT_SQL_STATES.contains(sqlException.getSQLState())) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }
}
