package outreach.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in
 * {@link outreach.jdbc.store}.
 */
public final class OutreachStoreException extends RuntimeException {
  public OutreachStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the wrapped {@link SQLException}, or {@code null} if the failure did not come
   * from the driver.
   */
  public SQLException sqlException() {
    return getCause() instanceof SQLException e ? e : null;
  }
}
