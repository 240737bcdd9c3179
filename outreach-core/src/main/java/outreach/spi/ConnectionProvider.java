package outreach.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections for attempt and budget updates. Callers close the
 * returned connection.
 *
 * @see outreach.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
