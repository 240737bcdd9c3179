package outreach.jdbc.store;

import outreach.util.JsonCodec;

import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL attempt store.
 *
 * <p>A duplicate (attendee, wave) insert fails with {@code unique_violation} (23505). The
 * failed statement aborts the surrounding transaction, so callers that insert inside an
 * explicit transaction must roll back before reusing the connection.
 */
public final class PostgresAttemptStore extends AbstractJdbcAttemptStore {

  public PostgresAttemptStore() {
    super();
  }

  public PostgresAttemptStore(String tableName) {
    super(tableName);
  }

  public PostgresAttemptStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcAttemptStore withTableName(String tableName) {
    return new PostgresAttemptStore(tableName, jsonCodec());
  }

  @Override
  public AbstractJdbcAttemptStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresAttemptStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected boolean isUniqueViolation(SQLException e) {
    return "23505".equals(e.getSQLState());
  }
}
