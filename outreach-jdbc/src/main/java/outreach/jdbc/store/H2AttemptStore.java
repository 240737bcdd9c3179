package outreach.jdbc.store;

import outreach.util.JsonCodec;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 attempt store, used for tests and embedded deployments.
 */
public final class H2AttemptStore extends AbstractJdbcAttemptStore {

  public H2AttemptStore() {
    super();
  }

  public H2AttemptStore(String tableName) {
    super(tableName);
  }

  public H2AttemptStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcAttemptStore withTableName(String tableName) {
    return new H2AttemptStore(tableName, jsonCodec());
  }

  @Override
  public AbstractJdbcAttemptStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2AttemptStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected boolean isUniqueViolation(SQLException e) {
    return "23505".equals(e.getSQLState());
  }
}
