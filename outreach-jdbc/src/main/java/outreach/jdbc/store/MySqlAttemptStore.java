package outreach.jdbc.store;

import outreach.util.JsonCodec;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL attempt store. Also compatible with TiDB.
 *
 * <p>MySQL reports every integrity violation as SQL state 23000, so duplicates are
 * recognized by vendor error code {@code ER_DUP_ENTRY} (1062).
 */
public final class MySqlAttemptStore extends AbstractJdbcAttemptStore {
  private static final int ER_DUP_ENTRY = 1062;

  public MySqlAttemptStore() {
    super();
  }

  public MySqlAttemptStore(String tableName) {
    super(tableName);
  }

  public MySqlAttemptStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcAttemptStore withTableName(String tableName) {
    return new MySqlAttemptStore(tableName, jsonCodec());
  }

  @Override
  public AbstractJdbcAttemptStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlAttemptStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected boolean isUniqueViolation(SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY;
  }
}
