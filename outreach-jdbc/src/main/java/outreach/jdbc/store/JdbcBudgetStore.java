package outreach.jdbc.store;

import outreach.jdbc.JdbcTemplate;
import outreach.jdbc.OutreachStoreException;
import outreach.model.CompanyBudget;
import outreach.spi.BudgetStore;
import outreach.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC budget store. Portable across H2, MySQL and PostgreSQL.
 *
 * <p>The consumed count only moves through single conditional {@code UPDATE}
 * statements, so concurrent senders on any number of instances cannot push a company
 * past its cap. The ranking is stored as a JSON array of attendee ids.
 */
public final class JdbcBudgetStore implements BudgetStore {
  public static final String DEFAULT_TABLE = "outreach_company_budget";

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<CompanyBudget> rowMapper;

  public JdbcBudgetStore() {
    this(DEFAULT_TABLE, JsonCodec.getDefault());
  }

  public JdbcBudgetStore(String tableName, JsonCodec jsonCodec) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new CompanyBudget(
        rs.getLong("company_id"),
        rs.getString("wave"),
        parseRanking(rs.getString("ranking")),
        rs.getInt("contact_cap"),
        rs.getInt("consumed"));
  }

  @Override
  public CompanyBudget saveIfAbsent(Connection conn, CompanyBudget budget) {
    Optional<CompanyBudget> existing = find(conn, budget.companyId(), budget.wave());
    if (existing.isPresent()) {
      return existing.get();
    }
    String sql = "INSERT INTO " + tableName +
        " (company_id, wave, ranking, contact_cap, consumed) VALUES (?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql, budget.companyId(), budget.wave(),
          encodeRanking(budget.ranking()), budget.cap(), budget.consumed());
      return budget;
    } catch (OutreachStoreException e) {
      SQLException cause = e.sqlException();
      if (cause == null || cause.getSQLState() == null || !cause.getSQLState().startsWith("23")) {
        throw e;
      }
      // lost the insert race; the winner's row is authoritative
      return find(conn, budget.companyId(), budget.wave()).orElseThrow(() -> e);
    }
  }

  @Override
  public Optional<CompanyBudget> find(Connection conn, long companyId, String wave) {
    String sql = "SELECT company_id, wave, ranking, contact_cap, consumed FROM " + tableName +
        " WHERE company_id=? AND wave=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, companyId, wave);
  }

  @Override
  public boolean tryConsume(Connection conn, long companyId, String wave, int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("n must be > 0");
    }
    String sql = "UPDATE " + tableName + " SET consumed=consumed+?" +
        " WHERE company_id=? AND wave=? AND consumed+?<=contact_cap";
    return JdbcTemplate.update(conn, sql, n, companyId, wave, n) == 1;
  }

  @Override
  public void release(Connection conn, long companyId, String wave, int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("n must be > 0");
    }
    String sql = "UPDATE " + tableName +
        " SET consumed=CASE WHEN consumed<? THEN 0 ELSE consumed-? END" +
        " WHERE company_id=? AND wave=?";
    JdbcTemplate.update(conn, sql, n, n, companyId, wave);
  }

  private String encodeRanking(List<Long> ranking) {
    List<String> ids = new ArrayList<>(ranking.size());
    for (Long id : ranking) {
      ids.add(Long.toString(id));
    }
    return jsonCodec.toJsonArray(ids);
  }

  private List<Long> parseRanking(String json) {
    List<Long> ids = new ArrayList<>();
    for (String id : jsonCodec.parseArray(json)) {
      ids.add(Long.parseLong(id));
    }
    return ids;
  }
}
