package outreach.jdbc.store;

import outreach.classify.RoleClassifier;
import outreach.jdbc.JdbcTemplate;
import outreach.jdbc.OutreachStoreException;
import outreach.model.AttendanceType;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.model.RoleClass;
import outreach.spi.ConnectionProvider;
import outreach.spi.ResearchStore;
import outreach.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only {@link ResearchStore} over the research tables.
 *
 * <p>Bullets are a JSON array of strings. The attendee {@code ticket_type} column holds
 * the raw ticket tag and is parsed with {@link AttendanceType#fromTicketType(String)}.
 * When the {@code role_class} column is empty the role is derived from title and job function.
 */
public final class JdbcResearchStore implements ResearchStore {
  public static final String DEFAULT_COMPANY_TABLE = "outreach_company";
  public static final String DEFAULT_ATTENDEE_TABLE = "outreach_attendee";

  private static final String COMPANY_COLUMNS =
      "company_id, name, website, industry, employee_count, location_count, overview, " +
      "dc_count, dc_source, truck_count, truck_source, bullets, hook, gate_fit, truck_fit, " +
      "combined_score";

  private static final String ATTENDEE_COLUMNS =
      "attendee_id, company_id, first_name, last_name, email, title, job_function, " +
      "management_level, role_class, ticket_type, linkedin_url, gate_fit, truck_fit, combined_score";

  private final ConnectionProvider connectionProvider;
  private final String companyTable;
  private final String attendeeTable;
  private final JsonCodec jsonCodec;
  private final RoleClassifier roleClassifier;

  private final JdbcTemplate.RowMapper<CompanyRecord> companyMapper = this::mapCompany;
  private final JdbcTemplate.RowMapper<AttendeeRecord> attendeeMapper = this::mapAttendee;

  public JdbcResearchStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, DEFAULT_COMPANY_TABLE, DEFAULT_ATTENDEE_TABLE, JsonCodec.getDefault());
  }

  public JdbcResearchStore(ConnectionProvider connectionProvider, String companyTable,
      String attendeeTable, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.companyTable = checkTableName(companyTable);
    this.attendeeTable = checkTableName(attendeeTable);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.roleClassifier = new RoleClassifier();
  }

  @Override
  public Optional<CompanyRecord> getCompany(long companyId) {
    String sql = "SELECT " + COMPANY_COLUMNS + " FROM " + companyTable + " WHERE company_id=?";
    return withConnection(conn -> JdbcTemplate.queryOne(conn, sql, companyMapper, companyId));
  }

  @Override
  public List<AttendeeRecord> getAttendees(long companyId) {
    String sql = "SELECT " + ATTENDEE_COLUMNS + " FROM " + attendeeTable +
        " WHERE company_id=? ORDER BY attendee_id";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, attendeeMapper, companyId));
  }

  @Override
  public Optional<AttendeeRecord> getAttendee(long attendeeId) {
    String sql = "SELECT " + ATTENDEE_COLUMNS + " FROM " + attendeeTable + " WHERE attendee_id=?";
    return withConnection(conn -> JdbcTemplate.queryOne(conn, sql, attendeeMapper, attendeeId));
  }

  @Override
  public List<Long> topCompanyIds(int n) {
    if (n <= 0) {
      return List.of();
    }
    String sql = "SELECT company_id FROM " + companyTable +
        " ORDER BY combined_score DESC, dc_count DESC, company_id LIMIT ?";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, rs -> rs.getLong("company_id"), n));
  }

  private CompanyRecord mapCompany(ResultSet rs) throws SQLException {
    return CompanyRecord.builder(rs.getLong("company_id"), rs.getString("name"))
        .website(rs.getString("website"))
        .industry(rs.getString("industry"))
        .employeeCount(rs.getInt("employee_count"))
        .locationCount(rs.getInt("location_count"))
        .overview(rs.getString("overview"))
        .dcCount(rs.getInt("dc_count"), rs.getString("dc_source"))
        .truckCount(rs.getInt("truck_count"), rs.getString("truck_source"))
        .bullets(jsonCodec.parseArray(rs.getString("bullets")))
        .hook(rs.getString("hook"))
        .fitScores(rs.getInt("gate_fit"), rs.getInt("truck_fit"))
        .combinedScore(rs.getInt("combined_score"))
        .build();
  }

  private AttendeeRecord mapAttendee(ResultSet rs) throws SQLException {
    String title = rs.getString("title");
    String jobFunction = rs.getString("job_function");
    String role = rs.getString("role_class");
    return AttendeeRecord.builder(rs.getLong("attendee_id"), rs.getLong("company_id"),
            rs.getString("first_name"))
        .lastName(rs.getString("last_name"))
        .email(rs.getString("email"))
        .title(title)
        .jobFunction(jobFunction)
        .managementLevel(rs.getString("management_level"))
        .role(role == null || role.isBlank()
            ? roleClassifier.classify(title, jobFunction)
            : RoleClass.valueOf(role.trim().toUpperCase(Locale.ROOT)))
        .attendanceType(AttendanceType.fromTicketType(rs.getString("ticket_type")))
        .linkedinUrl(rs.getString("linkedin_url"))
        .scores(rs.getInt("gate_fit"), rs.getInt("truck_fit"), rs.getInt("combined_score"))
        .build();
  }

  private <T> T withConnection(Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new OutreachStoreException("Failed to read research data", e);
    }
  }

  private static String checkTableName(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
