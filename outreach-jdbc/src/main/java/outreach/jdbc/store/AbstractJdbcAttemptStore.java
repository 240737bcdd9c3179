package outreach.jdbc.store;

import outreach.InvalidInputException;
import outreach.jdbc.JdbcTemplate;
import outreach.jdbc.OutreachStoreException;
import outreach.model.AttemptState;
import outreach.model.FactClaim;
import outreach.model.GeneratedMessage;
import outreach.model.GenerationStatus;
import outreach.model.GroundingIssue;
import outreach.model.GroundingVerdict;
import outreach.model.OutreachAttempt;
import outreach.model.ReplySignal;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.model.SuppressionReason;
import outreach.model.Treatment;
import outreach.model.TreatmentKind;
import outreach.spi.AttemptStore;
import outreach.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC attempt store with standard SQL implementations.
 *
 * <p>States are stored as their numeric {@link AttemptState#code()}; the other enums as
 * their names. Claimed facts and grounding issues are stored as JSON through the
 * configured {@link JsonCodec}. Updates are conditional on the stored version, so a
 * writer holding a stale copy updates zero rows.
 *
 * <p>Subclasses identify the database they handle and how it reports unique-key
 * violations. Register custom implementations via
 * {@code META-INF/services/outreach.jdbc.store.AbstractJdbcAttemptStore}.
 *
 * @see JdbcAttemptStores
 */
public abstract class AbstractJdbcAttemptStore implements AttemptStore {
  public static final String DEFAULT_TABLE = "outreach_attempt";
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS =
      "attempt_id, attendee_id, company_id, wave, treatment_kind, priority_rank, " +
      "suppression_reason, company_contacts, state, generation_status, send_status, " +
      "delivery_id, sent_at, reply_signal, signal_at, follow_up_eligible_at, " +
      "follow_up_claimed_at, follow_up_sent, follow_up_sent_at, subject, body, claims, " +
      "grounding_issues, last_error, failed_stage, version, created_at, updated_at";

  protected static final String FOLLOW_UP_STATES_IN =
      "(" + AttemptState.AWAITING_REPLY.code() + "," + AttemptState.FOLLOW_UP_DUE.code() + ")";

  protected static final String REVIEW_CONDITION =
      "state=" + AttemptState.FAILED.code() +
      " OR (state=" + AttemptState.SUPPRESSED.code() +
      " AND suppression_reason='" + SuppressionReason.AMBIGUOUS_ROLE.name() + "')" +
      " OR (state=" + AttemptState.GENERATED.code() +
      " AND send_status IN ('" + SendStatus.ERROR.name() + "','" + SendStatus.UNCONFIRMED.name() + "'))" +
      " OR (state=" + AttemptState.FOLLOW_UP_DUE.code() + " AND follow_up_claimed_at IS NOT NULL)";

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<OutreachAttempt> rowMapper = this::mapRow;

  protected AbstractJdbcAttemptStore() {
    this(DEFAULT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcAttemptStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcAttemptStore(String tableName, JsonCodec jsonCodec) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this attempt store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this attempt store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store that writes to {@code tableName}.
   */
  public abstract AbstractJdbcAttemptStore withTableName(String tableName);

  /**
   * Returns a copy of this store that encodes JSON columns with {@code jsonCodec}.
   */
  public abstract AbstractJdbcAttemptStore withJsonCodec(JsonCodec jsonCodec);

  /**
   * Classpath location of the DDL for this database.
   */
  public String schemaResource() {
    return "outreach/jdbc/schema/" + name() + ".sql";
  }

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Returns {@code true} if the exception reports a duplicate (attendee, wave) row.
   * The default accepts any integrity-constraint SQL state (class 23).
   */
  protected boolean isUniqueViolation(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }

  @Override
  public void insertNew(Connection conn, OutreachAttempt attempt) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    GeneratedMessage message = attempt.message();
    Treatment treatment = attempt.treatment();
    try {
      JdbcTemplate.update(conn, sql,
          attempt.attemptId(), attempt.attendeeId(), attempt.companyId(), attempt.wave(),
          treatment.kind().name(), treatment.priorityRank(), name(treatment.reason()),
          attempt.companyContacts(), attempt.state().code(),
          attempt.generationStatus().name(), attempt.sendStatus().name(),
          attempt.deliveryId(), timestamp(attempt.sentAt()),
          attempt.replySignal().name(), timestamp(attempt.signalAt()),
          timestamp(attempt.followUpEligibleAt()), timestamp(attempt.followUpClaimedAt()),
          attempt.followUpSent(), timestamp(attempt.followUpSentAt()),
          message == null ? null : message.subject(),
          message == null ? null : message.body(),
          message == null ? null : encodeClaims(message.claims()),
          message == null ? null : encodeIssues(message.verdict()),
          truncateError(attempt.lastError()), name(attempt.failedStage()),
          attempt.version(), timestamp(attempt.createdAt()), timestamp(attempt.updatedAt()));
    } catch (OutreachStoreException e) {
      SQLException cause = e.sqlException();
      if (cause != null && isUniqueViolation(cause)) {
        throw new InvalidInputException(Stage.CLASSIFY, attempt.attendeeId(), attempt.companyId(),
            "An attempt already exists for wave " + attempt.wave());
      }
      throw e;
    }
  }

  @Override
  public Optional<OutreachAttempt> find(Connection conn, long attendeeId, String wave) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE attendee_id=? AND wave=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, attendeeId, wave);
  }

  @Override
  public Optional<OutreachAttempt> findById(Connection conn, String attemptId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE attempt_id=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, attemptId);
  }

  @Override
  public int update(Connection conn, OutreachAttempt next) {
    String sql = "UPDATE " + tableName() + " SET " +
        "treatment_kind=?, priority_rank=?, suppression_reason=?, company_contacts=?, " +
        "state=?, generation_status=?, send_status=?, delivery_id=?, sent_at=?, " +
        "reply_signal=?, signal_at=?, follow_up_eligible_at=?, follow_up_claimed_at=?, " +
        "follow_up_sent=?, follow_up_sent_at=?, subject=?, body=?, claims=?, " +
        "grounding_issues=?, last_error=?, failed_stage=?, version=?, updated_at=? " +
        "WHERE attempt_id=? AND version=?";
    GeneratedMessage message = next.message();
    Treatment treatment = next.treatment();
    return JdbcTemplate.update(conn, sql,
        treatment.kind().name(), treatment.priorityRank(), name(treatment.reason()),
        next.companyContacts(), next.state().code(),
        next.generationStatus().name(), next.sendStatus().name(),
        next.deliveryId(), timestamp(next.sentAt()),
        next.replySignal().name(), timestamp(next.signalAt()),
        timestamp(next.followUpEligibleAt()), timestamp(next.followUpClaimedAt()),
        next.followUpSent(), timestamp(next.followUpSentAt()),
        message == null ? null : message.subject(),
        message == null ? null : message.body(),
        message == null ? null : encodeClaims(message.claims()),
        message == null ? null : encodeIssues(message.verdict()),
        truncateError(next.lastError()), name(next.failedStage()),
        next.version(), timestamp(next.updatedAt()),
        next.attemptId(), next.version() - 1);
  }

  @Override
  public List<OutreachAttempt> findByAttendee(Connection conn, long attendeeId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE attendee_id=? ORDER BY created_at, attempt_id";
    return JdbcTemplate.query(conn, sql, rowMapper, attendeeId);
  }

  @Override
  public List<OutreachAttempt> queryByCompanyWave(Connection conn, long companyId, String wave) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE company_id=? AND wave=? ORDER BY attempt_id";
    return JdbcTemplate.query(conn, sql, rowMapper, companyId, wave);
  }

  @Override
  public List<OutreachAttempt> queryDueForFollowUp(Connection conn, Instant asOf, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE state IN " + FOLLOW_UP_STATES_IN +
        " AND reply_signal='" + ReplySignal.NONE.name() + "'" +
        " AND follow_up_claimed_at IS NULL" +
        " AND follow_up_eligible_at IS NOT NULL AND follow_up_eligible_at <= ?" +
        " ORDER BY follow_up_eligible_at, attempt_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, Timestamp.from(asOf), limit);
  }

  @Override
  public List<OutreachAttempt> queryPendingReview(Connection conn, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE " + REVIEW_CONDITION + " ORDER BY attempt_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, limit);
  }

  protected OutreachAttempt mapRow(ResultSet rs) throws SQLException {
    Treatment treatment = new Treatment(
        TreatmentKind.valueOf(rs.getString("treatment_kind")),
        rs.getInt("priority_rank"),
        enumOrNull(SuppressionReason.class, rs.getString("suppression_reason")));
    String subject = rs.getString("subject");
    GeneratedMessage message = subject == null ? null : new GeneratedMessage(
        subject,
        rs.getString("body"),
        decodeClaims(rs.getString("claims")),
        decodeIssues(rs.getString("grounding_issues")));
    return new OutreachAttempt(
        rs.getString("attempt_id"),
        rs.getLong("attendee_id"),
        rs.getLong("company_id"),
        rs.getString("wave"),
        treatment,
        rs.getInt("company_contacts"),
        AttemptState.fromCode(rs.getInt("state")),
        GenerationStatus.valueOf(rs.getString("generation_status")),
        SendStatus.valueOf(rs.getString("send_status")),
        rs.getString("delivery_id"),
        instant(rs, "sent_at"),
        ReplySignal.valueOf(rs.getString("reply_signal")),
        instant(rs, "signal_at"),
        instant(rs, "follow_up_eligible_at"),
        instant(rs, "follow_up_claimed_at"),
        rs.getBoolean("follow_up_sent"),
        instant(rs, "follow_up_sent_at"),
        message,
        rs.getString("last_error"),
        enumOrNull(Stage.class, rs.getString("failed_stage")),
        rs.getInt("version"),
        instant(rs, "created_at"),
        instant(rs, "updated_at"));
  }

  private String encodeClaims(List<FactClaim> claims) {
    List<Map<String, String>> records = new ArrayList<>(claims.size());
    for (FactClaim claim : claims) {
      Map<String, String> record = new LinkedHashMap<>();
      record.put("field", claim.rawField());
      record.put("value", claim.value());
      records.add(record);
    }
    return jsonCodec.toJsonRecords(records);
  }

  private List<FactClaim> decodeClaims(String json) {
    List<FactClaim> claims = new ArrayList<>();
    for (Map<String, String> record : jsonCodec.parseRecords(json)) {
      claims.add(FactClaim.parse(record.get("field"), record.get("value")));
    }
    return claims;
  }

  private String encodeIssues(GroundingVerdict verdict) {
    List<Map<String, String>> records = new ArrayList<>(verdict.issues().size());
    for (GroundingIssue issue : verdict.issues()) {
      Map<String, String> record = new LinkedHashMap<>();
      record.put("kind", issue.kind().name());
      record.put("detail", issue.detail());
      records.add(record);
    }
    return jsonCodec.toJsonRecords(records);
  }

  private GroundingVerdict decodeIssues(String json) {
    List<GroundingIssue> issues = new ArrayList<>();
    for (Map<String, String> record : jsonCodec.parseRecords(json)) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.valueOf(record.get("kind")),
          record.get("detail")));
    }
    return new GroundingVerdict(issues);
  }

  protected static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  protected static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static String name(Enum<?> value) {
    return value == null ? null : value.name();
  }

  private static <E extends Enum<E>> E enumOrNull(Class<E> type, String name) {
    return name == null ? null : Enum.valueOf(type, name);
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
