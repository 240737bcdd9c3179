package outreach.spi;

import outreach.model.OutreachAttempt;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for {@link OutreachAttempt} rows.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Rows are unique per (attendee, wave) and are never deleted.
 * Updates are optimistic: a row is replaced only when its stored version is exactly one
 * less than the new version, so a concurrent writer is detected rather than overwritten.
 *
 * @see outreach.jdbc.store.AbstractJdbcAttemptStore
 */
public interface AttemptStore {

  /**
   * Inserts a new attempt.
   *
   * @throws outreach.InvalidInputException if an attempt already exists for the
   *     attendee and wave
   */
  void insertNew(Connection conn, OutreachAttempt attempt);

  Optional<OutreachAttempt> find(Connection conn, long attendeeId, String wave);

  Optional<OutreachAttempt> findById(Connection conn, String attemptId);

  /**
   * Replaces the stored row with {@code next} when the stored version equals
   * {@code next.version() - 1}.
   *
   * @return the number of rows updated (0 on a lost race, 1 otherwise)
   */
  int update(Connection conn, OutreachAttempt next);

  /** All attempts of the attendee across waves, oldest first. */
  List<OutreachAttempt> findByAttendee(Connection conn, long attendeeId);

  List<OutreachAttempt> queryByCompanyWave(Connection conn, long companyId, String wave);

  /**
   * Attempts in AWAITING_REPLY or FOLLOW_UP_DUE whose follow-up eligibility time is at or
   * before {@code asOf} and which carry no reply or claim signal, earliest first.
   */
  List<OutreachAttempt> queryDueForFollowUp(Connection conn, Instant asOf, int limit);

  /**
   * Attempts needing a human: FAILED, suppressed for an ambiguous role, or generated
   * with a failed delivery.
   */
  List<OutreachAttempt> queryPendingReview(Connection conn, int limit);
}
