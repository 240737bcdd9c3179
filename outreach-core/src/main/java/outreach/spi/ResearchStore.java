package outreach.spi;

import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to researched companies and attendees. The engine never writes
 * research data.
 *
 * @see outreach.jdbc.store.JdbcResearchStore
 */
public interface ResearchStore {

  Optional<CompanyRecord> getCompany(long companyId);

  /**
   * Returns every attendee linked to the company, in no particular order.
   *
   * @param companyId company identifier
   * @return attendees, empty if the company has none
   */
  List<AttendeeRecord> getAttendees(long companyId);

  Optional<AttendeeRecord> getAttendee(long attendeeId);

  /**
   * Returns the ids of the {@code n} highest-ranked target companies: combined score
   * descending, then distribution-center count descending, then id ascending.
   *
   * @param n number of companies to return
   * @return at most {@code n} company ids, best first
   */
  List<Long> topCompanyIds(int n);
}
