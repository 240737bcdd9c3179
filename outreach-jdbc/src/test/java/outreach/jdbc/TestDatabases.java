package outreach.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.util.JsonCodec;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/** Fresh H2 databases with the shipped schema, plus research row inserts. */
public final class TestDatabases {

  private TestDatabases() {
  }

  public static JdbcDataSource h2() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    return ds;
  }

  /** Runs every statement of a schema resource against the data source. */
  public static void createSchema(DataSource dataSource, String resource) {
    String script;
    try (InputStream in = TestDatabases.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource: " + resource);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          st.execute(sql);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to create schema from " + resource, e);
    }
  }

  public static void insertCompany(Connection conn, CompanyRecord c) {
    JdbcTemplate.update(conn, "INSERT INTO outreach_company (company_id, name, website, industry, " +
            "employee_count, location_count, overview, dc_count, dc_source, truck_count, truck_source, " +
            "bullets, hook, gate_fit, truck_fit, combined_score) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        c.id(), c.name(), c.website(), c.industry(), c.employeeCount(), c.locationCount(),
        c.overview(), c.dcCount(), c.dcSource(), c.truckCount(), c.truckSource(),
        JsonCodec.getDefault().toJsonArray(c.bullets()), c.hook(), c.gateFit(), c.truckFit(),
        c.combinedScore());
  }

  /**
   * Inserts an attendee. A {@code null} role leaves {@code role_class} empty so the store
   * derives it from the title.
   */
  public static void insertAttendee(Connection conn, AttendeeRecord a, String ticketType, String role) {
    JdbcTemplate.update(conn, "INSERT INTO outreach_attendee (attendee_id, company_id, first_name, " +
            "last_name, email, title, job_function, management_level, role_class, ticket_type, " +
            "linkedin_url, gate_fit, truck_fit, combined_score) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        a.id(), a.companyId(), a.firstName(), a.lastName(), a.email(), a.title(), a.jobFunction(),
        a.managementLevel(), role, ticketType, a.linkedinUrl(), a.gateFit(), a.truckFit(),
        a.combinedScore());
  }
}
