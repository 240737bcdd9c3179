package outreach.testing;

import outreach.compose.FactPayload;
import outreach.compose.GenerationRequest;
import outreach.compose.GenerationResult;
import outreach.model.AttendanceType;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.model.FactClaim;
import outreach.model.FactField;
import outreach.model.RoleClass;
import outreach.spi.GenerationService;

import java.util.ArrayList;
import java.util.List;

/** Research records and a well-behaved generation service for tests. */
public final class Fixtures {

  private static final String[] FIRST_NAMES = {
      "Avery", "Blake", "Casey", "Dana", "Emery", "Finley", "Gray", "Harper", "Indy", "Jordan"};

  private Fixtures() {
  }

  public static String firstName(long id) {
    return FIRST_NAMES[(int) (id % FIRST_NAMES.length)];
  }

  public static CompanyRecord company(long id, int gateFit, int truckFit) {
    return CompanyRecord.builder(id, "Company " + id)
        .industry("Grocery")
        .overview("Regional grocery chain.")
        .fitScores(gateFit, truckFit)
        .build();
  }

  /** Gate-fit retailer with a sourced DC count. */
  public static CompanyRecord retailer(long id, String name, int dcCount) {
    return CompanyRecord.builder(id, name)
        .industry("Grocery")
        .overview(name + " runs supermarkets across the Midwest.")
        .dcCount(dcCount, "2024 annual report")
        .hook("Opened a new automated cross-dock this spring.")
        .bullets(List.of("Operates its own private fleet.", "Expanding into two new states."))
        .fitScores(80, 40)
        .build();
  }

  public static AttendeeRecord attendee(long id, CompanyRecord company, AttendanceType type) {
    return AttendeeRecord.builder(id, company.id(), firstName(id))
        .lastName("Tester")
        .email("person" + id + "@example.com")
        .title("Director of Operations")
        .attendanceType(type)
        .scoresFrom(company)
        .build();
  }

  public static AttendeeRecord exhibitor(long id, CompanyRecord company, String title, RoleClass role) {
    return AttendeeRecord.builder(id, company.id(), firstName(id))
        .email("person" + id + "@example.com")
        .title(title)
        .role(role)
        .attendanceType(AttendanceType.EXHIBITOR_SPONSOR)
        .scoresFrom(company)
        .build();
  }

  /**
   * Writes a short message from the payload only, citing the count when one was supplied.
   */
  public static GenerationService groundedGenerator() {
    return Fixtures::groundedResult;
  }

  public static GenerationResult groundedResult(GenerationRequest request) {
    FactPayload payload = request.payload();
    String firstName = payload.value(FactField.FIRST_NAME);
    String company = payload.value(FactField.COMPANY_NAME);
    List<FactClaim> claims = new ArrayList<>();
    claims.add(FactClaim.of(FactField.FIRST_NAME, firstName));
    claims.add(FactClaim.of(FactField.COMPANY_NAME, company));
    StringBuilder body = new StringBuilder("Hi ").append(firstName).append(",\n\n");
    String dcCount = payload.value(FactField.DC_COUNT);
    String trucks = payload.value(FactField.TRUCK_COUNT);
    if (dcCount != null) {
      body.append("With ").append(dcCount).append(" distribution centers, ").append(company)
          .append(" moves a lot of freight through its gates.");
      claims.add(FactClaim.of(FactField.DC_COUNT, dcCount));
    } else if (trucks != null) {
      body.append("Running a fleet of ").append(trucks).append(" trucks keeps ").append(company)
          .append(" busy.");
      claims.add(FactClaim.of(FactField.TRUCK_COUNT, trucks));
    } else {
      body.append("I enjoyed reading about ").append(company).append('.');
    }
    body.append("\n\nBest,\nThe team");
    return new GenerationResult("Hello from the show, " + firstName, body.toString(), claims);
  }
}
