package outreach.model;

import java.util.Objects;

/**
 * Conference attendee linked to exactly one {@link CompanyRecord}.
 *
 * <p>Fit scores are a denormalized snapshot of the company's scores taken at research
 * time. They change only through {@link #withScoresFrom(CompanyRecord)}.
 */
public record AttendeeRecord(
    long id,
    long companyId,
    String firstName,
    String lastName,
    String email,
    String title,
    String jobFunction,
    String managementLevel,
    RoleClass role,
    AttendanceType attendanceType,
    String linkedinUrl,
    int gateFit,
    int truckFit,
    int combinedScore
) {

  public AttendeeRecord {
    Objects.requireNonNull(firstName, "firstName");
    role = role == null ? RoleClass.OTHER : role;
    attendanceType = attendanceType == null ? AttendanceType.OTHER : attendanceType;
  }

  public String fullName() {
    return lastName == null || lastName.isBlank() ? firstName : (firstName + " " + lastName).trim();
  }

  public FitCategory fitCategory(int threshold) {
    return FitCategory.of(gateFit, truckFit, threshold);
  }

  /**
   * Returns a copy whose inherited scores are refreshed from the given company.
   *
   * @param company the attendee's company
   * @return refreshed attendee
   * @throws IllegalArgumentException if {@code company} is not this attendee's company
   */
  public AttendeeRecord withScoresFrom(CompanyRecord company) {
    Objects.requireNonNull(company, "company");
    if (company.id() != companyId) {
      throw new IllegalArgumentException("Attendee " + id + " belongs to company " + companyId
          + ", not " + company.id());
    }
    return new AttendeeRecord(id, companyId, firstName, lastName, email, title, jobFunction,
        managementLevel, role, attendanceType, linkedinUrl,
        company.gateFit(), company.truckFit(), company.combinedScore());
  }

  public static Builder builder(long id, long companyId, String firstName) {
    return new Builder(id, companyId, firstName);
  }

  /** Builder for {@link AttendeeRecord}. */
  public static final class Builder {
    private final long id;
    private final long companyId;
    private final String firstName;
    private String lastName;
    private String email;
    private String title;
    private String jobFunction;
    private String managementLevel;
    private RoleClass role;
    private AttendanceType attendanceType;
    private String linkedinUrl;
    private int gateFit;
    private int truckFit;
    private int combinedScore;

    private Builder(long id, long companyId, String firstName) {
      this.id = id;
      this.companyId = companyId;
      this.firstName = firstName;
    }

    public Builder lastName(String lastName) {
      this.lastName = lastName;
      return this;
    }

    public Builder email(String email) {
      this.email = email;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder jobFunction(String jobFunction) {
      this.jobFunction = jobFunction;
      return this;
    }

    public Builder managementLevel(String managementLevel) {
      this.managementLevel = managementLevel;
      return this;
    }

    public Builder role(RoleClass role) {
      this.role = role;
      return this;
    }

    public Builder attendanceType(AttendanceType attendanceType) {
      this.attendanceType = attendanceType;
      return this;
    }

    public Builder linkedinUrl(String linkedinUrl) {
      this.linkedinUrl = linkedinUrl;
      return this;
    }

    public Builder scores(int gateFit, int truckFit, int combinedScore) {
      this.gateFit = gateFit;
      this.truckFit = truckFit;
      this.combinedScore = combinedScore;
      return this;
    }

    public Builder scoresFrom(CompanyRecord company) {
      return scores(company.gateFit(), company.truckFit(), company.combinedScore());
    }

    public AttendeeRecord build() {
      return new AttendeeRecord(id, companyId, firstName, lastName, email, title, jobFunction,
          managementLevel, role, attendanceType, linkedinUrl, gateFit, truckFit, combinedScore);
    }
  }
}
