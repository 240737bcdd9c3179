package outreach.spring.boot;

import outreach.OutreachConfig;
import outreach.jdbc.store.AbstractJdbcAttemptStore;
import outreach.jdbc.store.JdbcBudgetStore;
import outreach.jdbc.store.JdbcResearchStore;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the outreach engine, bound under {@code outreach.*}.
 *
 * @see OutreachAutoConfiguration
 */
@ConfigurationProperties(prefix = "outreach")
public class OutreachProperties {

  /**
   * Address added as BCC to every send. Required; the engine refuses to start without it.
   */
  private String trackingBcc;

  /**
   * Start the follow-up sweep and signal poller when the engine bean is created.
   */
  private boolean autoStart = true;

  private final Tables tables = new Tables();
  private final Classification classification = new Classification();
  private final Generation generation = new Generation();
  private final Delivery delivery = new Delivery();
  private final Wave wave = new Wave();
  private final FollowUp followUp = new FollowUp();
  private final Signal signal = new Signal();
  private final Metrics metrics = new Metrics();

  public String getTrackingBcc() {
    return trackingBcc;
  }

  public void setTrackingBcc(String trackingBcc) {
    this.trackingBcc = trackingBcc;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public Tables getTables() {
    return tables;
  }

  public Classification getClassification() {
    return classification;
  }

  public Generation getGeneration() {
    return generation;
  }

  public Delivery getDelivery() {
    return delivery;
  }

  public Wave getWave() {
    return wave;
  }

  public FollowUp getFollowUp() {
    return followUp;
  }

  public Signal getSignal() {
    return signal;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /** Maps the bound values onto an engine configuration. Setter validation applies. */
  public OutreachConfig toConfig() {
    return new OutreachConfig()
        .setTrackingBcc(trackingBcc)
        .setFitThreshold(classification.getFitThreshold())
        .setMaxContactsPerCompany(classification.getMaxContactsPerCompany())
        .setTopTargetCount(classification.getTopTargetCount())
        .setGenerationTimeout(generation.getTimeout())
        .setComposeConcurrency(generation.getConcurrency())
        .setDeliveryTimeout(delivery.getTimeout())
        .setCompanyConcurrency(wave.getCompanyConcurrency())
        .setFollowUpDelay(followUp.getDelay())
        .setFollowUpBatchSize(followUp.getBatchSize())
        .setFollowUpSweepInterval(followUp.getSweepInterval())
        .setSignalBatchSize(signal.getBatchSize())
        .setSignalPollInterval(signal.getPollInterval());
  }

  public static class Tables {
    private String attempt = AbstractJdbcAttemptStore.DEFAULT_TABLE;
    private String budget = JdbcBudgetStore.DEFAULT_TABLE;
    private String company = JdbcResearchStore.DEFAULT_COMPANY_TABLE;
    private String attendee = JdbcResearchStore.DEFAULT_ATTENDEE_TABLE;

    public String getAttempt() {
      return attempt;
    }

    public void setAttempt(String attempt) {
      this.attempt = attempt;
    }

    public String getBudget() {
      return budget;
    }

    public void setBudget(String budget) {
      this.budget = budget;
    }

    public String getCompany() {
      return company;
    }

    public void setCompany(String company) {
      this.company = company;
    }

    public String getAttendee() {
      return attendee;
    }

    public void setAttendee(String attendee) {
      this.attendee = attendee;
    }
  }

  public static class Classification {
    /**
     * Minimum product-line score, inclusive, for a company to count as a fit.
     */
    private int fitThreshold = 50;
    private int maxContactsPerCompany = 3;
    /**
     * Number of companies, by combined score, whose attendees get the top-tier treatment.
     */
    private int topTargetCount = 50;

    public int getFitThreshold() {
      return fitThreshold;
    }

    public void setFitThreshold(int fitThreshold) {
      this.fitThreshold = fitThreshold;
    }

    public int getMaxContactsPerCompany() {
      return maxContactsPerCompany;
    }

    public void setMaxContactsPerCompany(int maxContactsPerCompany) {
      this.maxContactsPerCompany = maxContactsPerCompany;
    }

    public int getTopTargetCount() {
      return topTargetCount;
    }

    public void setTopTargetCount(int topTargetCount) {
      this.topTargetCount = topTargetCount;
    }
  }

  public static class Generation {
    private Duration timeout = Duration.ofSeconds(30);
    private int concurrency = 4;
    /**
     * Sampling temperature for first drafts when generation goes through LangChain4j.
     */
    private double temperature = 0.7;

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }
  }

  public static class Delivery {
    private Duration timeout = Duration.ofSeconds(15);

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }

  public static class Wave {
    private int companyConcurrency = 2;

    public int getCompanyConcurrency() {
      return companyConcurrency;
    }

    public void setCompanyConcurrency(int companyConcurrency) {
      this.companyConcurrency = companyConcurrency;
    }
  }

  public static class FollowUp {
    private Duration delay = Duration.ofDays(7);
    private int batchSize = 100;
    private Duration sweepInterval = Duration.ofMinutes(15);

    public Duration getDelay() {
      return delay;
    }

    public void setDelay(Duration delay) {
      this.delay = delay;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }
  }

  public static class Signal {
    private int batchSize = 200;
    private Duration pollInterval = Duration.ofMinutes(1);

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }
  }

  public static class Metrics {
    /**
     * Register a Micrometer exporter when Micrometer is on the classpath.
     */
    private boolean enabled = true;
    private String namePrefix = "outreach";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
