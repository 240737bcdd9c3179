package outreach;

import java.time.Duration;
import java.util.Objects;

public final class OutreachConfig {
  private int fitThreshold = 50;
  private int maxContactsPerCompany = 3;
  private int topTargetCount = 50;

  private Duration followUpDelay = Duration.ofDays(7);
  private int followUpBatchSize = 100;
  private Duration followUpSweepInterval = Duration.ofMinutes(15);
  private int signalBatchSize = 200;
  private Duration signalPollInterval = Duration.ofMinutes(1);

  private Duration generationTimeout = Duration.ofSeconds(30);
  private Duration deliveryTimeout = Duration.ofSeconds(15);
  private int composeConcurrency = 4;
  private int companyConcurrency = 2;

  private String trackingBcc;

  public int getFitThreshold() {
    return fitThreshold;
  }

  public OutreachConfig setFitThreshold(int fitThreshold) {
    if (fitThreshold < 0 || fitThreshold > 100) {
      throw new IllegalArgumentException("fitThreshold must be in [0, 100]");
    }
    this.fitThreshold = fitThreshold;
    return this;
  }

  public int getMaxContactsPerCompany() {
    return maxContactsPerCompany;
  }

  public OutreachConfig setMaxContactsPerCompany(int maxContactsPerCompany) {
    if (maxContactsPerCompany < 1) {
      throw new IllegalArgumentException("maxContactsPerCompany must be >= 1");
    }
    this.maxContactsPerCompany = maxContactsPerCompany;
    return this;
  }

  public int getTopTargetCount() {
    return topTargetCount;
  }

  public OutreachConfig setTopTargetCount(int topTargetCount) {
    if (topTargetCount < 0) {
      throw new IllegalArgumentException("topTargetCount must be >= 0");
    }
    this.topTargetCount = topTargetCount;
    return this;
  }

  public Duration getFollowUpDelay() {
    return followUpDelay;
  }

  public OutreachConfig setFollowUpDelay(Duration followUpDelay) {
    Objects.requireNonNull(followUpDelay, "followUpDelay");
    if (followUpDelay.isNegative()) {
      throw new IllegalArgumentException("followUpDelay must be >= 0");
    }
    this.followUpDelay = followUpDelay;
    return this;
  }

  public int getFollowUpBatchSize() {
    return followUpBatchSize;
  }

  public OutreachConfig setFollowUpBatchSize(int followUpBatchSize) {
    if (followUpBatchSize <= 0) {
      throw new IllegalArgumentException("followUpBatchSize must be > 0");
    }
    this.followUpBatchSize = followUpBatchSize;
    return this;
  }

  public Duration getFollowUpSweepInterval() {
    return followUpSweepInterval;
  }

  public OutreachConfig setFollowUpSweepInterval(Duration followUpSweepInterval) {
    this.followUpSweepInterval = requirePositive(followUpSweepInterval, "followUpSweepInterval");
    return this;
  }

  public int getSignalBatchSize() {
    return signalBatchSize;
  }

  public OutreachConfig setSignalBatchSize(int signalBatchSize) {
    if (signalBatchSize <= 0) {
      throw new IllegalArgumentException("signalBatchSize must be > 0");
    }
    this.signalBatchSize = signalBatchSize;
    return this;
  }

  public Duration getSignalPollInterval() {
    return signalPollInterval;
  }

  public OutreachConfig setSignalPollInterval(Duration signalPollInterval) {
    this.signalPollInterval = requirePositive(signalPollInterval, "signalPollInterval");
    return this;
  }

  public Duration getGenerationTimeout() {
    return generationTimeout;
  }

  public OutreachConfig setGenerationTimeout(Duration generationTimeout) {
    this.generationTimeout = requirePositive(generationTimeout, "generationTimeout");
    return this;
  }

  public Duration getDeliveryTimeout() {
    return deliveryTimeout;
  }

  public OutreachConfig setDeliveryTimeout(Duration deliveryTimeout) {
    this.deliveryTimeout = requirePositive(deliveryTimeout, "deliveryTimeout");
    return this;
  }

  public int getComposeConcurrency() {
    return composeConcurrency;
  }

  public OutreachConfig setComposeConcurrency(int composeConcurrency) {
    if (composeConcurrency <= 0) {
      throw new IllegalArgumentException("composeConcurrency must be > 0");
    }
    this.composeConcurrency = composeConcurrency;
    return this;
  }

  public int getCompanyConcurrency() {
    return companyConcurrency;
  }

  public OutreachConfig setCompanyConcurrency(int companyConcurrency) {
    if (companyConcurrency <= 0) {
      throw new IllegalArgumentException("companyConcurrency must be > 0");
    }
    this.companyConcurrency = companyConcurrency;
    return this;
  }

  /**
   * Fixed tracking address added as BCC to every send. Delivery is refused while unset.
   */
  public String getTrackingBcc() {
    return trackingBcc;
  }

  public OutreachConfig setTrackingBcc(String trackingBcc) {
    this.trackingBcc = trackingBcc;
    return this;
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
    return value;
  }
}
