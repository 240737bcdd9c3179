package outreach.spring.boot;

import outreach.OutreachEngine;
import outreach.jdbc.DataSourceConnectionProvider;
import outreach.jdbc.store.AbstractJdbcAttemptStore;
import outreach.jdbc.store.JdbcAttemptStores;
import outreach.jdbc.store.JdbcBudgetStore;
import outreach.jdbc.store.JdbcResearchStore;
import outreach.spi.BudgetStore;
import outreach.spi.ConnectionProvider;
import outreach.spi.DeliveryService;
import outreach.spi.GenerationService;
import outreach.spi.MetricsExporter;
import outreach.spi.ResearchStore;
import outreach.spi.SignalFeed;
import outreach.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the outreach engine.
 *
 * <p>Wires the JDBC attempt, budget and research stores from a {@link DataSource}, and an
 * {@link OutreachEngine} once a {@link DeliveryService} bean exists. The attempt store
 * dialect is detected from the JDBC URL.
 *
 * @see OutreachProperties
 * @see OutreachLangChainAutoConfiguration
 * @see OutreachMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(OutreachEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(OutreachProperties.class)
public class OutreachAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JsonCodec outreachJsonCodec() {
    return JsonCodec.getDefault();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcAttemptStore attemptStore(DataSource dataSource, OutreachProperties props,
      JsonCodec jsonCodec) {
    AbstractJdbcAttemptStore detected = JdbcAttemptStores.detect(dataSource, jsonCodec);
    String tableName = props.getTables().getAttempt();
    if (!AbstractJdbcAttemptStore.DEFAULT_TABLE.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(BudgetStore.class)
  public JdbcBudgetStore budgetStore(OutreachProperties props, JsonCodec jsonCodec) {
    return new JdbcBudgetStore(props.getTables().getBudget(), jsonCodec);
  }

  @Bean
  @ConditionalOnMissingBean(ResearchStore.class)
  public JdbcResearchStore researchStore(ConnectionProvider connectionProvider,
      OutreachProperties props, JsonCodec jsonCodec) {
    return new JdbcResearchStore(connectionProvider, props.getTables().getCompany(),
        props.getTables().getAttendee(), jsonCodec);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(DeliveryService.class)
  public OutreachEngine outreachEngine(OutreachProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcAttemptStore attemptStore,
      BudgetStore budgetStore,
      ResearchStore researchStore,
      DeliveryService deliveryService,
      ObjectProvider<GenerationService> generationProvider,
      ObjectProvider<SignalFeed> signalFeedProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    GenerationService generationService = generationProvider.getIfAvailable();
    if (generationService == null) {
      throw new IllegalStateException(
          "No GenerationService bean: define one or a LangChain4j ChatModel bean");
    }
    var builder = OutreachEngine.builder()
        .connectionProvider(connectionProvider)
        .attemptStore(attemptStore)
        .budgetStore(budgetStore)
        .researchStore(researchStore)
        .generationService(generationService)
        .deliveryService(deliveryService)
        .config(props.toConfig());
    SignalFeed signalFeed = signalFeedProvider.getIfAvailable();
    if (signalFeed != null) {
      builder.signalFeed(signalFeed);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    OutreachEngine engine = builder.build();
    if (props.isAutoStart()) {
      engine.start();
    }
    return engine;
  }
}
